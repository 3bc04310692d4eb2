// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

/**
 * Thrown when a query observes its cancellation signal before issuing the next chain
 * client call. Hops already completed are discarded.
 */
public final class QueryCancelledException extends BlockQueryException {

    public QueryCancelledException(final String message) {
        super(message);
    }
}
