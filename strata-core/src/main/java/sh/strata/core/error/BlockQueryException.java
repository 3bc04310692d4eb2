// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

/**
 * Failure of a block query. Each subtype is one distinct, inspectable outcome;
 * none of them carries a partial result.
 *
 * @since 0.1.0
 */
public abstract sealed class BlockQueryException extends StrataException
        permits ChainConnectionException,
        BlockNotFoundException,
        TraversalDepthExceededException,
        InvalidBlockHashException,
        QueryCancelledException {

    protected BlockQueryException(final String message) {
        super(message);
    }

    protected BlockQueryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
