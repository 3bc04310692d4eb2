// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

/**
 * Base runtime exception for all Strata failures.
 *
 * <p>
 * This sealed class forms the root of Strata's exception hierarchy, so callers can
 * catch every library failure with a single clause while still matching on the
 * concrete outcome.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * StrataException
 * ├── {@link BlockQueryException} - block lookups by number or hash
 * │   ├── {@link ChainConnectionException} - chain client call failed
 * │   ├── {@link BlockNotFoundException} - future block, unknown hash, broken ancestry
 * │   ├── {@link TraversalDepthExceededException} - number too far behind head
 * │   ├── {@link InvalidBlockHashException} - malformed hash input
 * │   └── {@link QueryCancelledException} - caller cancelled or deadline passed
 * └── {@link RecordEncodingException} - block record JSON encoding/decoding
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     resolver.getBlockByNumber(n);
 * } catch (TraversalDepthExceededException e) {
 *     // Too old for traversal, look it up by hash instead
 * } catch (ChainConnectionException e) {
 *     // Node unreachable
 * } catch (StrataException e) {
 *     // Anything else
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class StrataException extends RuntimeException
        permits BlockQueryException,
        RecordEncodingException {

    public StrataException(final String message) {
        super(message);
    }

    public StrataException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
