// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

/**
 * Thrown when a block record cannot be written to or read from its JSON form.
 */
public final class RecordEncodingException extends StrataException {

    public RecordEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
