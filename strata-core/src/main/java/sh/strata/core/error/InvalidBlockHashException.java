// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

/**
 * Thrown when a block hash argument is not 32 bytes of hex.
 */
public final class InvalidBlockHashException extends BlockQueryException {

    private final String input;

    public InvalidBlockHashException(final String input, final Throwable cause) {
        super("Invalid block hash: " + input, cause);
        this.input = String.valueOf(input);
    }

    /**
     * Returns the rejected input as given by the caller.
     *
     * @return the raw input, possibly {@code "null"}
     */
    public String input() {
        return input;
    }
}
