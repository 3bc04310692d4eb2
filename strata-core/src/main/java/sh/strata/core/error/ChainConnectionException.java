// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a call to the chain client fails: the head fetch, a parent hop during
 * traversal, a direct block fetch, or extrinsic/event enumeration.
 *
 * <p>
 * This layer never retries; the original client failure is kept as the cause.
 * During traversal, {@link #targetNumber()} names the block that could not be reached.
 */
public final class ChainConnectionException extends BlockQueryException {

    private final @Nullable Long targetNumber;

    public ChainConnectionException(final String message, final Throwable cause) {
        this(message, null, cause);
    }

    public ChainConnectionException(
            final String message, final @Nullable Long targetNumber, final @Nullable Throwable cause) {
        super(message, cause);
        this.targetNumber = targetNumber;
    }

    /**
     * Returns the block number the failed call was trying to reach, if known.
     *
     * @return the target number, or {@code null} when the call was not part of a traversal
     */
    public @Nullable Long targetNumber() {
        return targetNumber;
    }
}
