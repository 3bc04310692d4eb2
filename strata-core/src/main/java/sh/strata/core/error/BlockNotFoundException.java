// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

/**
 * Thrown when the requested block does not exist from the client's point of view.
 *
 * <p>
 * The {@link Reason} tells the cases apart:
 * <ul>
 * <li>{@link Reason#FUTURE_BLOCK}: the number is above the current head</li>
 * <li>{@link Reason#UNKNOWN_HASH}: the client has no block with that hash</li>
 * <li>{@link Reason#ANCESTRY_MISMATCH}: walking parent hashes from head never reached the
 * number, so the client reported inconsistent ancestry</li>
 * </ul>
 */
public final class BlockNotFoundException extends BlockQueryException {

    /** Why the block could not be produced. */
    public enum Reason {
        FUTURE_BLOCK,
        UNKNOWN_HASH,
        ANCESTRY_MISMATCH
    }

    private final Reason reason;

    public BlockNotFoundException(final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public static BlockNotFoundException futureBlock(final long requested, final long head) {
        return new BlockNotFoundException(
                Reason.FUTURE_BLOCK, "Block " + requested + " not found (latest: " + head + ")");
    }

    public static BlockNotFoundException unknownHash(final String hash) {
        return new BlockNotFoundException(Reason.UNKNOWN_HASH, "No block with hash " + hash);
    }

    public static BlockNotFoundException ancestryMismatch(final long requested, final long head, final long hops) {
        return new BlockNotFoundException(
                Reason.ANCESTRY_MISMATCH,
                "Block " + requested + " not reached after " + hops + " parent hops from head " + head
                        + "; chain client reported inconsistent ancestry");
    }
}
