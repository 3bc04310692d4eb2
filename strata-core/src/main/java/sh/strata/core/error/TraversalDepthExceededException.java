// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.error;

/**
 * Thrown when a block number lies further behind head than the resolver is allowed to
 * walk. No traversal is attempted; look the block up by hash instead.
 */
public final class TraversalDepthExceededException extends BlockQueryException {

    private final long requestedNumber;
    private final long headNumber;
    private final long maxDepth;

    public TraversalDepthExceededException(final long requestedNumber, final long headNumber, final long maxDepth) {
        super("Block " + requestedNumber + " is too far from current height " + headNumber
                + " (depth " + (headNumber - requestedNumber) + " > " + maxDepth
                + "). Consider using getBlockByHash if the hash is known.");
        this.requestedNumber = requestedNumber;
        this.headNumber = headNumber;
        this.maxDepth = maxDepth;
    }

    public long requestedNumber() {
        return requestedNumber;
    }

    public long headNumber() {
        return headNumber;
    }

    public long depth() {
        return headNumber - requestedNumber;
    }

    public long maxDepth() {
        return maxDepth;
    }
}
