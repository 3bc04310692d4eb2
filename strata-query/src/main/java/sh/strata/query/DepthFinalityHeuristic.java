// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

/**
 * Treats a block as final once more than {@code finalityDepth} blocks sit on top of it.
 *
 * <p>
 * The distance saturates at zero, so a block ahead of a stale head is never final.
 *
 * @param finalityDepth number of confirmations that must be exceeded (must be &gt;= 0)
 */
public record DepthFinalityHeuristic(long finalityDepth) implements FinalityHeuristic {

    public DepthFinalityHeuristic {
        if (finalityDepth < 0) {
            throw new IllegalArgumentException("finalityDepth must be >= 0, got: " + finalityDepth);
        }
    }

    @Override
    public boolean isFinalized(long blockNumber, long headNumber) {
        long distance = headNumber > blockNumber ? headNumber - blockNumber : 0L;
        return distance > finalityDepth;
    }
}
