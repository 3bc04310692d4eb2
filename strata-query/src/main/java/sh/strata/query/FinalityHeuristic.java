// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

/**
 * Decides whether a block should be treated as final relative to the observed head.
 *
 * <p>
 * This is a caching hint, not a consensus guarantee. Implementations must be pure.
 */
@FunctionalInterface
public interface FinalityHeuristic {

    boolean isFinalized(long blockNumber, long headNumber);

    static FinalityHeuristic depth(long finalityDepth) {
        return new DepthFinalityHeuristic(finalityDepth);
    }
}
