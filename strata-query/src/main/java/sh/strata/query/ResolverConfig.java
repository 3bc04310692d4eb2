// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

/**
 * Bounds applied by {@link BlockResolver}.
 *
 * <ul>
 * <li>{@code maxTraverseDepth} - how many parent hops a number lookup may take behind
 * head before giving up with {@link sh.strata.core.error.TraversalDepthExceededException}
 * (default: 100)</li>
 * <li>{@code finalityDepth} - how many blocks must be built on top of a block before it
 * is treated as finalized (default: 100)</li>
 * </ul>
 *
 * <p>
 * The two values are independent. A deployment that trusts a shorter finality window can
 * lower {@code finalityDepth} without widening the traversal bound.
 *
 * <pre>{@code
 * ResolverConfig config = ResolverConfig.builder()
 *         .maxTraverseDepth(250)
 *         .finalityDepth(10)
 *         .build();
 * }</pre>
 *
 * @param maxTraverseDepth maximum parent hops per number lookup (must be &gt;= 0)
 * @param finalityDepth    confirmations that must be exceeded for finality (must be &gt;= 0)
 * @since 0.1.0
 */
public record ResolverConfig(long maxTraverseDepth, long finalityDepth) {

    /** Default traversal bound: 100 hops. */
    public static final long DEFAULT_MAX_TRAVERSE_DEPTH = 100;

    /** Default finality depth: 100 blocks. */
    public static final long DEFAULT_FINALITY_DEPTH = 100;

    public ResolverConfig {
        if (maxTraverseDepth < 0) {
            throw new IllegalArgumentException("maxTraverseDepth must be >= 0, got: " + maxTraverseDepth);
        }
        if (finalityDepth < 0) {
            throw new IllegalArgumentException("finalityDepth must be >= 0, got: " + finalityDepth);
        }
    }

    public static ResolverConfig defaults() {
        return new ResolverConfig(DEFAULT_MAX_TRAVERSE_DEPTH, DEFAULT_FINALITY_DEPTH);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ResolverConfig}; unset values keep their defaults.
     */
    public static final class Builder {
        private long maxTraverseDepth = DEFAULT_MAX_TRAVERSE_DEPTH;
        private long finalityDepth = DEFAULT_FINALITY_DEPTH;

        private Builder() {}

        public Builder maxTraverseDepth(long maxTraverseDepth) {
            this.maxTraverseDepth = maxTraverseDepth;
            return this;
        }

        public Builder finalityDepth(long finalityDepth) {
            this.finalityDepth = finalityDepth;
            return this;
        }

        /**
         * Builds the config.
         *
         * @return the config
         * @throws IllegalArgumentException if a value is negative
         */
        public ResolverConfig build() {
            return new ResolverConfig(maxTraverseDepth, finalityDepth);
        }
    }
}
