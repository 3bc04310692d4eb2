// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;

import sh.strata.core.crypto.Hasher;
import sh.strata.core.model.BlockRecord;
import sh.strata.core.model.DetailedBlockRecord;
import sh.strata.query.cache.BlockCache;

/**
 * Resolves blocks by number or hash against a {@link ChainClient}, optionally backed by a
 * {@link BlockCache}.
 *
 * <p>
 * A lookup by number walks parent hashes back from the current head, so it only reaches
 * blocks within {@link ResolverConfig#maxTraverseDepth()} of head. Older blocks must be
 * looked up by hash.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * BlockResolver resolver = BlockResolver.builder(client)
 *         .cache(new BlockCache(CacheConfig.defaults()))
 *         .build();
 *
 * BlockRecord block = resolver.getBlockByNumber(12_345_678);
 * }</pre>
 *
 * <p>
 * Every failure is a {@link sh.strata.core.error.BlockQueryException}; no partial record
 * is ever returned.
 *
 * @since 0.1.0
 */
public interface BlockResolver {

    /**
     * Resolves a block by number.
     *
     * @param number the block number
     * @return the block summary
     * @throws sh.strata.core.error.BlockNotFoundException          if the number is above head
     *                                                              or the ancestry is inconsistent
     * @throws sh.strata.core.error.TraversalDepthExceededException if the block is too far behind head
     * @throws sh.strata.core.error.ChainConnectionException        if a chain client call fails
     */
    default BlockRecord getBlockByNumber(long number) {
        return getBlockByNumber(number, CancellationSignal.none());
    }

    BlockRecord getBlockByNumber(long number, CancellationSignal signal);

    /**
     * Resolves a block by hash, given as hex with or without {@code 0x}.
     *
     * @param hash the block hash
     * @return the block summary
     * @throws sh.strata.core.error.InvalidBlockHashException if {@code hash} is not 32 bytes of hex
     * @throws sh.strata.core.error.BlockNotFoundException    if the client does not know the hash
     * @throws sh.strata.core.error.ChainConnectionException  if a chain client call fails
     */
    default BlockRecord getBlockByHash(String hash) {
        return getBlockByHash(hash, CancellationSignal.none());
    }

    BlockRecord getBlockByHash(String hash, CancellationSignal signal);

    /**
     * Resolves a block by number with its full extrinsic and event lists. Same bounds and
     * errors as {@link #getBlockByNumber(long)}; the cache is never consulted.
     *
     * @param number the block number
     * @return the detailed record
     */
    default DetailedBlockRecord getDetailedBlock(long number) {
        return getDetailedBlock(number, CancellationSignal.none());
    }

    DetailedBlockRecord getDetailedBlock(long number, CancellationSignal signal);

    static Builder builder(ChainClient client) {
        return new Builder(client);
    }

    /**
     * Builder for the default resolver.
     *
     * <p>
     * Either pass a ready {@link BlockRecordBuilder}, or let the resolver build one from
     * the hasher, clock, executor and the config's finality depth.
     */
    final class Builder {
        private final ChainClient client;
        private @Nullable BlockCache cache;
        private ResolverConfig config = ResolverConfig.defaults();
        private @Nullable BlockRecordBuilder recordBuilder;
        private @Nullable Hasher hasher;
        private @Nullable TimestampExtractor timestampExtractor;
        private @Nullable Clock clock;
        private @Nullable Executor executor;

        private Builder(ChainClient client) {
            this.client = Objects.requireNonNull(client, "client");
        }

        /**
         * Sets the cache consulted before and filled after each lookup.
         *
         * @param cache the cache, or {@code null} for none
         * @return this builder
         */
        public Builder cache(@Nullable BlockCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder config(ResolverConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder recordBuilder(BlockRecordBuilder recordBuilder) {
            this.recordBuilder = Objects.requireNonNull(recordBuilder, "recordBuilder");
            return this;
        }

        public Builder hasher(Hasher hasher) {
            this.hasher = Objects.requireNonNull(hasher, "hasher");
            return this;
        }

        public Builder timestampExtractor(TimestampExtractor timestampExtractor) {
            this.timestampExtractor = Objects.requireNonNull(timestampExtractor, "timestampExtractor");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the executor for parallel event enumeration in detailed lookups.
         *
         * @param executor the executor
         * @return this builder
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public BlockResolver build() {
            BlockRecordBuilder records = recordBuilder;
            if (records == null) {
                BlockRecordBuilder.Builder b = BlockRecordBuilder.builder(client)
                        .finality(new DepthFinalityHeuristic(config.finalityDepth()))
                        .executor(executor);
                if (hasher != null) {
                    b.hasher(hasher);
                }
                if (timestampExtractor != null) {
                    b.timestampExtractor(timestampExtractor);
                }
                if (clock != null) {
                    b.clock(clock);
                }
                records = b.build();
            }
            return new DefaultBlockResolver(client, cache, config, records);
        }
    }
}
