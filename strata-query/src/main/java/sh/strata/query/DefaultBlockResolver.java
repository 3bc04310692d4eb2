// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.strata.core.DebugLogger;
import sh.strata.core.error.BlockNotFoundException;
import sh.strata.core.error.ChainConnectionException;
import sh.strata.core.error.InvalidBlockHashException;
import sh.strata.core.error.QueryCancelledException;
import sh.strata.core.error.TraversalDepthExceededException;
import sh.strata.core.model.BlockRecord;
import sh.strata.core.model.DetailedBlockRecord;
import sh.strata.core.types.Hash;
import sh.strata.query.cache.BlockCache;

/**
 * Default {@link BlockResolver}: bounded sequential parent traversal from head, with
 * read-through caching of summaries.
 *
 * <p>
 * Thread-safe as long as the {@link ChainClient} is; the resolver itself holds no
 * mutable state beyond the shared cache.
 */
final class DefaultBlockResolver implements BlockResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultBlockResolver.class);

    private final ChainClient client;
    private final @Nullable BlockCache cache;
    private final ResolverConfig config;
    private final BlockRecordBuilder records;

    DefaultBlockResolver(
            ChainClient client, @Nullable BlockCache cache, ResolverConfig config, BlockRecordBuilder records) {
        this.client = Objects.requireNonNull(client, "client");
        this.cache = cache;
        this.config = Objects.requireNonNull(config, "config");
        this.records = Objects.requireNonNull(records, "records");
    }

    @Override
    public BlockRecord getBlockByNumber(long number, CancellationSignal signal) {
        requireNonNegative(number);
        Objects.requireNonNull(signal, "signal");
        log.debug("getBlockByNumber({})", number);

        if (cache != null) {
            Optional<BlockRecord> cached = cache.getBlockByNumber(number);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        Located located = locate(number, signal);
        BlockRecord record = records.build(located.block(), located.headNumber());
        store(record);
        return record;
    }

    @Override
    public BlockRecord getBlockByHash(String hash, CancellationSignal signal) {
        Objects.requireNonNull(signal, "signal");
        final Hash parsed;
        try {
            parsed = Hash.parse(hash);
        } catch (IllegalArgumentException e) {
            throw new InvalidBlockHashException(hash, e);
        }
        log.debug("getBlockByHash({})", parsed);

        if (cache != null) {
            Optional<BlockRecord> cached = cache.getBlockByHash(parsed);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        checkCancelled(signal, "before fetching block " + parsed);
        final Optional<BlockHandle> block;
        try {
            block = client.blockAt(parsed);
        } catch (RuntimeException e) {
            throw new ChainConnectionException("Failed to fetch block " + parsed, e);
        }
        if (block.isEmpty()) {
            throw BlockNotFoundException.unknownHash(parsed.value());
        }

        checkCancelled(signal, "before fetching head");
        BlockHandle head = fetchHead();
        BlockRecord record = records.build(block.get(), head.number());
        store(record);
        return record;
    }

    @Override
    public DetailedBlockRecord getDetailedBlock(long number, CancellationSignal signal) {
        requireNonNegative(number);
        Objects.requireNonNull(signal, "signal");
        log.debug("getDetailedBlock({})", number);

        Located located = locate(number, signal);
        DetailedBlockRecord detailed = records.buildDetailed(located.block(), located.headNumber());
        store(detailed.basic());
        return detailed;
    }

    private Located locate(long number, CancellationSignal signal) {
        checkCancelled(signal, "before fetching head");
        BlockHandle head = fetchHead();
        long headNumber = head.number();

        if (number > headNumber) {
            throw BlockNotFoundException.futureBlock(number, headNumber);
        }
        if (number == headNumber) {
            return new Located(head, headNumber);
        }

        long depth = headNumber - number;
        if (depth > config.maxTraverseDepth()) {
            throw new TraversalDepthExceededException(number, headNumber, config.maxTraverseDepth());
        }

        BlockHandle current = head;
        long hops = 0;
        while (hops < depth) {
            long target = current.number() - 1;
            checkCancelled(signal, "at block " + current.number() + " after " + hops + " hops");

            final Optional<BlockHandle> parent;
            try {
                parent = client.blockAt(current.parentHash());
            } catch (RuntimeException e) {
                throw new ChainConnectionException(
                        "Failed to fetch block " + target + " (parent of " + current.number() + ")", target, e);
            }
            hops++;
            if (parent.isEmpty()) {
                throw new ChainConnectionException(
                        "Chain client returned no block for parent hash " + current.parentHash()
                                + " of block " + current.number(),
                        target, null);
            }

            current = parent.get();
            DebugLogger.logTraversal("[TRAVERSE] hop=%d block=%d hash=%s", hops, current.number(), current.hash());
            if (current.number() == number) {
                return new Located(current, headNumber);
            }
            if (current.number() < number) {
                break;
            }
        }
        throw BlockNotFoundException.ancestryMismatch(number, headNumber, hops);
    }

    private BlockHandle fetchHead() {
        try {
            return client.head();
        } catch (RuntimeException e) {
            throw new ChainConnectionException("Failed to fetch head block", e);
        }
    }

    private void store(BlockRecord record) {
        if (cache != null) {
            cache.putBlock(record);
        }
    }

    private static void checkCancelled(CancellationSignal signal, String where) {
        if (signal.isCancelled()) {
            throw new QueryCancelledException("Block query cancelled " + where);
        }
    }

    private static void requireNonNegative(long number) {
        if (number < 0) {
            throw new IllegalArgumentException("block number must be non-negative, got: " + number);
        }
    }

    private record Located(BlockHandle block, long headNumber) {}
}
