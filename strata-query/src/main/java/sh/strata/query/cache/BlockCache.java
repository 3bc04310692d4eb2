// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query.cache;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.strata.core.DebugLogger;
import sh.strata.core.model.BlockRecord;
import sh.strata.core.types.Hash;

/**
 * Bounded in-memory store of {@link BlockRecord}s, addressable by block number and by
 * block hash.
 *
 * <p>
 * Both keys of a record point at one shared entry, so they always agree on content and
 * expire together. Finalized records live for {@link CacheConfig#blockTtlFinalized()},
 * all others for {@link CacheConfig#blockTtlRecent()}. Expiry is lazy: an entry past its
 * lifetime is dropped from both indices by the lookup that finds it.
 *
 * <p>
 * When a new record would push the cache past {@link CacheConfig#maxEntries()}, expired
 * entries are purged first and then the oldest entries by insertion order, inside the
 * same {@link #putBlock(BlockRecord)} call.
 *
 * <p>
 * <strong>Thread Safety:</strong> a single {@link ReentrantLock} guards both indices,
 * so a reader never observes a record under one key but not the other.
 *
 * @since 0.1.0
 */
public final class BlockCache {

    private static final Logger log = LoggerFactory.getLogger(BlockCache.class);

    private final CacheConfig config;
    private final BlockCacheMetrics metrics;
    private final LongSupplier nanoTime;
    private final long finalizedTtlNanos;
    private final long recentTtlNanos;

    private final ReentrantLock lock = new ReentrantLock();
    // insertion order doubles as eviction order
    private final LinkedHashMap<Long, CacheEntry> byNumber = new LinkedHashMap<>();
    private final Map<Hash, CacheEntry> byHash = new HashMap<>();

    public BlockCache(CacheConfig config) {
        this(config, BlockCacheMetrics.noop());
    }

    public BlockCache(CacheConfig config, BlockCacheMetrics metrics) {
        this(config, metrics, System::nanoTime);
    }

    BlockCache(CacheConfig config, BlockCacheMetrics metrics, LongSupplier nanoTime) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.finalizedTtlNanos = saturatedNanos(config.blockTtlFinalized());
        this.recentTtlNanos = saturatedNanos(config.blockTtlRecent());
    }

    /**
     * Stores a record under its number and its hash.
     *
     * <p>
     * Any entry already cached for the same number or the same hash is replaced, and
     * the keys of the replaced entries are removed from both indices.
     *
     * @param record the record to cache
     */
    public void putBlock(BlockRecord record) {
        Objects.requireNonNull(record, "record");
        long ttl = record.finalized() ? finalizedTtlNanos : recentTtlNanos;

        lock.lock();
        try {
            long now = nanoTime.getAsLong();
            removeEntry(byNumber.get(record.number()));
            removeEntry(byHash.get(record.hash()));

            if (byNumber.size() >= config.maxEntries()) {
                makeRoom(now);
            }

            CacheEntry entry = new CacheEntry(record, now, ttl);
            byNumber.put(record.number(), entry);
            byHash.put(record.hash(), entry);
        } finally {
            lock.unlock();
        }
        DebugLogger.logCache("[CACHE] put block=%d hash=%s finalized=%s", record.number(), record.hash(),
                record.finalized());
    }

    /**
     * Looks up a record by block number.
     *
     * @param number the block number
     * @return the live record, or empty if absent or expired
     */
    public Optional<BlockRecord> getBlockByNumber(long number) {
        lock.lock();
        try {
            return live(byNumber.get(number));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Looks up a record by block hash.
     *
     * @param hash the block hash
     * @return the live record, or empty if absent or expired
     */
    public Optional<BlockRecord> getBlockByHash(Hash hash) {
        Objects.requireNonNull(hash, "hash");
        lock.lock();
        try {
            return live(byHash.get(hash));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Looks up a record by a hex hash string, with or without {@code 0x}, in any case.
     *
     * <p>
     * A string that is not a 32-byte hex hash cannot be a key and reads as a miss.
     *
     * @param hash the block hash as hex
     * @return the live record, or empty if absent, expired, or not a valid hash
     */
    public Optional<BlockRecord> getBlockByHash(String hash) {
        final Hash parsed;
        try {
            parsed = Hash.parse(hash);
        } catch (IllegalArgumentException e) {
            log.debug("Cache lookup with malformed hash '{}'", hash);
            metrics.onMiss();
            return Optional.empty();
        }
        return getBlockByHash(parsed);
    }

    /**
     * Removes every entry from both indices.
     */
    public void clear() {
        lock.lock();
        try {
            byNumber.clear();
            byHash.clear();
        } finally {
            lock.unlock();
        }
        DebugLogger.logCache("[CACHE] cleared");
    }

    /**
     * Returns the number of cached records, including expired ones not yet purged.
     *
     * @return the record count
     */
    public int size() {
        lock.lock();
        try {
            return byNumber.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheConfig config() {
        return config;
    }

    private Optional<BlockRecord> live(@Nullable CacheEntry entry) {
        if (entry == null) {
            metrics.onMiss();
            return Optional.empty();
        }
        if (entry.isExpired(nanoTime.getAsLong())) {
            removeEntry(entry);
            metrics.onExpired(entry.record().number());
            metrics.onMiss();
            DebugLogger.logCache("[CACHE] expired block=%d", entry.record().number());
            return Optional.empty();
        }
        metrics.onHit();
        return Optional.of(entry.record());
    }

    private void makeRoom(long now) {
        Iterator<CacheEntry> it = byNumber.values().iterator();
        while (it.hasNext()) {
            CacheEntry entry = it.next();
            if (entry.isExpired(now)) {
                it.remove();
                byHash.remove(entry.record().hash());
                metrics.onExpired(entry.record().number());
            }
        }

        it = byNumber.values().iterator();
        while (byNumber.size() >= config.maxEntries() && it.hasNext()) {
            CacheEntry oldest = it.next();
            it.remove();
            byHash.remove(oldest.record().hash());
            metrics.onEviction(oldest.record().number());
            DebugLogger.logCache("[CACHE] evicted block=%d", oldest.record().number());
        }
    }

    // lifetimes beyond ~292 years read as "never expires"
    private static long saturatedNanos(Duration ttl) {
        try {
            return ttl.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void removeEntry(@Nullable CacheEntry entry) {
        if (entry == null) {
            return;
        }
        // only drop a key that still points at this entry
        byNumber.remove(entry.record().number(), entry);
        byHash.remove(entry.record().hash(), entry);
    }
}
