// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.benchmark;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;

import sh.strata.core.model.BlockRecord;
import sh.strata.core.types.Hash;
import sh.strata.query.cache.BlockCache;
import sh.strata.query.cache.CacheConfig;

/**
 * JMH benchmark for {@link BlockCache} throughput.
 *
 * <ul>
 *   <li>{@code putFinalized} / {@code putRecent} - inserts into a full cache, so every
 *       call pays for eviction</li>
 *   <li>{@code hitByNumber} / {@code hitByHash} - lookups of cached records</li>
 *   <li>{@code hitByHexString} - lookup through hash string parsing</li>
 *   <li>{@code miss} - lookup of a number never inserted</li>
 * </ul>
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
public class BlockCacheBenchmark {

    @Param({ "100", "500", "1000", "5000" })
    private int entries;

    private BlockCache cache;
    private BlockRecord[] finalizedRecords;
    private BlockRecord[] recentRecords;
    private String[] hexHashes;
    private int cursor;

    @Setup
    public void setup() {
        cache = new BlockCache(CacheConfig.defaults().withMaxEntries(entries));
        finalizedRecords = new BlockRecord[entries * 2];
        recentRecords = new BlockRecord[entries * 2];
        hexHashes = new String[entries];
        for (int i = 0; i < entries * 2; i++) {
            finalizedRecords[i] = record(i, true);
            recentRecords[i] = record(entries * 4L + i, false);
        }
        for (int i = 0; i < entries; i++) {
            cache.putBlock(finalizedRecords[i]);
            hexHashes[i] = finalizedRecords[i].hash().value().substring(2);
        }
    }

    private static BlockRecord record(long number, boolean finalized) {
        return new BlockRecord(number, hashOf(number, 0x01), hashOf(number - 1, 0x01), 1704067200 + number * 6,
                List.of(hashOf(number, 0x02), hashOf(number, 0x03)), null, null, 2, 4, finalized);
    }

    private static Hash hashOf(long number, int tag) {
        ByteBuffer buf = ByteBuffer.allocate(32);
        buf.put((byte) tag);
        buf.position(24);
        buf.putLong(number);
        return Hash.fromBytes(buf.array());
    }

    private int next(int bound) {
        cursor = cursor + 1 == bound ? 0 : cursor + 1;
        return cursor;
    }

    @Benchmark
    public void putFinalized() {
        cache.putBlock(finalizedRecords[next(finalizedRecords.length)]);
    }

    @Benchmark
    public void putRecent() {
        cache.putBlock(recentRecords[next(recentRecords.length)]);
    }

    @Benchmark
    public Optional<BlockRecord> hitByNumber() {
        return cache.getBlockByNumber(next(entries));
    }

    @Benchmark
    public Optional<BlockRecord> hitByHash() {
        return cache.getBlockByHash(finalizedRecords[next(entries)].hash());
    }

    @Benchmark
    public Optional<BlockRecord> hitByHexString() {
        return cache.getBlockByHash(hexHashes[next(entries)]);
    }

    @Benchmark
    public Optional<BlockRecord> miss() {
        return cache.getBlockByNumber(-1L - next(entries));
    }
}
