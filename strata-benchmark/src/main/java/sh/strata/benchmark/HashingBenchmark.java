// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.benchmark;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;

import sh.strata.core.crypto.Blake2b256;
import sh.strata.core.types.Hash;
import sh.strata.primitives.Hex;
import sh.strata.primitives.scale.ScaleCompact;

/**
 * JMH benchmark for the per-extrinsic work of building a block record: hashing the
 * encoded extrinsic, hex-encoding the digest, and parsing user-supplied hashes.
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
public class HashingBenchmark {

    @Param({ "64", "256", "4096" })
    private int extrinsicSize;

    private byte[] extrinsic;
    private byte[] digest;
    private String bareHash;
    private byte[] compactTimestamp;

    @Setup
    public void setup() {
        extrinsic = new byte[extrinsicSize];
        for (int i = 0; i < extrinsic.length; i++) {
            extrinsic[i] = (byte) (i * 31);
        }
        digest = Blake2b256.hash(extrinsic);
        bareHash = Hex.encodeNoPrefix(digest).toUpperCase();
        compactTimestamp = ScaleCompact.encodeLong(1_704_067_200_000L);
    }

    @TearDown
    public void tearDown() {
        Blake2b256.cleanup();
    }

    @Benchmark
    public byte[] blake2b256() {
        return Blake2b256.hash(extrinsic);
    }

    @Benchmark
    public Hash extrinsicHash() {
        return Hash.fromBytes(Blake2b256.hash(extrinsic));
    }

    @Benchmark
    public String hexEncode() {
        return Hex.encode(digest);
    }

    @Benchmark
    public Hash parseBareHash() {
        return Hash.parse(bareHash);
    }

    @Benchmark
    public long decodeTimestamp() {
        return ScaleCompact.decodeLong(compactTimestamp);
    }
}
