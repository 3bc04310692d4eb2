// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * BLAKE2b with a 256-bit output, the hash Substrate chains use for block and extrinsic
 * hashes.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] hash = Blake2b256.hash(extrinsicBytes);
 * Hash id = Hash.fromBytes(hash);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>
 * A {@link ThreadLocal} keeps one BouncyCastle digest per thread. In pooled-thread
 * environments the digest stays reachable for the lifetime of each thread; call
 * {@link #cleanup()} when a thread is handed back to a container you do not own.
 *
 * @since 0.1.0
 */
public final class Blake2b256 {

    /** Output size in bytes. */
    public static final int DIGEST_LENGTH = 32;

    private static final ThreadLocal<Blake2bDigest> DIGEST =
            ThreadLocal.withInitial(() -> new Blake2bDigest(DIGEST_LENGTH * 8));

    private Blake2b256() {
        // Utility class
    }

    /**
     * Computes the BLAKE2b-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final Blake2bDigest digest = DIGEST.get();
        digest.reset();
        digest.update(input, 0, input.length);
        final byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Removes the calling thread's cached digest.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
