// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.crypto;

/**
 * Pure 32-byte hash function used to derive extrinsic identifiers.
 *
 * <p>Implementations must be stateless or thread-safe; detailed block extraction may call
 * them from several threads at once.
 */
@FunctionalInterface
public interface Hasher {

    /**
     * Hashes the input.
     *
     * @param input the bytes to hash
     * @return exactly 32 bytes
     */
    byte[] hash256(byte[] input);

    /**
     * Returns the BLAKE2b-256 hasher used by Substrate chains.
     *
     * @return the default hasher
     */
    static Hasher blake2b256() {
        return Blake2b256::hash;
    }
}
