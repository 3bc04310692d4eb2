// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.strata.core.types.Hash;

/**
 * Summary of one block as resolved from the chain.
 *
 * <p>
 * When built from a live fetch, {@code transactions.size() == extrinsicCount}. The
 * record does not enforce or repair that relation: a record constructed with a
 * different count keeps it through caching and JSON encoding.
 *
 * @param number         the block number
 * @param hash           the block hash
 * @param parentHash     the parent block's hash
 * @param timestamp      block time in seconds since the epoch; may be the query time when the
 *                       timestamp inherent could not be decoded
 * @param transactions   extrinsic content hashes in on-chain order
 * @param stateRoot      the header's state root, if extracted
 * @param extrinsicsRoot the header's extrinsics root, if extracted
 * @param extrinsicCount number of extrinsics in the block
 * @param eventCount     total events across all extrinsics, or {@code null} when enumeration failed
 * @param finalized      whether the block was deep enough behind head to be treated as final
 * @since 0.1.0
 */
public record BlockRecord(
        long number,
        Hash hash,
        Hash parentHash,
        long timestamp,
        List<Hash> transactions,
        @Nullable Hash stateRoot,
        @Nullable Hash extrinsicsRoot,
        int extrinsicCount,
        @Nullable Integer eventCount,
        boolean finalized) {

    public BlockRecord {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(parentHash, "parentHash");
        if (number < 0) {
            throw new IllegalArgumentException("number must be non-negative, got: " + number);
        }
        if (extrinsicCount < 0) {
            throw new IllegalArgumentException("extrinsicCount must be non-negative, got: " + extrinsicCount);
        }
        if (eventCount != null && eventCount < 0) {
            throw new IllegalArgumentException("eventCount must be non-negative, got: " + eventCount);
        }
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
