// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query.cache;

import sh.strata.core.model.BlockRecord;

/**
 * One cached record and its lifetime, shared by the number and hash indices.
 */
record CacheEntry(BlockRecord record, long insertedNanos, long ttlNanos) {

    boolean isExpired(long nowNanos) {
        return nowNanos - insertedNanos > ttlNanos;
    }
}
