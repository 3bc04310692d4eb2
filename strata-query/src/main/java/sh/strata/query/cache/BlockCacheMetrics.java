// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query.cache;

/**
 * Listener for {@link BlockCache} activity.
 *
 * <p>
 * Implementations can forward to a metrics library. By default a no-op implementation is
 * used ({@link #noop()}). Callbacks run while the cache lock is held, so they must be
 * fast and must not call back into the cache.
 */
public interface BlockCacheMetrics {

    /** Called when a lookup returns a live record. */
    default void onHit() {
    }

    /** Called when a lookup finds nothing, including after lazy expiry. */
    default void onMiss() {
    }

    /**
     * Called when a lookup finds an expired entry and drops it.
     *
     * @param blockNumber the expired block
     */
    default void onExpired(long blockNumber) {
    }

    /**
     * Called when an entry is removed to stay within capacity.
     *
     * @param blockNumber the evicted block
     */
    default void onEviction(long blockNumber) {
    }

    /**
     * Returns a metrics listener that does nothing.
     *
     * @return the no-op listener
     */
    static BlockCacheMetrics noop() {
        return NoopCacheMetrics.INSTANCE;
    }
}

enum NoopCacheMetrics implements BlockCacheMetrics {
    INSTANCE
}
