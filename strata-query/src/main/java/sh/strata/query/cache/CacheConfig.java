// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Lifetimes and capacity for {@link BlockCache}.
 *
 * <p>
 * Finalized blocks can no longer be reorganized away, so they are kept much longer than
 * recent ones:
 * <ul>
 * <li>{@code blockTtlFinalized} - lifetime of finalized records (default: 1 hour)</li>
 * <li>{@code blockTtlRecent} - lifetime of non-finalized records (default: 12 seconds,
 * about two block times)</li>
 * <li>{@code maxEntries} - upper bound on cached records (default: 1000)</li>
 * </ul>
 *
 * <pre>{@code
 * CacheConfig config = CacheConfig.defaults()
 *         .withBlockTtlRecent(Duration.ofSeconds(6))
 *         .withMaxEntries(5000);
 * }</pre>
 *
 * @param blockTtlFinalized lifetime of finalized records (must be positive)
 * @param blockTtlRecent    lifetime of non-finalized records (must be positive)
 * @param maxEntries        capacity in records (must be &gt; 0)
 * @since 0.1.0
 */
public record CacheConfig(Duration blockTtlFinalized, Duration blockTtlRecent, int maxEntries) {

    /** Default lifetime of finalized records: 1 hour. */
    public static final Duration DEFAULT_BLOCK_TTL_FINALIZED = Duration.ofHours(1);

    /** Default lifetime of recent records: 12 seconds. */
    public static final Duration DEFAULT_BLOCK_TTL_RECENT = Duration.ofSeconds(12);

    /** Default capacity: 1000 records. */
    public static final int DEFAULT_MAX_ENTRIES = 1000;

    public CacheConfig {
        Objects.requireNonNull(blockTtlFinalized, "blockTtlFinalized");
        Objects.requireNonNull(blockTtlRecent, "blockTtlRecent");
        if (blockTtlFinalized.isNegative() || blockTtlFinalized.isZero()) {
            throw new IllegalArgumentException("blockTtlFinalized must be positive, got: " + blockTtlFinalized);
        }
        if (blockTtlRecent.isNegative() || blockTtlRecent.isZero()) {
            throw new IllegalArgumentException("blockTtlRecent must be positive, got: " + blockTtlRecent);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
        }
    }

    /**
     * Returns the default configuration.
     *
     * @return 1 hour finalized, 12 seconds recent, 1000 entries
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_BLOCK_TTL_FINALIZED, DEFAULT_BLOCK_TTL_RECENT, DEFAULT_MAX_ENTRIES);
    }

    public CacheConfig withBlockTtlFinalized(Duration ttl) {
        return new CacheConfig(ttl, blockTtlRecent, maxEntries);
    }

    public CacheConfig withBlockTtlRecent(Duration ttl) {
        return new CacheConfig(blockTtlFinalized, ttl, maxEntries);
    }

    public CacheConfig withMaxEntries(int maxEntries) {
        return new CacheConfig(blockTtlFinalized, blockTtlRecent, maxEntries);
    }
}
