// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class CacheConfigTest {

    @Test
    void defaults() {
        CacheConfig config = CacheConfig.defaults();

        assertEquals(Duration.ofHours(1), config.blockTtlFinalized());
        assertEquals(Duration.ofSeconds(12), config.blockTtlRecent());
        assertEquals(1000, config.maxEntries());
    }

    @Test
    void withersChangeOneValue() {
        CacheConfig config = CacheConfig.defaults()
                .withBlockTtlFinalized(Duration.ofMinutes(10))
                .withBlockTtlRecent(Duration.ofSeconds(6))
                .withMaxEntries(5000);

        assertEquals(Duration.ofMinutes(10), config.blockTtlFinalized());
        assertEquals(Duration.ofSeconds(6), config.blockTtlRecent());
        assertEquals(5000, config.maxEntries());
    }

    @Test
    void rejectsNonPositiveValues() {
        CacheConfig defaults = CacheConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxEntries(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withBlockTtlRecent(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> defaults.withBlockTtlFinalized(Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> defaults.withBlockTtlRecent(null));
    }
}
