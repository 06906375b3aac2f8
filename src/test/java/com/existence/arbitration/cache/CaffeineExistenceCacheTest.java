package com.existence.arbitration.cache;

import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.ExistenceCacheEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;

import static com.existence.arbitration.BindingFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CaffeineExistenceCache")
class CaffeineExistenceCacheTest {

    private final CaffeineExistenceCache cache =
            new CaffeineExistenceCache(new CacheConfig(100), Clock.fixed(T0, ZoneOffset.UTC));

    @Test
    @DisplayName("First upsert derives existence flags from status")
    void initialEntry() {
        ExistenceCacheEntry visible = cache.upsert("b1", BindingStatus.VISIBLE);
        ExistenceCacheEntry hidden = cache.upsert("b2", BindingStatus.HIDDEN);

        assertEquals(1, visible.cacheVersion());
        assertTrue(visible.markExists());
        assertFalse(visible.elementDeleted());
        assertTrue(hidden.elementDeleted());
        assertFalse(hidden.markExists());
        assertEquals(T0, visible.lastVerifiedAt());
    }

    @Test
    @DisplayName("Subsequent upserts bump the version and clear staleness")
    void versionBump() {
        cache.upsert("b1", BindingStatus.VISIBLE);
        cache.markAllStale();
        assertTrue(cache.get("b1").orElseThrow().stale());

        ExistenceCacheEntry next = cache.upsert("b1", BindingStatus.HIDDEN);

        assertEquals(2, next.cacheVersion());
        assertEquals(BindingStatus.HIDDEN, next.status());
        assertFalse(next.stale());
    }

    @Test
    @DisplayName("Invalidate removes entries and stats count hits and misses")
    void invalidateAndStats() {
        cache.upsert("b1", BindingStatus.VISIBLE);
        cache.get("b1");
        cache.invalidate("b1");
        cache.get("b1");

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 0.0001);
    }

    @Test
    @DisplayName("Config rejects non-positive size")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0));
        assertEquals(50_000, CacheConfig.defaults().maxSize());
    }
}
