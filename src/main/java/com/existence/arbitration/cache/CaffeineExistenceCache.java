package com.existence.arbitration.cache;

import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.ExistenceCacheEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Caffeine-backed {@link ExistenceCache}. Size-bounded; an evicted entry simply
 * starts again at cache version 1 on the next transition.
 */
public class CaffeineExistenceCache implements ExistenceCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineExistenceCache.class);

    private final Cache<String, ExistenceCacheEntry> cache;
    private final Clock clock;

    public CaffeineExistenceCache() {
        this(CacheConfig.defaults(), Clock.systemUTC());
    }

    public CaffeineExistenceCache(CacheConfig config, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        this.clock = clock;
        log.info("CaffeineExistenceCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<ExistenceCacheEntry> get(String bindingId) {
        return Optional.ofNullable(cache.getIfPresent(bindingId));
    }

    @Override
    public ExistenceCacheEntry upsert(String bindingId, BindingStatus status) {
        return cache.asMap().compute(bindingId, (id, existing) -> existing == null
                ? ExistenceCacheEntry.initial(id, status, clock.instant())
                : existing.next(status, clock.instant()));
    }

    @Override
    public void markAllStale() {
        cache.asMap().replaceAll((id, entry) -> entry.markStale());
    }

    @Override
    public void invalidate(String bindingId) {
        cache.invalidate(bindingId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all existence cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}
