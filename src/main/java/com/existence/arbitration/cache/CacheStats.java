package com.existence.arbitration.cache;

/**
 * Existence cache counters.
 *
 * @param hitCount      number of lookups served from the cache
 * @param missCount     number of lookups that found nothing
 * @param evictionCount number of entries evicted for size
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
