package com.roster.matching.cache;

/**
 * Point-in-time statistics of the directory query cache.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
