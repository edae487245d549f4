package com.resource.guard.cache;

/**
 * Local store metrics.
 *
 * @param hitCount      number of reads that found an entry
 * @param missCount     number of reads that found nothing
 * @param evictionCount number of entries evicted for size or expiry
 * @param size          current (estimated) number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
