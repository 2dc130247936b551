package com.bastion.validation.cache;

/**
 * Point-in-time counters of a {@link ValidationCache}.
 */
public record CacheStats(long hits, long misses, long puts, long evictions, long invalidations, int size) {

    /** Hits over lookups, as a percentage; 0 when nothing was looked up. */
    public double hitRatePercent() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : hits * 100.0 / lookups;
    }
}
