package com.bastion.validation.cache;

import java.time.Duration;

/**
 * @param enabled    whether the enhanced validator consults the cache at all
 * @param ttl        upper bound on entry lifetime
 * @param maxEntries capacity; the entry closest to expiry is evicted on overflow
 */
public record CacheSettings(boolean enabled, Duration ttl, int maxEntries) {

    public static final CacheSettings DEFAULTS = new CacheSettings(true, Duration.ofMinutes(5), 1000);

    public CacheSettings {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
    }
}
