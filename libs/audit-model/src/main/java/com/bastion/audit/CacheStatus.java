package com.bastion.audit;

/**
 * Whether a validator's decision was served from the decision cache.
 */
public enum CacheStatus {
    HIT,
    MISS,
    /** The validator does not use the cache (legacy) or never reached it. */
    NOT_APPLICABLE
}
