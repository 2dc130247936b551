package com.bastion.validation.cache;

import com.bastion.security.CredentialFingerprint;
import com.bastion.security.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Short-lived cache of resolved identities keyed by credential fingerprint and resource.
 *
 * <p>One entry per key, last write wins. Expired entries are removed lazily when read.
 * When the cache is full, the entry with the earliest expiry makes room. Callers never lock.
 *
 * <p>Revocations advance a revocation epoch. A writer captures {@link #revocationEpoch()} before
 * it resolves the identity it is about to store; {@link #put} drops the write when a revocation
 * happened in between, so a decision resolved before a revocation never outlives it.
 */
public class ValidationCache {

    private static final Logger log = LoggerFactory.getLogger(ValidationCache.class);

    record Key(String fingerprint, String resource) {
    }

    private record Entry(ValidationContext context, Instant expiresAt) {
    }

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final CacheSettings settings;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong puts = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong revocationEpoch = new AtomicLong();

    public ValidationCache(CacheSettings settings, Clock clock) {
        if (settings == null || clock == null) {
            throw new IllegalArgumentException("settings and clock must not be null");
        }
        this.settings = settings;
        this.clock = clock;
    }

    public Optional<ValidationContext> get(CredentialFingerprint fingerprint, String resource) {
        Key key = key(fingerprint, resource);
        Entry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            if (entries.remove(key, entry)) {
                evictions.incrementAndGet();
            }
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.context());
    }

    /** Current revocation epoch; pass it back to {@link #put}. */
    public long revocationEpoch() {
        return revocationEpoch.get();
    }

    /**
     * Stores a context for at most {@code ttl}, capped at the configured TTL. Non-positive TTLs
     * are ignored.
     *
     * @param epoch revocation epoch read before {@code context} was resolved
     * @return whether the entry was stored and survived any concurrent revocation
     */
    public boolean put(CredentialFingerprint fingerprint, String resource, ValidationContext context, Duration ttl,
                       long epoch) {
        if (context == null || ttl == null) {
            throw new IllegalArgumentException("context and ttl must not be null");
        }
        Duration effective = ttl.compareTo(settings.ttl()) < 0 ? ttl : settings.ttl();
        if (effective.isZero() || effective.isNegative()) {
            return false;
        }
        if (revocationEpoch.get() != epoch) {
            log.debug("Skipped caching credential {}: revoked while it was being resolved", fingerprint.shortForm());
            return false;
        }
        Key key = key(fingerprint, resource);
        while (!entries.containsKey(key) && entries.size() >= settings.maxEntries()) {
            // concurrent writers may pick the same victim, so re-check until there is room
            if (!evictEarliestExpiry()) {
                break;
            }
        }
        Entry entry = new Entry(context, clock.instant().plus(effective));
        entries.put(key, entry);
        puts.incrementAndGet();
        // a revocation that advanced the epoch before its sweep may have missed this entry
        if (revocationEpoch.get() != epoch) {
            if (entries.remove(key, entry)) {
                invalidations.incrementAndGet();
            }
            return false;
        }
        return true;
    }

    /**
     * Revokes one credential: drops its entries across all resources and rejects in-flight writes
     * resolved before this call.
     */
    public int invalidate(CredentialFingerprint fingerprint) {
        revocationEpoch.incrementAndGet();
        return evict(fingerprint);
    }

    /**
     * Drops the entries of one credential without fencing in-flight writes. Used when the stored
     * identity changed but the credential stays valid, as after an expiry extension.
     */
    public int evict(CredentialFingerprint fingerprint) {
        String value = fingerprint.value();
        return removeWhere(e -> e.getKey().fingerprint().equals(value));
    }

    /** Revokes every entry whose resolved identity belongs to the tenant. */
    public int invalidateTenant(String tenantId) {
        revocationEpoch.incrementAndGet();
        return removeWhere(e -> e.getValue().context().tenantId().equals(tenantId));
    }

    public void clear() {
        revocationEpoch.incrementAndGet();
        int removed = entries.size();
        entries.clear();
        invalidations.addAndGet(removed);
        log.info("Validation cache cleared ({} entries)", removed);
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), puts.get(), evictions.get(), invalidations.get(),
                entries.size());
    }

    public int size() {
        return entries.size();
    }

    public CacheSettings settings() {
        return settings;
    }

    private int removeWhere(Predicate<Map.Entry<Key, Entry>> predicate) {
        int[] removed = {0};
        entries.entrySet().removeIf(e -> {
            if (predicate.test(e)) {
                removed[0]++;
                return true;
            }
            return false;
        });
        invalidations.addAndGet(removed[0]);
        return removed[0];
    }

    private boolean evictEarliestExpiry() {
        Optional<Map.Entry<Key, Entry>> victim = entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().expiresAt()));
        if (victim.isEmpty()) {
            return false;
        }
        Key key = victim.get().getKey();
        Entry entry = victim.get().getValue();
        if (entries.remove(key, entry)) {
            evictions.incrementAndGet();
            log.debug("Cache full ({} entries), evicted entry expiring at {}", settings.maxEntries(),
                    entry.expiresAt());
        }
        return true;
    }

    private static Key key(CredentialFingerprint fingerprint, String resource) {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint must not be null");
        }
        return new Key(fingerprint.value(), resource == null ? "" : resource);
    }
}
