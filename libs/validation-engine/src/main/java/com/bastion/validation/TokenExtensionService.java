package com.bastion.validation;

import com.bastion.security.Credential;
import com.bastion.security.ValidationContext;
import com.bastion.validation.cache.ValidationCache;
import com.bastion.validation.store.CredentialStore;
import com.bastion.validation.store.ExtensionResult;
import com.bastion.validation.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Extends credentials that are close to expiry, without changing the credential value.
 *
 * <p>The new expiry is computed from the credential's current expiry, not from "now", and the
 * write is conditional on that current expiry. Concurrent requests on any number of gateway
 * instances therefore compute the same window, and exactly one conditional write wins it. Losing
 * the race ({@link ExtensionResult#CONFLICT}) is not an error.
 */
public class TokenExtensionService {

    private static final Logger log = LoggerFactory.getLogger(TokenExtensionService.class);

    /**
     * @param context the context to continue with (with the new expiry when applied)
     * @param applied whether this call's write extended the credential
     */
    public record Decision(ValidationContext context, boolean applied) {
    }

    private final CredentialStore store;
    private final ExtensionPolicy policy;
    private final ValidationCache cache;
    private final Clock clock;

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong extended = new AtomicLong();
    private final AtomicLong conflicts = new AtomicLong();
    private final AtomicLong notFound = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public TokenExtensionService(CredentialStore store, ExtensionPolicy policy, ValidationCache cache, Clock clock) {
        if (store == null || policy == null || clock == null) {
            throw new IllegalArgumentException("store, policy and clock must not be null");
        }
        this.store = store;
        this.policy = policy;
        this.cache = cache;
        this.clock = clock;
    }

    /** True when the context is eligible and inside the extension window at {@code now}. */
    public boolean due(ValidationContext context, Instant now) {
        if (!policy.permits(context.credentialKind(), context.tenantId())) {
            return false;
        }
        Duration lifetime = context.lifetime();
        if (lifetime.isZero() || context.expiredAt(now)) {
            return false;
        }
        long thresholdNanos = (long) (lifetime.toNanos() * policy.thresholdFraction());
        return context.remainingAt(now).toNanos() < thresholdNanos;
    }

    /**
     * Extends the credential when due. A store failure here never fails validation; the
     * request continues with the unextended context.
     */
    public Decision maybeExtend(Credential credential, ValidationContext context) {
        if (!due(context, clock.instant())) {
            return new Decision(context, false);
        }
        attempts.incrementAndGet();
        Instant currentExpiry = context.expiresAt();
        Instant newExpiry = currentExpiry.plus(policy.extension());

        ExtensionResult result;
        try {
            result = store.extendCredential(credential.rawValue(), newExpiry, currentExpiry);
        } catch (StoreUnavailableException e) {
            failed.incrementAndGet();
            log.warn("Credential extension skipped, store unavailable: {}", e.getMessage());
            return new Decision(context, false);
        }

        switch (result) {
            case EXTENDED -> {
                extended.incrementAndGet();
                if (cache != null) {
                    cache.evict(credential.fingerprint());
                }
                log.info("Credential {} extended from {} to {}", credential.fingerprint().shortForm(),
                        currentExpiry, newExpiry);
                return new Decision(context.withExpiresAt(newExpiry), true);
            }
            case CONFLICT -> {
                conflicts.incrementAndGet();
                // the cached expiry is stale now
                if (cache != null) {
                    cache.evict(credential.fingerprint());
                }
                log.debug("Credential {} already extended by a concurrent request",
                        credential.fingerprint().shortForm());
                return new Decision(context, false);
            }
            default -> {
                notFound.incrementAndGet();
                log.warn("Credential {} disappeared before it could be extended",
                        credential.fingerprint().shortForm());
                return new Decision(context, false);
            }
        }
    }

    public ExtensionStats stats() {
        return new ExtensionStats(attempts.get(), extended.get(), conflicts.get(), notFound.get(), failed.get());
    }

    public ExtensionPolicy policy() {
        return policy;
    }
}
