package com.bastion.validation;

import com.bastion.audit.ErrorKind;
import com.bastion.security.Credential;
import com.bastion.security.CredentialKind;
import com.bastion.security.ValidationContext;
import com.bastion.validation.store.CredentialRecord;
import com.bastion.validation.store.CredentialStore;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns a presented credential into a {@link ValidationContext}.
 *
 * <p>Pure read against the store; safe to call concurrently from both validators. Store
 * outages propagate as {@link com.bastion.validation.store.StoreUnavailableException}.
 */
public class CredentialResolver {

    private final CredentialStore store;
    private final RiskScorer riskScorer;
    private final Clock clock;

    public CredentialResolver(CredentialStore store, RiskScorer riskScorer, Clock clock) {
        if (store == null || riskScorer == null || clock == null) {
            throw new IllegalArgumentException("store, riskScorer and clock must not be null");
        }
        this.store = store;
        this.riskScorer = riskScorer;
        this.clock = clock;
    }

    /**
     * @throws CredentialResolutionException with {@code MALFORMED}, {@code NOT_FOUND} or {@code EXPIRED}
     */
    public ValidationContext resolve(Credential credential) {
        if (credential == null || !credential.recognized()) {
            throw new CredentialResolutionException(ErrorKind.MALFORMED, "credential format not recognized");
        }

        CredentialRecord record = store.lookupCredential(credential.rawValue())
                .orElseThrow(() -> new CredentialResolutionException(ErrorKind.NOT_FOUND, "credential not found"));

        if (credential.kind() == CredentialKind.SESSION_TOKEN
                && (record.userId() == null || record.userId().isBlank())) {
            throw new CredentialResolutionException(ErrorKind.MALFORMED, "session token has no owning user");
        }

        Instant now = clock.instant();
        if (!now.isBefore(record.expiresAt())) {
            throw new CredentialResolutionException(ErrorKind.EXPIRED, "credential expired at " + record.expiresAt());
        }

        return new ValidationContext(
                record.tenantId(),
                record.userId(),
                record.accessLevel(),
                riskScorer.initialScore(record, now),
                credential.kind(),
                now,
                record.issuedAt(),
                record.expiresAt());
    }

    /** True when the tenant exists and is active. */
    public boolean tenantActive(String tenantId) {
        return store.lookupTenant(tenantId).map(t -> t.active()).orElse(false);
    }

    public Clock clock() {
        return clock;
    }
}
