package com.bastion.validation.store;

import com.bastion.security.AccessLevel;

import java.time.Instant;

/**
 * A credential as held by the backing store.
 *
 * @param tenantId      owning tenant
 * @param userId        owning user, null for machine API keys
 * @param accessLevel   granted access level
 * @param issuedAt      issue time
 * @param expiresAt     current expiry
 * @param priorFailures recent failed-validation count, null when the store does not track it
 */
public record CredentialRecord(
        String tenantId,
        String userId,
        AccessLevel accessLevel,
        Instant issuedAt,
        Instant expiresAt,
        Integer priorFailures) {

    public CredentialRecord {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (accessLevel == null) {
            throw new IllegalArgumentException("accessLevel must not be null");
        }
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("issuedAt and expiresAt must not be null");
        }
        if (priorFailures != null && priorFailures < 0) {
            throw new IllegalArgumentException("priorFailures must be >= 0");
        }
    }

    public CredentialRecord withExpiresAt(Instant newExpiry) {
        return new CredentialRecord(tenantId, userId, accessLevel, issuedAt, newExpiry, priorFailures);
    }
}
