package com.bastion.security;

import java.time.Duration;
import java.time.Instant;

/**
 * The identity resolved for a single request.
 *
 * <p>Created fresh per request by each validator and never shared across requests. Immutable:
 * risk refinement and token extension produce modified copies through the {@code with*}
 * methods.
 *
 * @param tenantId       owning tenant, compared by exact equality for isolation checks
 * @param userId         owning user (null for machine API keys)
 * @param accessLevel    granted access level
 * @param riskScore      0.0 (trusted) to 1.0 (riskiest)
 * @param credentialKind kind of the presented credential
 * @param resolvedAt     when the resolution happened
 * @param issuedAt       when the credential was issued
 * @param expiresAt      when the credential expires
 */
public record ValidationContext(
        String tenantId,
        String userId,
        AccessLevel accessLevel,
        double riskScore,
        CredentialKind credentialKind,
        Instant resolvedAt,
        Instant issuedAt,
        Instant expiresAt) {

    /** Risk score used when no signals are available. */
    public static final double NEUTRAL_RISK = 0.5;

    public ValidationContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (accessLevel == null) {
            throw new IllegalArgumentException("accessLevel must not be null");
        }
        if (credentialKind == null) {
            throw new IllegalArgumentException("credentialKind must not be null");
        }
        if (Double.isNaN(riskScore) || riskScore < 0.0 || riskScore > 1.0) {
            throw new IllegalArgumentException("riskScore must be within [0.0, 1.0] but was " + riskScore);
        }
        if (resolvedAt == null || issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("resolvedAt, issuedAt and expiresAt must not be null");
        }
        if (expiresAt.isBefore(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must not precede issuedAt");
        }
    }

    public ValidationContext withAccessLevel(AccessLevel level) {
        return new ValidationContext(tenantId, userId, level, riskScore, credentialKind, resolvedAt, issuedAt, expiresAt);
    }

    public ValidationContext withRiskScore(double score) {
        return new ValidationContext(tenantId, userId, accessLevel, score, credentialKind, resolvedAt, issuedAt, expiresAt);
    }

    public ValidationContext withExpiresAt(Instant newExpiry) {
        return new ValidationContext(tenantId, userId, accessLevel, riskScore, credentialKind, resolvedAt, issuedAt, newExpiry);
    }

    /** Total validity window of the credential. */
    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }

    /** Validity left at {@code now}; zero once expired. */
    public Duration remainingAt(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /** True when the credential is expired at {@code now}. */
    public boolean expiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** True when the tenant and access level match (what "outcomes agree" compares). */
    public boolean sameGrantAs(ValidationContext other) {
        return other != null && tenantId.equals(other.tenantId) && accessLevel == other.accessLevel;
    }
}
