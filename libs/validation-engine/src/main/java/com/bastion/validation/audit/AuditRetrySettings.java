package com.bastion.validation.audit;

import java.time.Duration;

/**
 * Retry schedule for audit appends: {@code maxAttempts} tries with exponential backoff
 * starting at {@code initialBackoff}.
 */
public record AuditRetrySettings(int maxAttempts, Duration initialBackoff, double backoffMultiplier) {

    public static final AuditRetrySettings DEFAULTS = new AuditRetrySettings(5, Duration.ofMillis(100), 2.0);

    public AuditRetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isZero() || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }
}
