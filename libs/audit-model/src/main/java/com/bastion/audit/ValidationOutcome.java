package com.bastion.audit;

import com.bastion.security.ValidationContext;

import java.time.Duration;

/**
 * Result of one validator run for one request.
 *
 * <p>Exactly one of {@code context} (on success) and {@code errorKind} (on failure) is set.
 * Use the {@link #success} and {@link #failure} factories rather than the canonical
 * constructor.
 *
 * @param validator                 which path produced this outcome
 * @param success                   whether the credential was accepted
 * @param context                   the resolved identity (success only)
 * @param errorKind                 why it was rejected (failure only)
 * @param duration                  wall-clock time the validator took
 * @param cacheStatus               decision-cache involvement
 * @param extensionApplied          whether this run extended the credential (enhanced only)
 * @param crossTenantBlockTriggered whether the tenant isolation check fired (enhanced only)
 */
public record ValidationOutcome(
        ValidatorName validator,
        boolean success,
        ValidationContext context,
        ErrorKind errorKind,
        Duration duration,
        CacheStatus cacheStatus,
        boolean extensionApplied,
        boolean crossTenantBlockTriggered) {

    public ValidationOutcome {
        if (validator == null) {
            throw new IllegalArgumentException("validator must not be null");
        }
        if (success && (context == null || errorKind != null)) {
            throw new IllegalArgumentException("a successful outcome carries a context and no error kind");
        }
        if (!success && (errorKind == null || context != null)) {
            throw new IllegalArgumentException("a failed outcome carries an error kind and no context");
        }
        if (duration == null || duration.isNegative()) {
            duration = Duration.ZERO;
        }
        if (cacheStatus == null) {
            cacheStatus = CacheStatus.NOT_APPLICABLE;
        }
    }

    public static ValidationOutcome success(ValidatorName validator, ValidationContext context, Duration duration,
                                            CacheStatus cacheStatus, boolean extensionApplied) {
        return new ValidationOutcome(validator, true, context, null, duration, cacheStatus, extensionApplied, false);
    }

    public static ValidationOutcome failure(ValidatorName validator, ErrorKind errorKind, Duration duration,
                                            CacheStatus cacheStatus) {
        return new ValidationOutcome(validator, false, null, errorKind, duration, cacheStatus, false,
                errorKind == ErrorKind.CROSS_TENANT_DENIED);
    }

    /** Outcome used when a validator timed out or threw. */
    public static ValidationOutcome fault(ValidatorName validator, ErrorKind faultKind, Duration duration) {
        if (!faultKind.fault()) {
            throw new IllegalArgumentException(faultKind + " is not an internal fault kind");
        }
        return failure(validator, faultKind, duration, CacheStatus.NOT_APPLICABLE);
    }

    /** Returns the error category, or null on success. */
    public ErrorCategory errorCategory() {
        return errorKind == null ? null : errorKind.category();
    }

    /** Duration in fractional milliseconds. */
    public double durationMillis() {
        return duration.toNanos() / 1_000_000.0;
    }

    /**
     * True when both outcomes succeeded with the same tenant and access level, or both failed.
     */
    public boolean agreesWith(ValidationOutcome other) {
        if (other == null) {
            return false;
        }
        if (success && other.success) {
            return context.sameGrantAs(other.context);
        }
        return !success && !other.success;
    }
}
