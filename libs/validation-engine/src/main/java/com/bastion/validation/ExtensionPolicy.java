package com.bastion.validation;

import com.bastion.security.CredentialKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * When credentials nearing expiry are extended.
 *
 * @param enabled           master switch
 * @param thresholdFraction extend when remaining validity is below this fraction of the total lifetime
 * @param extension         how far past the current expiry the new expiry lies
 * @param allowedKinds      credential kinds eligible for extension
 * @param excludedTenants   tenants whose credentials are never extended
 */
public record ExtensionPolicy(
        boolean enabled,
        double thresholdFraction,
        Duration extension,
        Set<CredentialKind> allowedKinds,
        Set<String> excludedTenants) {

    public static final ExtensionPolicy DEFAULTS = new ExtensionPolicy(true, 0.25, Duration.ofDays(30),
            EnumSet.allOf(CredentialKind.class), Set.of());

    public ExtensionPolicy {
        if (Double.isNaN(thresholdFraction) || thresholdFraction < 0.0 || thresholdFraction > 1.0) {
            throw new IllegalArgumentException("thresholdFraction must be within [0.0, 1.0]");
        }
        if (extension == null || extension.isZero() || extension.isNegative()) {
            throw new IllegalArgumentException("extension must be positive");
        }
        allowedKinds = allowedKinds == null ? Set.of() : Set.copyOf(allowedKinds);
        excludedTenants = excludedTenants == null ? Set.of() : Set.copyOf(excludedTenants);
    }

    public static ExtensionPolicy disabled() {
        return new ExtensionPolicy(false, 0.0, Duration.ofDays(1), Set.of(), Set.of());
    }

    public boolean permits(CredentialKind kind, String tenantId) {
        return enabled && allowedKinds.contains(kind) && !excludedTenants.contains(tenantId);
    }
}
