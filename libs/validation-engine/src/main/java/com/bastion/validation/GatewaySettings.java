package com.bastion.validation;

import java.time.Duration;

/**
 * Orchestration settings.
 *
 * @param parallelEnabled  run the non-selected validator in the shadow as well
 * @param selectionPolicy  whose outcome the caller sees
 * @param legacyTimeout    deadline for the legacy validator
 * @param enhancedTimeout  deadline for the enhanced validator
 */
public record GatewaySettings(
        boolean parallelEnabled,
        SelectionPolicy selectionPolicy,
        Duration legacyTimeout,
        Duration enhancedTimeout) {

    public static final GatewaySettings DEFAULTS =
            new GatewaySettings(true, SelectionPolicy.SHADOW, Duration.ofMillis(500), Duration.ofMillis(200));

    public GatewaySettings {
        if (selectionPolicy == null) {
            throw new IllegalArgumentException("selectionPolicy must not be null");
        }
        requirePositive("legacyTimeout", legacyTimeout);
        requirePositive("enhancedTimeout", enhancedTimeout);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
