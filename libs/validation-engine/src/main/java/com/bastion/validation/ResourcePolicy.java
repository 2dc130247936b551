package com.bastion.validation;

import com.bastion.security.AccessLevel;

import java.util.Map;

/**
 * Per-resource authorization requirements. Resources without an explicit entry fall back to
 * {@link #defaultRequirement()}.
 */
public final class ResourcePolicy {

    /**
     * What a resource demands of a caller.
     *
     * @param requiredLevel minimum access level
     * @param sensitivity   0.0 (public) to 1.0 (most sensitive), feeds the risk score
     */
    public record Requirement(AccessLevel requiredLevel, double sensitivity) {

        public Requirement {
            if (requiredLevel == null) {
                throw new IllegalArgumentException("requiredLevel must not be null");
            }
            if (Double.isNaN(sensitivity) || sensitivity < 0.0 || sensitivity > 1.0) {
                throw new IllegalArgumentException("sensitivity must be within [0.0, 1.0] but was " + sensitivity);
            }
        }
    }

    private static final Requirement OPEN = new Requirement(AccessLevel.READ, 0.0);

    private final Map<String, Requirement> requirements;
    private final Requirement defaultRequirement;

    public ResourcePolicy(Map<String, Requirement> requirements, Requirement defaultRequirement) {
        this.requirements = Map.copyOf(requirements);
        this.defaultRequirement = defaultRequirement == null ? OPEN : defaultRequirement;
    }

    /** A policy where every resource needs READ and carries no sensitivity. */
    public static ResourcePolicy open() {
        return new ResourcePolicy(Map.of(), OPEN);
    }

    public Requirement requirementFor(String resource) {
        if (resource == null) {
            return defaultRequirement;
        }
        return requirements.getOrDefault(resource, defaultRequirement);
    }

    public Requirement defaultRequirement() {
        return defaultRequirement;
    }
}
