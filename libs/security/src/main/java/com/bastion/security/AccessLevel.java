package com.bastion.security;

import java.util.Optional;

/**
 * Access levels a resolved credential can carry, ordered from least to most privileged.
 * <p>
 * The ordering is the hierarchy: a level implies every level below it, so ADMIN implies WRITE
 * and READ. {@link #degrade()} steps one level down and is used by risk scoring to reduce
 * privileges instead of rejecting a request outright.
 */
public enum AccessLevel {

    READ,
    WRITE,
    ADMIN;

    /**
     * Checks whether this level grants at least the given level.
     */
    public boolean implies(AccessLevel required) {
        return compareTo(required) >= 0;
    }

    /**
     * Returns the next lower level, or READ if this is already the lowest.
     */
    public AccessLevel degrade() {
        return this == READ ? READ : values()[ordinal() - 1];
    }

    /**
     * Looks up a level by name, case-insensitively.
     *
     * @param value the string to match (e.g. "write")
     * @return the matching level, or empty if unknown or null
     */
    public static Optional<AccessLevel> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AccessLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.strip())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
