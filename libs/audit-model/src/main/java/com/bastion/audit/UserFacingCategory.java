package com.bastion.audit;

/**
 * Category of error shown to an API caller. Never reveals which internal check failed.
 */
public enum UserFacingCategory {
    INVALID_CREDENTIALS,
    ACCESS_DENIED,
    TEMPORARILY_UNAVAILABLE;

    /** The caller-visible category for an internal error category. */
    public static UserFacingCategory forCategory(ErrorCategory category) {
        return switch (category) {
            case AUTHENTICATION_FAILURE -> INVALID_CREDENTIALS;
            case AUTHORIZATION_FAILURE -> ACCESS_DENIED;
            case INTERNAL_FAULT, CONFIGURATION_DEFECT -> TEMPORARILY_UNAVAILABLE;
        };
    }
}
