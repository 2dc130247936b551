package com.bastion.audit;

/**
 * Every failure a validator can report. Each kind belongs to exactly one {@link ErrorCategory}.
 */
public enum ErrorKind {

    NOT_FOUND(ErrorCategory.AUTHENTICATION_FAILURE),
    EXPIRED(ErrorCategory.AUTHENTICATION_FAILURE),
    MALFORMED(ErrorCategory.AUTHENTICATION_FAILURE),

    CROSS_TENANT_DENIED(ErrorCategory.AUTHORIZATION_FAILURE),
    ACCESS_LEVEL_INSUFFICIENT(ErrorCategory.AUTHORIZATION_FAILURE),
    TENANT_INACTIVE(ErrorCategory.AUTHORIZATION_FAILURE),

    INTERNAL_FAULT(ErrorCategory.INTERNAL_FAULT),
    VALIDATOR_TIMEOUT(ErrorCategory.INTERNAL_FAULT),
    STORE_UNAVAILABLE(ErrorCategory.INTERNAL_FAULT);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    /** True for kinds that indicate the validator itself broke rather than rejected. */
    public boolean fault() {
        return category == ErrorCategory.INTERNAL_FAULT;
    }
}
