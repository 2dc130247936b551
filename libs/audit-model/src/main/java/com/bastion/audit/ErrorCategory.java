package com.bastion.audit;

/**
 * Coarse error taxonomy that decides retry semantics and operator alerting.
 */
public enum ErrorCategory {

    /** Bad, unknown or expired credential. Caller retries with a new credential. */
    AUTHENTICATION_FAILURE(false),

    /** Valid credential, insufficient rights. Not retriable without a privilege change. */
    AUTHORIZATION_FAILURE(false),

    /** Timeout, unexpected exception or store outage. Retriable; alerts operators. */
    INTERNAL_FAULT(true),

    /** Startup-time misconfiguration. Never produced at request time. */
    CONFIGURATION_DEFECT(false);

    private final boolean retriable;

    ErrorCategory(boolean retriable) {
        this.retriable = retriable;
    }

    /** Whether the same request may succeed if simply retried. */
    public boolean retriable() {
        return retriable;
    }
}
