package com.bastion.validation;

import com.bastion.audit.ErrorCategory;
import com.bastion.audit.ErrorKind;

/**
 * Thrown by {@link CredentialResolver} when a credential cannot be turned into a
 * {@link com.bastion.security.ValidationContext}. Always an authentication failure.
 */
public class CredentialResolutionException extends RuntimeException {

    private final ErrorKind errorKind;

    public CredentialResolutionException(ErrorKind errorKind, String message) {
        super(message);
        if (errorKind == null || errorKind.category() != ErrorCategory.AUTHENTICATION_FAILURE) {
            throw new IllegalArgumentException("resolution failures must be authentication failures: " + errorKind);
        }
        this.errorKind = errorKind;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }
}
