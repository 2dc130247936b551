package com.bastion.validation.store;

/**
 * Thrown by {@link CredentialStore} implementations when the store cannot be reached or
 * answered with an infrastructure error. Never used for "credential not found".
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
