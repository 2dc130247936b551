package com.bastion.validation.audit;

/**
 * Thrown when an {@link AuditSink} cannot store or read records.
 */
public class AuditSinkException extends RuntimeException {

    public AuditSinkException(String message) {
        super(message);
    }

    public AuditSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
