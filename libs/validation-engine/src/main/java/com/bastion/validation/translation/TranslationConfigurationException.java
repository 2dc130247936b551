package com.bastion.validation.translation;

/**
 * Raised at startup when the error translation table is incomplete or inconsistent.
 * The gateway must not start with such a table.
 */
public class TranslationConfigurationException extends RuntimeException {

    public TranslationConfigurationException(String message) {
        super(message);
    }
}
