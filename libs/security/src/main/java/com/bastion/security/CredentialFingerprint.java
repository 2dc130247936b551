package com.bastion.security;

/**
 * Stable, non-reversible digest of a bearer credential.
 * <p>
 * Used as cache and audit key so the raw secret never needs to be stored or logged.
 *
 * @param value lowercase hex digest
 */
public record CredentialFingerprint(String value) {

    public CredentialFingerprint {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("fingerprint value must not be null or blank");
        }
    }

    /**
     * Returns the first 12 characters, enough to correlate log lines by eye.
     */
    public String shortForm() {
        return value.length() <= 12 ? value : value.substring(0, 12);
    }

    @Override
    public String toString() {
        return value;
    }
}
