package com.bastion.security;

/**
 * Derives a {@link CredentialFingerprint} from a raw credential value.
 * <p>
 * Implementations must be deterministic and thread-safe.
 */
@FunctionalInterface
public interface Fingerprinter {

    /**
     * Computes the fingerprint for the given raw value (may be empty, never null).
     */
    CredentialFingerprint fingerprint(String rawValue);
}
