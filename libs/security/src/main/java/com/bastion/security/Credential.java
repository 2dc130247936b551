package com.bastion.security;

import java.util.Objects;

/**
 * An opaque bearer credential presented by a caller.
 * <p>
 * Immutable. {@link #toString()} never includes the raw value. Instances are created by
 * {@link CredentialParser}; a credential whose prefix matched no known kind has a
 * {@code null} kind and is rejected as malformed by the resolver without a store lookup.
 */
public final class Credential {

    private final String rawValue;
    private final CredentialKind kind;
    private final CredentialFingerprint fingerprint;

    public Credential(String rawValue, CredentialKind kind, CredentialFingerprint fingerprint) {
        this.rawValue = rawValue == null ? "" : rawValue;
        this.kind = kind;
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    /** The secret as presented. Never log this. */
    public String rawValue() {
        return rawValue;
    }

    /** The recognized kind, or null when the format matched no kind. */
    public CredentialKind kind() {
        return kind;
    }

    public CredentialFingerprint fingerprint() {
        return fingerprint;
    }

    /** True when the value is non-blank and its prefix matched a known kind. */
    public boolean recognized() {
        return kind != null && !rawValue.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Credential other)) {
            return false;
        }
        return rawValue.equals(other.rawValue) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawValue, kind);
    }

    @Override
    public String toString() {
        return "Credential[kind=" + kind + ", fingerprint=" + fingerprint.shortForm() + "]";
    }
}
