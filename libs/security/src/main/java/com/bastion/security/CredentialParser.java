package com.bastion.security;

import java.util.Map;

/**
 * Classifies a raw bearer string into a {@link Credential} by its prefix.
 * <p>
 * Classification is purely syntactic. The store is never consulted, so a malformed value
 * costs nothing beyond a digest.
 */
public final class CredentialParser {

    /** Default prefix for API keys. */
    public static final String DEFAULT_API_KEY_PREFIX = "ovt_";

    /** Default prefix for session tokens. */
    public static final String DEFAULT_SESSION_PREFIX = "sess_";

    /** Minimum number of characters after the prefix for a value to count as well-formed. */
    public static final int MIN_BODY_LENGTH = 8;

    private final Map<CredentialKind, String> prefixes;
    private final Fingerprinter fingerprinter;

    /**
     * Creates a parser with the default prefixes.
     */
    public CredentialParser(Fingerprinter fingerprinter) {
        this(DEFAULT_API_KEY_PREFIX, DEFAULT_SESSION_PREFIX, fingerprinter);
    }

    /**
     * Creates a parser with explicit prefixes.
     *
     * @param apiKeyPrefix  prefix identifying API keys
     * @param sessionPrefix prefix identifying session tokens
     * @param fingerprinter fingerprint derivation
     */
    public CredentialParser(String apiKeyPrefix, String sessionPrefix, Fingerprinter fingerprinter) {
        if (apiKeyPrefix == null || apiKeyPrefix.isBlank()) {
            throw new IllegalArgumentException("apiKeyPrefix must not be null or blank");
        }
        if (sessionPrefix == null || sessionPrefix.isBlank()) {
            throw new IllegalArgumentException("sessionPrefix must not be null or blank");
        }
        if (apiKeyPrefix.startsWith(sessionPrefix) || sessionPrefix.startsWith(apiKeyPrefix)) {
            throw new IllegalArgumentException("credential prefixes must not overlap");
        }
        if (fingerprinter == null) {
            throw new IllegalArgumentException("fingerprinter must not be null");
        }
        this.prefixes = Map.of(CredentialKind.API_KEY, apiKeyPrefix, CredentialKind.SESSION_TOKEN, sessionPrefix);
        this.fingerprinter = fingerprinter;
    }

    /**
     * Parses a raw bearer value. Never returns null; an unrecognized value yields a
     * credential whose {@link Credential#recognized()} is false.
     *
     * @param rawValue the presented value (nullable)
     */
    public Credential parse(String rawValue) {
        String value = rawValue == null ? "" : rawValue.strip();
        return new Credential(value, classify(value), fingerprinter.fingerprint(value));
    }

    private CredentialKind classify(String value) {
        for (Map.Entry<CredentialKind, String> entry : prefixes.entrySet()) {
            String prefix = entry.getValue();
            if (value.startsWith(prefix) && value.length() - prefix.length() >= MIN_BODY_LENGTH
                    && value.chars().noneMatch(Character::isWhitespace)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /** Returns the configured prefix for a kind. */
    public String prefixFor(CredentialKind kind) {
        return prefixes.get(kind);
    }
}
