package com.bastion.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts bearer secrets before they reach logs or audit payloads.
 * <p>
 * Two modes: {@link #redact(Map)} replaces the values of sensitive-looking keys in a
 * structured log map; {@link #mask(String)} keeps only a short prefix of a secret so that an
 * operator can tell credential kinds apart without learning the secret.
 * All key matching is case-insensitive.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Number of leading characters {@link #mask(String)} keeps. */
    public static final int MASK_VISIBLE_CHARS = 6;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api_key",
            "credential", "bearer", "pepper"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive key patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive key patterns (case-insensitive).
     *
     * @param patterns key name fragments to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive values replaced by {@value #REDACTED}.
     * Keys that merely carry a fingerprint (e.g. {@code credentialFingerprint}) are kept,
     * because a fingerprint is already non-reversible. Null input returns an empty map.
     *
     * @param data the log data map
     * @return a new map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String key = entry.getKey();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else {
                result.put(key, entry.getValue());
            }
        }
        return result;
    }

    /**
     * Checks whether a key name matches any sensitive pattern.
     *
     * @param fieldName the key name to check
     * @return true if the key is sensitive and not a fingerprint key
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        if (fieldName.toLowerCase().contains("fingerprint")) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Masks a secret, keeping at most {@value #MASK_VISIBLE_CHARS} leading characters.
     * Secrets no longer than that are fully replaced.
     *
     * @param secret the raw secret (nullable)
     * @return the masked form, or {@value #REDACTED} for null/short input
     */
    public String mask(String secret) {
        if (secret == null || secret.length() <= MASK_VISIBLE_CHARS) {
            return REDACTED;
        }
        return secret.substring(0, MASK_VISIBLE_CHARS) + "****";
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}
