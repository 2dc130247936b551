package com.bastion.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts the bearer credential from request headers.
 * <p>
 * The {@code Authorization: Bearer <value>} header wins; the {@code X-API-Key} header is a
 * fallback for machine clients that cannot set Authorization.
 */
public final class BearerTokenExtractor {

    /** Header carrying the bearer credential. */
    public static final String AUTHORIZATION_HEADER = "Authorization";

    /** Fallback header for API keys. */
    public static final String API_KEY_HEADER = "X-API-Key";

    private static final String BEARER = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the credential from an Authorization header value.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the credential, or empty if the header is missing or not a Bearer header
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= BEARER.length()
                || !trimmed.substring(0, BEARER.length()).toLowerCase(Locale.ROOT).equals(BEARER)
                || !Character.isWhitespace(trimmed.charAt(BEARER.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * Extracts the credential from the Authorization header, falling back to the API key header.
     *
     * @param authorizationHeader Authorization header value (nullable)
     * @param apiKeyHeader        X-API-Key header value (nullable)
     */
    public static Optional<String> extract(String authorizationHeader, String apiKeyHeader) {
        Optional<String> bearer = extract(authorizationHeader);
        if (bearer.isPresent()) {
            return bearer;
        }
        if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(apiKeyHeader.strip());
    }
}
