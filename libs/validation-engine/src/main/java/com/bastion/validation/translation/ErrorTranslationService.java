package com.bastion.validation.translation;

import com.bastion.audit.ErrorKind;
import com.bastion.audit.UserFacingCategory;
import com.bastion.audit.ValidatorName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Maps every {@link ErrorKind} to the {@link UserFacingError} callers see.
 *
 * <p>The table is total: construction fails with {@link TranslationConfigurationException} if any
 * kind is missing or mapped to a category that does not match its error category. Cross-tenant
 * denials are presented as "not found" so callers cannot discover other tenants' resources.
 */
public class ErrorTranslationService {

    private static final Logger log = LoggerFactory.getLogger(ErrorTranslationService.class);

    private final Map<ErrorKind, UserFacingError> translations;
    private final AtomicLongArray exerciseCounts = new AtomicLongArray(ErrorKind.values().length);

    public ErrorTranslationService(Map<ErrorKind, UserFacingError> translations) {
        this.translations = Collections.unmodifiableMap(verified(translations));
        log.info("Error translation table loaded with {} entries", this.translations.size());
    }

    /** Built-in translations. */
    public static ErrorTranslationService withDefaults() {
        return new ErrorTranslationService(defaultTranslations());
    }

    /** Built-in translations with configured overrides merged over them. */
    public static ErrorTranslationService withOverrides(Map<ErrorKind, TranslationOverride> overrides) {
        Map<ErrorKind, UserFacingError> merged = defaultTranslations();
        if (overrides != null) {
            overrides.forEach((kind, override) -> merged.computeIfPresent(kind, (k, base) -> base.merge(override)));
        }
        return new ErrorTranslationService(merged);
    }

    /**
     * Translates an error kind reported by {@code origin}. Counts the translation for coverage.
     */
    public UserFacingError translate(ErrorKind kind, ValidatorName origin) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        exerciseCounts.incrementAndGet(kind.ordinal());
        UserFacingError error = translations.get(kind);
        log.debug("Translated {} from {} validator to {}", kind, origin, error.errorCode());
        return error;
    }

    public TranslationCoverage coverage() {
        Map<ErrorKind, Long> counts = new EnumMap<>(ErrorKind.class);
        int exercised = 0;
        for (ErrorKind kind : ErrorKind.values()) {
            long count = exerciseCounts.get(kind.ordinal());
            counts.put(kind, count);
            if (count > 0) {
                exercised++;
            }
        }
        return new TranslationCoverage(ErrorKind.values().length, translations.size(), exercised,
                Collections.unmodifiableMap(counts));
    }

    private static Map<ErrorKind, UserFacingError> verified(Map<ErrorKind, UserFacingError> candidate) {
        if (candidate == null) {
            throw new TranslationConfigurationException("translation table must not be null");
        }
        List<String> problems = new ArrayList<>();
        Map<ErrorKind, UserFacingError> copy = new EnumMap<>(ErrorKind.class);
        for (ErrorKind kind : ErrorKind.values()) {
            UserFacingError error = candidate.get(kind);
            if (error == null) {
                problems.add(kind + " has no translation");
                continue;
            }
            UserFacingCategory expected = UserFacingCategory.forCategory(kind.category());
            if (error.category() != expected) {
                problems.add(kind + " must translate to " + expected + " but maps to " + error.category());
            }
            copy.put(kind, error);
        }
        if (!problems.isEmpty()) {
            throw new TranslationConfigurationException("Invalid error translation table: " + String.join("; ", problems));
        }
        return copy;
    }

    static Map<ErrorKind, UserFacingError> defaultTranslations() {
        Map<ErrorKind, UserFacingError> table = new EnumMap<>(ErrorKind.class);
        table.put(ErrorKind.NOT_FOUND, invalid("Please log in again",
                "Check that you are using a current API key or session", "AUTH_INVALID_001"));
        table.put(ErrorKind.EXPIRED, invalid("Please log in again",
                "Refresh your session to continue", "AUTH_EXPIRED_001"));
        table.put(ErrorKind.MALFORMED, invalid("Please log in again",
                "Your session may have been corrupted", "AUTH_FORMAT_001"));
        table.put(ErrorKind.CROSS_TENANT_DENIED, denied("Resource not found",
                "Try searching for what you're looking for", "ACCESS_DENIED_001"));
        table.put(ErrorKind.ACCESS_LEVEL_INSUFFICIENT, denied("Access not available for your account",
                "Contact your administrator if you need access", "PERM_DENIED_001"));
        table.put(ErrorKind.TENANT_INACTIVE, denied("Access not available for your account",
                "Contact your administrator to reactivate your organization", "TENANT_INACTIVE_001"));
        table.put(ErrorKind.INTERNAL_FAULT, unavailable("Service temporarily unavailable",
                "Please try again in a moment", "SYS_FAULT_001"));
        table.put(ErrorKind.VALIDATOR_TIMEOUT, unavailable("Service temporarily unavailable",
                "Please try again in a moment", "TIMEOUT_001"));
        table.put(ErrorKind.STORE_UNAVAILABLE, unavailable("Service temporarily unavailable",
                "Please try again in a few minutes", "DB_CONN_001"));
        return table;
    }

    private static UserFacingError invalid(String message, String action, String code) {
        return new UserFacingError(UserFacingCategory.INVALID_CREDENTIALS, message, action, code);
    }

    private static UserFacingError denied(String message, String action, String code) {
        return new UserFacingError(UserFacingCategory.ACCESS_DENIED, message, action, code);
    }

    private static UserFacingError unavailable(String message, String action, String code) {
        return new UserFacingError(UserFacingCategory.TEMPORARILY_UNAVAILABLE, message, action, code);
    }
}
