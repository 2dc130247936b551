package com.bastion.validation.translation;

import com.bastion.audit.UserFacingCategory;

/**
 * What a caller sees when a request is denied. Carries no internal detail.
 *
 * @param category      coarse category
 * @param message       short message for display
 * @param helpfulAction what the caller can do next
 * @param errorCode     stable code for support lookups
 */
public record UserFacingError(UserFacingCategory category, String message, String helpfulAction, String errorCode) {

    public UserFacingError {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode must not be null or blank");
        }
        if (helpfulAction == null) {
            helpfulAction = "";
        }
    }

    /** Applies an override, keeping this error's values for any field the override leaves null. */
    public UserFacingError merge(TranslationOverride override) {
        if (override == null) {
            return this;
        }
        return new UserFacingError(category,
                override.message() != null ? override.message() : message,
                override.helpfulAction() != null ? override.helpfulAction() : helpfulAction,
                override.errorCode() != null ? override.errorCode() : errorCode);
    }
}
