package com.bastion.validation.translation;

/**
 * Configured replacement text for one error kind. Null fields keep the built-in value.
 */
public record TranslationOverride(String message, String helpfulAction, String errorCode) {
}
