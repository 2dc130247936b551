package com.bastion.validation.store;

/**
 * Result of a conditional expiry extension.
 */
public enum ExtensionResult {

    /** This caller's write won; the expiry now equals the requested value. */
    EXTENDED,

    /** The stored expiry no longer matched the expected value; someone else extended first. */
    CONFLICT,

    /** The credential no longer exists. */
    NOT_FOUND
}
