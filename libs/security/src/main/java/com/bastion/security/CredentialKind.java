package com.bastion.security;

/**
 * The two kinds of bearer credential the gateway recognizes.
 */
public enum CredentialKind {

    /** Long-lived machine credential; may have no owning user. */
    API_KEY,

    /** Interactive session credential; always owned by a user. */
    SESSION_TOKEN
}
