package com.bastion.audit;

/**
 * Identifies which validation path produced an outcome.
 */
public enum ValidatorName {

    /** The trusted, pre-existing path. Response source until promotion. */
    LEGACY,

    /** The stricter path running in shadow mode. */
    ENHANCED;

    /** Lowercase name used in metric tags and span names. */
    public String tagValue() {
        return name().toLowerCase();
    }
}
