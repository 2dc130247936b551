package com.bastion.validation;

import com.bastion.audit.SourceOfTruth;

/**
 * Decides whose outcome the caller sees. Versioned so every comparison record states which
 * policy was in force.
 */
public record SelectionPolicy(int version, SourceOfTruth sourceOfTruth) {

    /** Shadow mode: legacy decides, enhanced is only observed. */
    public static final SelectionPolicy SHADOW = new SelectionPolicy(1, SourceOfTruth.LEGACY);

    public SelectionPolicy {
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        if (sourceOfTruth == null) {
            throw new IllegalArgumentException("sourceOfTruth must not be null");
        }
    }
}
