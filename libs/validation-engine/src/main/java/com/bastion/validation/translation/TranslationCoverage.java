package com.bastion.validation.translation;

import com.bastion.audit.ErrorKind;

import java.util.Map;

/**
 * How much of the error taxonomy the translation table covers and how much of it live traffic
 * has exercised.
 *
 * @param knownKinds     number of error kinds in the taxonomy
 * @param mappedKinds    kinds with a translation (always equal to {@code knownKinds} once constructed)
 * @param exercisedKinds kinds translated at least once
 * @param exerciseCounts translations served per kind
 */
public record TranslationCoverage(int knownKinds, int mappedKinds, int exercisedKinds,
                                  Map<ErrorKind, Long> exerciseCounts) {

    public double mappedPercent() {
        return knownKinds == 0 ? 100.0 : mappedKinds * 100.0 / knownKinds;
    }

    public double exercisedPercent() {
        return knownKinds == 0 ? 100.0 : exercisedKinds * 100.0 / knownKinds;
    }
}
