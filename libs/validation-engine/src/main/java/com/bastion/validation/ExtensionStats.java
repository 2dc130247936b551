package com.bastion.validation;

/**
 * Counters of extension attempts made by {@link TokenExtensionService}.
 */
public record ExtensionStats(long attempts, long extended, long conflicts, long notFound, long failed) {

    /**
     * Attempts that left the credential extended, as a percentage. A conflict counts: another
     * instance already extended the same window. 100 when nothing was attempted.
     */
    public double successPercent() {
        return attempts == 0 ? 100.0 : (extended + conflicts) * 100.0 / attempts;
    }
}
