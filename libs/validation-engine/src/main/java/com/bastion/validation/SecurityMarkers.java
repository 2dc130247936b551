package com.bastion.validation;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * SLF4J markers for log events that security operations route separately.
 */
public final class SecurityMarkers {

    /** Cross-tenant blocks, security discrepancies and access degradations. */
    public static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");

    private SecurityMarkers() {
        // constants
    }
}
