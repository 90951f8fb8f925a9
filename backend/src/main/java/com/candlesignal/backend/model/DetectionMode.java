package com.candlesignal.backend.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which detectors a generation pass runs.
 */
public enum DetectionMode {
    CONFIRMED_BUY_ONLY(EnumSet.of(DetectorType.CONFIRMED_BUY)),
    ALL_DETECTORS(EnumSet.allOf(DetectorType.class));

    private final Set<DetectorType> detectors;

    DetectionMode(EnumSet<DetectorType> detectors) {
        this.detectors = Collections.unmodifiableSet(detectors);
    }

    /**
     * Selected detectors in evaluation order.
     */
    public Set<DetectorType> detectors() {
        return detectors;
    }
}
