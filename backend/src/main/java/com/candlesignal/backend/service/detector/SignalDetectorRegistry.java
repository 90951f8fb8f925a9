package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.model.DetectionMode;
import com.candlesignal.backend.model.DetectorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup from {@link DetectorType} to its detector bean. Every type must be covered.
 */
@Slf4j
@Component
public class SignalDetectorRegistry {

    private final Map<DetectorType, SignalDetector> detectors;

    public SignalDetectorRegistry(List<SignalDetector> detectorBeans) {
        Map<DetectorType, SignalDetector> byType = new EnumMap<>(DetectorType.class);
        for (SignalDetector detector : detectorBeans) {
            SignalDetector previous = byType.put(detector.type(), detector);
            if (previous != null) {
                throw new IllegalStateException("Duplicate detector for " + detector.type() + ": "
                        + previous.getClass().getSimpleName() + " and " + detector.getClass().getSimpleName());
            }
        }
        for (DetectorType type : DetectorType.values()) {
            if (!byType.containsKey(type)) {
                throw new IllegalStateException("No detector registered for " + type);
            }
        }
        this.detectors = Collections.unmodifiableMap(byType);
        log.info("Registered signal detectors: {}", detectors.keySet());
    }

    /**
     * Detectors selected by {@code mode}, in evaluation order.
     */
    public List<SignalDetector> forMode(DetectionMode mode) {
        List<SignalDetector> selected = new ArrayList<>();
        for (DetectorType type : mode.detectors()) {
            selected.add(detectors.get(type));
        }
        return selected;
    }
}
