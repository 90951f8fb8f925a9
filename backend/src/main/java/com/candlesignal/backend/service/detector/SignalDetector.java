package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.model.DetectorType;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalVerdict;

import java.util.Optional;

/**
 * Pure evaluation of one signal rule against a validated price series.
 */
public interface SignalDetector {

    DetectorType type();

    /**
     * @return the verdict, or empty when the rule does not fire or cannot be evaluated
     */
    Optional<SignalVerdict> detect(PriceSeries series);
}
