package com.candlesignal.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Output of one detector applied to one price series.
 * <p>
 * {@code signalDate} is only set by detectors that fix it themselves; the orchestrator falls
 * back to the market-hours signal date otherwise. {@code details} keeps insertion order so the
 * serialised payload reads in gate order.
 */
@Value
@Builder(toBuilder = true)
public class SignalVerdict {
    DetectorType detector;
    SignalType signalType;
    SignalStrength strength;
    double confidenceScore;
    double price;
    Double volume;
    LocalDate signalDate;
    @Singular("detail")
    Map<String, Object> details;
}
