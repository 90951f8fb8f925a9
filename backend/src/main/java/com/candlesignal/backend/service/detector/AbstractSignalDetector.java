package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.exception.InsufficientDataException;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalVerdict;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Turns data shortfalls and computation errors into "no verdict" so one bad series
 * never stops the remaining detectors.
 */
@Slf4j
public abstract class AbstractSignalDetector implements SignalDetector {

    @Override
    public final Optional<SignalVerdict> detect(PriceSeries series) {
        if (series == null || series.isEmpty()) {
            return Optional.empty();
        }
        try {
            return evaluate(series);
        } catch (InsufficientDataException e) {
            log.debug("{} skipped: {}", type(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Error in {} detection on {}: {}", type(), series, e.getMessage(), e);
            return Optional.empty();
        }
    }

    protected abstract Optional<SignalVerdict> evaluate(PriceSeries series);

    protected void requireCandles(PriceSeries series, int required) {
        if (series.size() < required) {
            throw new InsufficientDataException(type().code(), required, series.size());
        }
    }

    protected static boolean crossedAbove(double previous, double previousReference, double current, double currentReference) {
        return previous <= previousReference && current > currentReference;
    }

    protected static boolean crossedBelow(double previous, double previousReference, double current, double currentReference) {
        return previous >= previousReference && current < currentReference;
    }
}
