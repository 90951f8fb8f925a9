package com.candlesignal.backend.service;

import com.candlesignal.backend.model.DetectorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class SignalMetricsService {

    private final MeterRegistry meterRegistry;

    private final Map<DetectorType, Counter> generatedByDetector = new EnumMap<>(DetectorType.class);
    private Counter instrumentsFailedCounter;
    private Counter instrumentsSkippedCounter;
    private Timer batchDurationTimer;

    @jakarta.annotation.PostConstruct
    void init() {
        for (DetectorType type : DetectorType.values()) {
            generatedByDetector.put(type, Counter.builder("signals_generated_total")
                    .tag("detector", type.code())
                    .register(meterRegistry));
        }
        instrumentsFailedCounter = Counter.builder("signal_instruments_failed_total").register(meterRegistry);
        instrumentsSkippedCounter = Counter.builder("signal_instruments_skipped_total").register(meterRegistry);
        batchDurationTimer = Timer.builder("signal_batch_duration").register(meterRegistry);
    }

    public void recordSignalGenerated(DetectorType detector) {
        Counter counter = generatedByDetector.get(detector);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordInstrumentFailed() {
        if (instrumentsFailedCounter != null) {
            instrumentsFailedCounter.increment();
        }
    }

    public void recordInstrumentSkipped() {
        if (instrumentsSkippedCounter != null) {
            instrumentsSkippedCounter.increment();
        }
    }

    public void recordBatchDuration(Duration duration) {
        if (batchDurationTimer != null) {
            batchDurationTimer.record(duration);
        }
    }
}
