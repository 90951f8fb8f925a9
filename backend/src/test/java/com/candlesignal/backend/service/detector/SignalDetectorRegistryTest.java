package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.DetectionMode;
import com.candlesignal.backend.model.DetectorType;
import com.candlesignal.backend.service.indicator.MacdService;
import com.candlesignal.backend.service.indicator.MovingAverageService;
import com.candlesignal.backend.service.indicator.RsiService;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalDetectorRegistryTest {

    private final SignalProperties properties = new SignalProperties();
    private final MovingAverageService movingAverageService = new MovingAverageService();
    private final RsiService rsiService = new RsiService();

    private List<SignalDetector> allDetectors() {
        // registration order deliberately differs from evaluation order
        return List.of(
                new ConfirmedBuyDetector(movingAverageService, rsiService,
                        new MacdService(movingAverageService, properties), properties, Clock.systemUTC()),
                new GoldenCrossDetector(movingAverageService, properties),
                new SmaVolumeBreakoutDetector(movingAverageService, properties),
                new EmaCrossoverDetector(movingAverageService, rsiService, properties),
                new SmaTrendDetector(movingAverageService, properties));
    }

    @Test
    void returnsDetectorsInEvaluationOrder() {
        SignalDetectorRegistry registry = new SignalDetectorRegistry(allDetectors());

        assertThat(registry.forMode(DetectionMode.ALL_DETECTORS))
                .extracting(SignalDetector::type)
                .containsExactly(DetectorType.values());
        assertThat(registry.forMode(DetectionMode.CONFIRMED_BUY_ONLY))
                .extracting(SignalDetector::type)
                .containsExactly(DetectorType.CONFIRMED_BUY);
    }

    @Test
    void failsWhenTypeHasNoDetector() {
        List<SignalDetector> partial = allDetectors().subList(0, 4);

        assertThatThrownBy(() -> new SignalDetectorRegistry(partial))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SMA_TREND");
    }

    @Test
    void failsOnDuplicateType() {
        List<SignalDetector> detectors = new java.util.ArrayList<>(allDetectors());
        detectors.add(new SmaTrendDetector(movingAverageService, properties));

        assertThatThrownBy(() -> new SignalDetectorRegistry(detectors))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }
}
