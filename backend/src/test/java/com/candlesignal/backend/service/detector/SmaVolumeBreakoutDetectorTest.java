package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.SignalStrength;
import com.candlesignal.backend.model.SignalType;
import com.candlesignal.backend.model.SignalVerdict;
import com.candlesignal.backend.service.indicator.MovingAverageService;
import com.candlesignal.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SmaVolumeBreakoutDetectorTest {

    private final SmaVolumeBreakoutDetector detector =
            new SmaVolumeBreakoutDetector(new MovingAverageService(), new SignalProperties());

    private static TestSeriesFactory breakout() {
        return TestSeriesFactory.startingAt(100).steps(209, -0.05, 0.05).steps(1, 3.0);
    }

    @Test
    void crossAboveOnHighVolumeIsBuy() {
        SignalVerdict verdict = detector.detect(breakout().tailVolume(1, 1600).build()).orElseThrow();

        assertThat(verdict.getSignalType()).isEqualTo(SignalType.BUY);
        assertThat(verdict.getStrength()).isEqualTo(SignalStrength.STRONG);
        assertThat(verdict.getConfidenceScore()).isEqualTo(0.8);
        assertThat(verdict.getVolume()).isEqualTo(1600.0);
        assertThat(verdict.getDetails()).containsEntry("type", "sma_volume_breakout");
        // the average includes the breakout candle: 1600 / 1030
        assertThat((double) verdict.getDetails().get("volume_ratio")).isCloseTo(1.5534, within(1e-4));
    }

    @Test
    void crossBelowOnHighVolumeIsSell() {
        SignalVerdict verdict = detector.detect(TestSeriesFactory.startingAt(100)
                        .steps(209, 0.05, -0.05)
                        .steps(1, -3.0)
                        .tailVolume(1, 1600)
                        .build())
                .orElseThrow();

        assertThat(verdict.getSignalType()).isEqualTo(SignalType.SELL);
        assertThat(verdict.getDetails()).containsEntry("type", "sma_volume_breakdown");
    }

    @Test
    void ordinaryVolumeGivesNothing() {
        assertThat(detector.detect(breakout().tailVolume(1, 1100).build())).isEmpty();
    }

    @Test
    void missingVolumeGivesNothing() {
        assertThat(detector.detect(breakout().withoutVolume().build())).isEmpty();
    }
}
