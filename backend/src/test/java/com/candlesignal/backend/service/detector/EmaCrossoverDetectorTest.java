package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalStrength;
import com.candlesignal.backend.model.SignalType;
import com.candlesignal.backend.model.SignalVerdict;
import com.candlesignal.backend.service.indicator.MovingAverageService;
import com.candlesignal.backend.service.indicator.RsiService;
import com.candlesignal.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmaCrossoverDetectorTest {

    private SignalProperties properties;
    private EmaCrossoverDetector detector;

    @BeforeEach
    void setUp() {
        properties = new SignalProperties();
        detector = new EmaCrossoverDetector(new MovingAverageService(), new RsiService(), properties);
    }

    @Test
    void bullishCrossBelowOverboughtIsBuy() {
        SignalVerdict verdict = detector.detect(bullish()).orElseThrow();

        assertThat(verdict.getSignalType()).isEqualTo(SignalType.BUY);
        assertThat(verdict.getStrength()).isEqualTo(SignalStrength.MODERATE);
        assertThat(verdict.getConfidenceScore()).isEqualTo(0.7);
        assertThat((double) verdict.getDetails().get("rsi")).isCloseTo(64.65, within(0.01));
        assertThat(verdict.getDetails()).containsKeys("ema_12", "ema_26");
    }

    @Test
    void bearishCrossAboveOversoldIsSell() {
        PriceSeries series = TestSeriesFactory.startingAt(60).steps(40, 1, -0.4).steps(11, -2, 1.2).build();

        SignalVerdict verdict = detector.detect(series).orElseThrow();

        assertThat(verdict.getSignalType()).isEqualTo(SignalType.SELL);
        assertThat(verdict.getPrice()).isCloseTo(66.0, within(1e-9));
    }

    @Test
    void overboughtCrossIsIgnored() {
        properties.getEmaCrossover().setOverbought(60.0);

        assertThat(detector.detect(bullish())).isEmpty();
    }

    @Test
    void needsSlowPeriodOfCandles() {
        assertThat(detector.detect(TestSeriesFactory.startingAt(100).steps(24, 1).build())).isEmpty();
    }

    private static PriceSeries bullish() {
        return TestSeriesFactory.startingAt(100).steps(40, -1, 0.4).steps(11, 2, -1.2).build();
    }
}
