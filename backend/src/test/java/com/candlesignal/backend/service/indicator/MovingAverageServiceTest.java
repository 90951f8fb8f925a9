package com.candlesignal.backend.service.indicator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MovingAverageServiceTest {

    private final MovingAverageService service = new MovingAverageService();

    @Test
    void smaIsExactWindowMeanAndUndefinedBeforeWindowFills() {
        IndicatorSeries sma = service.sma(new double[]{1, 2, 3, 4, 5, 6}, 3);

        assertThat(sma.isDefined(0)).isFalse();
        assertThat(sma.isDefined(1)).isFalse();
        assertThat(sma.get(2)).isEqualTo(2.0);
        assertThat(sma.get(3)).isEqualTo(3.0);
        assertThat(sma.last()).isEqualTo(5.0);
    }

    @Test
    void emaStartsAtFirstValueAndUsesAdjustedWeights() {
        IndicatorSeries ema = service.ema(new double[]{10, 11, 12}, 3);

        // alpha 0.5: weights 1, 0.5, 0.25 from newest
        assertThat(ema.get(0)).isEqualTo(10.0);
        assertThat(ema.get(1)).isCloseTo((11 + 0.5 * 10) / 1.5, within(1e-12));
        assertThat(ema.get(2)).isCloseTo((12 + 0.5 * 11 + 0.25 * 10) / 1.75, within(1e-12));
    }

    @Test
    void emaOfConstantSeriesIsConstant() {
        double[] values = new double[40];
        java.util.Arrays.fill(values, 42.5);

        IndicatorSeries ema = service.ema(values, 20);

        for (int i = 0; i < values.length; i++) {
            assertThat(ema.get(i)).isCloseTo(42.5, within(1e-9));
        }
    }

    @Test
    void emaIsDeterministic() {
        double[] values = {5, 7, 6, 9, 11, 10, 12};

        assertThat(service.ema(values, 5)).isEqualTo(service.ema(values.clone(), 5));
    }

    @Test
    void trailingMeanUsesAvailableHistoryWhenShort() {
        double[] values = {1, 2, 3, 4, 5, 6};

        assertThat(service.trailingMean(values, 2)).isEqualTo(5.5);
        assertThat(service.trailingMean(values, 50)).isEqualTo(3.5);
        assertThat(service.trailingMean(new double[0], 5)).isNaN();
    }

    @Test
    void rejectsNonPositivePeriod() {
        assertThatThrownBy(() -> service.sma(new double[]{1, 2}, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.ema(new double[]{1, 2}, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
