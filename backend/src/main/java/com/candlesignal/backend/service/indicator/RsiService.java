package com.candlesignal.backend.service.indicator;

import org.springframework.stereotype.Service;

@Service
public class RsiService {

    public static final int DEFAULT_PERIOD = 14;

    public IndicatorSeries rsi(double[] values) {
        return rsi(values, DEFAULT_PERIOD);
    }

    /**
     * Relative strength index from simple rolling means of gains and losses over {@code period}
     * deltas. Undefined ({@code NaN}) until {@code period} deltas exist.
     * <p>
     * A window without losses reads 100, a window without any movement reads 50.
     */
    public IndicatorSeries rsi(double[] values, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (i < period) {
                result[i] = Double.NaN;
                continue;
            }
            double gains = 0.0;
            double losses = 0.0;
            for (int k = i - period + 1; k <= i; k++) {
                double change = values[k] - values[k - 1];
                if (change > 0) {
                    gains += change;
                } else if (change < 0) {
                    losses -= change;
                }
            }
            double avgGain = gains / period;
            double avgLoss = losses / period;
            result[i] = toRsi(avgGain, avgLoss);
        }
        return new IndicatorSeries(result);
    }

    static double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return avgGain == 0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
