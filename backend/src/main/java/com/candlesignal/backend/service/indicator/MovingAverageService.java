package com.candlesignal.backend.service.indicator;

import org.springframework.stereotype.Service;

@Service
public class MovingAverageService {

    /**
     * Exponential moving average with span {@code period}: the weight of an observation k periods
     * old is proportional to (1 - alpha)^k, alpha = 2 / (period + 1). Early positions average over
     * whatever history exists instead of being left undefined.
     */
    public IndicatorSeries ema(double[] values, int period) {
        requirePositive(period);
        double[] result = new double[values.length];
        double decay = 1.0 - 2.0 / (period + 1.0);
        double weightedSum = 0.0;
        double weightTotal = 0.0;
        for (int i = 0; i < values.length; i++) {
            weightedSum = values[i] + decay * weightedSum;
            weightTotal = 1.0 + decay * weightTotal;
            result[i] = weightedSum / weightTotal;
        }
        return new IndicatorSeries(result);
    }

    public IndicatorSeries ema(IndicatorSeries series, int period) {
        return ema(series.toArray(), period);
    }

    /**
     * Trailing arithmetic mean; {@code NaN} until {@code period} observations exist.
     */
    public IndicatorSeries sma(double[] values, int period) {
        requirePositive(period);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (i < period - 1) {
                result[i] = Double.NaN;
                continue;
            }
            double sum = 0.0;
            for (int k = i - period + 1; k <= i; k++) {
                sum += values[k];
            }
            result[i] = sum / period;
        }
        return new IndicatorSeries(result);
    }

    /**
     * Mean of the last {@code window} values, or of all values when fewer exist.
     */
    public double trailingMean(double[] values, int window) {
        requirePositive(window);
        if (values.length == 0) {
            return Double.NaN;
        }
        int start = Math.max(0, values.length - window);
        double sum = 0.0;
        for (int i = start; i < values.length; i++) {
            sum += values[i];
        }
        return sum / (values.length - start);
    }

    private static void requirePositive(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
    }
}
