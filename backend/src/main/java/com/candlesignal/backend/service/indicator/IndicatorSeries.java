package com.candlesignal.backend.service.indicator;

import java.util.Arrays;

/**
 * Indicator values index-aligned with the series they were computed from.
 * Positions where the window has not filled yet hold {@code NaN}.
 */
public final class IndicatorSeries {

    private final double[] values;

    IndicatorSeries(double[] values) {
        this.values = values;
    }

    public static IndicatorSeries of(double... values) {
        return new IndicatorSeries(values.clone());
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /**
     * Value counted from the end: {@code fromEnd(1)} is the last value, {@code fromEnd(2)} the one before.
     */
    public double fromEnd(int offset) {
        if (offset < 1 || offset > values.length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside series of " + values.length);
        }
        return values[values.length - offset];
    }

    public double last() {
        return fromEnd(1);
    }

    public boolean isDefined(int index) {
        return !Double.isNaN(values[index]);
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Element-wise {@code this - other}. Both series must have the same length.
     */
    public IndicatorSeries minus(IndicatorSeries other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Series lengths differ: " + values.length + " vs " + other.values.length);
        }
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] - other.values[i];
        }
        return new IndicatorSeries(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndicatorSeries other)) {
            return false;
        }
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "IndicatorSeries" + Arrays.toString(values);
    }
}
