package com.candlesignal.backend.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, time-indexed candle sequence for one instrument.
 * <p>
 * Timestamps are strictly increasing. The candles are copied on construction so the series
 * cannot change while detectors read it.
 */
public final class PriceSeries {

    private static final PriceSeries EMPTY = new PriceSeries(List.of());

    private final List<Candle> candles;

    private PriceSeries(List<Candle> candles) {
        this.candles = candles;
    }

    public static PriceSeries of(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return EMPTY;
        }
        List<Candle> copy = new ArrayList<>(candles.size());
        LocalDateTime previous = null;
        for (Candle candle : candles) {
            if (candle == null || candle.getTimestamp() == null) {
                throw new IllegalArgumentException("Candle without timestamp at index " + copy.size());
            }
            if (previous != null && !candle.getTimestamp().isAfter(previous)) {
                throw new IllegalArgumentException("Candles must be strictly increasing in time: "
                        + candle.getTimestamp() + " follows " + previous);
            }
            previous = candle.getTimestamp();
            copy.add(Candle.builder()
                    .timestamp(candle.getTimestamp())
                    .open(candle.getOpen())
                    .high(candle.getHigh())
                    .low(candle.getLow())
                    .close(candle.getClose())
                    .volume(candle.getVolume())
                    .build());
        }
        return new PriceSeries(Collections.unmodifiableList(copy));
    }

    public static PriceSeries empty() {
        return EMPTY;
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public Candle get(int index) {
        return candles.get(index);
    }

    public Candle last() {
        if (candles.isEmpty()) {
            throw new IllegalStateException("Empty series has no last candle");
        }
        return candles.get(candles.size() - 1);
    }

    public LocalDate lastDate() {
        return last().getTimestamp().toLocalDate();
    }

    public List<Candle> candles() {
        return candles;
    }

    /**
     * Series without its final candle. Used to drop a still-forming period.
     */
    public PriceSeries withoutLast() {
        if (candles.size() <= 1) {
            return EMPTY;
        }
        return new PriceSeries(candles.subList(0, candles.size() - 1));
    }

    /**
     * Trailing window of at most {@code count} candles.
     */
    public PriceSeries tail(int count) {
        if (count >= candles.size()) {
            return this;
        }
        if (count <= 0) {
            return EMPTY;
        }
        return new PriceSeries(candles.subList(candles.size() - count, candles.size()));
    }

    public double[] closes() {
        double[] values = new double[candles.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = candles.get(i).getClose();
        }
        return values;
    }

    /**
     * Volumes as doubles. Only meaningful when {@link #hasVolume()} is true.
     */
    public double[] volumes() {
        double[] values = new double[candles.size()];
        for (int i = 0; i < values.length; i++) {
            Double volume = candles.get(i).getVolume();
            values[i] = volume == null ? Double.NaN : volume;
        }
        return values;
    }

    public boolean hasVolume() {
        if (candles.isEmpty()) {
            return false;
        }
        for (Candle candle : candles) {
            if (candle.getVolume() == null) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        if (candles.isEmpty()) {
            return "PriceSeries[empty]";
        }
        return "PriceSeries[" + candles.size() + " candles, " + candles.get(0).getTimestamp().toLocalDate()
                + ".." + lastDate() + "]";
    }
}
