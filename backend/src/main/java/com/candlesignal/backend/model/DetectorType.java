package com.candlesignal.backend.model;

/**
 * Closed set of signal detectors. Declaration order is evaluation order.
 */
public enum DetectorType {
    SMA_TREND("sma_50_above"),
    EMA_CROSSOVER("ema_crossover"),
    GOLDEN_CROSS("golden_cross"),
    SMA_VOLUME("sma_volume"),
    CONFIRMED_BUY("confirmed_buy");

    private final String code;

    DetectorType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
