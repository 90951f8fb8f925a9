package com.candlesignal.backend.model;

public enum SignalStrength {
    WEAK,
    MODERATE,
    STRONG
}
