package com.candlesignal.backend.model;

public enum SignalType {
    BUY,
    SELL
}
