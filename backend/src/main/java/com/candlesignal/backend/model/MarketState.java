package com.candlesignal.backend.model;

public enum MarketState {
    OPEN,
    CLOSED
}
