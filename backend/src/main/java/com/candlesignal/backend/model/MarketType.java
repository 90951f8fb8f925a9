package com.candlesignal.backend.model;

public enum MarketType {
    STOCK,
    CRYPTO
}
