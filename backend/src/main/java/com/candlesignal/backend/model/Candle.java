package com.candlesignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One daily OHLCV observation. Timestamps are UTC.
 * A {@code null} volume means the data source did not supply one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candle {
    private LocalDateTime timestamp;
    private double open;
    private double high;
    private double low;
    private double close;
    private Double volume;
}
