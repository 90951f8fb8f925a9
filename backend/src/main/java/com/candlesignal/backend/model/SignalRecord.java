package com.candlesignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Persistence-ready signal: a verdict with instrument identity attached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRecord {

    private Long instrumentId;
    private String symbol;
    private String exchange;
    private MarketType marketType;
    private String baseAsset;

    private DetectorType detector;
    private SignalType signalType;
    private SignalStrength signalStrength;
    private double confidenceScore;
    private double price;
    private Double volume;
    private LocalDate signalDate;

    private Instant generatedAt;
    @Builder.Default
    private boolean processed = false;

    // JSON of the detector detail payload, consumed by reports
    private String signalData;
    private Map<String, Object> details;
    private String justification;
}
