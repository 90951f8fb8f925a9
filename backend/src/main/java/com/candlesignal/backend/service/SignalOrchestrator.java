package com.candlesignal.backend.service;

import com.candlesignal.backend.model.DetectionMode;
import com.candlesignal.backend.model.Instrument;
import com.candlesignal.backend.model.MarketValidationResult;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalRecord;
import com.candlesignal.backend.model.SignalVerdict;
import com.candlesignal.backend.service.detector.SignalDetector;
import com.candlesignal.backend.service.detector.SignalDetectorRegistry;
import com.candlesignal.backend.service.market.MarketHoursService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Runs the detectors of a mode against one instrument's market-hours validated series.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignalOrchestrator {

    private final MarketHoursService marketHoursService;
    private final SignalDetectorRegistry detectorRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public List<SignalRecord> generate(Instrument instrument, PriceSeries rawSeries, DetectionMode mode) {
        MarketValidationResult validation = instrument.isCrypto()
                ? marketHoursService.continuousMarket(rawSeries)
                : marketHoursService.validateForSignals(rawSeries, instrument.exchange());
        log.info("🕒 {}: {}", instrument.symbol(), validation.justification());

        if (!validation.hasData()) {
            return List.of();
        }

        List<SignalRecord> records = new ArrayList<>();
        for (SignalDetector detector : detectorRegistry.forMode(mode)) {
            Optional<SignalVerdict> verdict;
            try {
                verdict = detector.detect(validation.series());
            } catch (RuntimeException e) {
                log.error("Detector {} failed for {}", detector.type(), instrument.symbol(), e);
                continue;
            }
            verdict.map(v -> toRecord(instrument, validation, v)).ifPresent(records::add);
        }

        if (!records.isEmpty()) {
            log.info("📈 {} signal(s) for {}: {}", records.size(), instrument.symbol(),
                    records.stream().map(r -> r.getDetector().code()).toList());
        }
        return records;
    }

    private SignalRecord toRecord(Instrument instrument, MarketValidationResult validation, SignalVerdict verdict) {
        return SignalRecord.builder()
                .instrumentId(instrument.id())
                .symbol(instrument.symbol())
                .exchange(instrument.exchange())
                .marketType(instrument.marketType())
                .baseAsset(instrument.baseAsset())
                .detector(verdict.getDetector())
                .signalType(verdict.getSignalType())
                .signalStrength(verdict.getStrength())
                .confidenceScore(verdict.getConfidenceScore())
                .price(verdict.getPrice())
                .volume(verdict.getVolume())
                .signalDate(verdict.getSignalDate() != null ? verdict.getSignalDate() : validation.signalDate())
                .generatedAt(clock.instant())
                .details(new LinkedHashMap<>(verdict.getDetails()))
                .signalData(serialize(instrument, verdict))
                .justification(validation.justification())
                .build();
    }

    private String serialize(Instrument instrument, SignalVerdict verdict) {
        try {
            return objectMapper.writeValueAsString(verdict.getDetails());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} details for {}", verdict.getDetector(), instrument.symbol(), e);
            return null;
        }
    }
}
