package com.candlesignal.backend.service;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.SignalKey;
import com.candlesignal.backend.model.SignalRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which records of a batch are persisted and which stored records expire.
 * <p>
 * One record survives per instrument and signal date: the most confident one, the later
 * record on a tie.
 */
@Component
@RequiredArgsConstructor
public class SignalRetentionPolicy {

    private final SignalProperties signalProperties;

    public record RetentionPlan(LocalDate cutoff, List<SignalRecord> retained, int supersededCount, int expiredCount) {}

    public LocalDate cutoff(LocalDate today) {
        return today.minusDays(signalProperties.getRetention().getDays());
    }

    public RetentionPlan plan(List<SignalRecord> batch, LocalDate today) {
        LocalDate cutoff = cutoff(today);
        Map<SignalKey, SignalRecord> winners = new LinkedHashMap<>();
        int superseded = 0;
        int expired = 0;
        for (SignalRecord record : batch) {
            if (record.getSignalDate().isBefore(cutoff)) {
                expired++;
                continue;
            }
            SignalKey key = SignalKey.of(record);
            SignalRecord current = winners.get(key);
            if (current == null) {
                winners.put(key, record);
                continue;
            }
            superseded++;
            if (record.getConfidenceScore() >= current.getConfidenceScore()) {
                winners.put(key, record);
            }
        }
        return new RetentionPlan(cutoff, new ArrayList<>(winners.values()), superseded, expired);
    }
}
