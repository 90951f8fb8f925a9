package com.candlesignal.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one batch generation run, returned to the caller that started it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {

    public enum Status {
        COMPLETED,
        COMPLETED_WITH_ERRORS
    }

    private String batchId;
    private DetectionMode mode;
    private Status status;
    private Instant startedAt;
    private Instant completedAt;

    private int instrumentsRequested;
    private int instrumentsProcessed;
    private int instrumentsSkipped;
    private int instrumentsFailed;

    @Builder.Default
    private List<SignalRecord> signals = List.of();
    private int supersededCount;
    private int purgedCount;
    private LocalDate retentionCutoff;

    // symbol -> failure message
    @Builder.Default
    private Map<String, String> failures = new LinkedHashMap<>();

    public int signalCount() {
        return signals == null ? 0 : signals.size();
    }
}
