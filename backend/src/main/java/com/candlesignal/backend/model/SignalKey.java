package com.candlesignal.backend.model;

import java.time.LocalDate;

/**
 * Persistence identity of a signal: one row per instrument and signal date.
 */
public record SignalKey(Long instrumentId, LocalDate signalDate) {

    public static SignalKey of(SignalRecord record) {
        return new SignalKey(record.getInstrumentId(), record.getSignalDate());
    }
}
