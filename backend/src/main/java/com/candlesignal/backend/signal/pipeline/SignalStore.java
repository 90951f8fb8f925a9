package com.candlesignal.backend.signal.pipeline;

import com.candlesignal.backend.model.SignalRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Signal persistence. At most one record is kept per instrument and signal date.
 */
public interface SignalStore {

    /**
     * Removes records dated strictly before {@code cutoff}.
     *
     * @return number of removed records
     */
    int purgeBefore(LocalDate cutoff);

    /**
     * Stores the records, replacing any stored record with the same instrument and signal date.
     */
    void saveAll(List<SignalRecord> records);

    List<SignalRecord> findAll();
}
