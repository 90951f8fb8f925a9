package com.candlesignal.backend.signal.pipeline;

import com.candlesignal.backend.model.SignalKey;
import com.candlesignal.backend.model.SignalRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemorySignalStore implements SignalStore {

    private final Map<SignalKey, SignalRecord> records = new ConcurrentHashMap<>();

    @Override
    public int purgeBefore(LocalDate cutoff) {
        int before = records.size();
        records.values().removeIf(record -> record.getSignalDate().isBefore(cutoff));
        int removed = before - records.size();
        if (removed > 0) {
            log.info("Purged {} signals older than {}", removed, cutoff);
        }
        return removed;
    }

    @Override
    public void saveAll(List<SignalRecord> batch) {
        for (SignalRecord record : batch) {
            records.put(SignalKey.of(record), record);
        }
    }

    @Override
    public List<SignalRecord> findAll() {
        List<SignalRecord> result = new ArrayList<>(records.values());
        result.sort(Comparator.comparing(SignalRecord::getSignalDate).thenComparing(SignalRecord::getSymbol));
        return result;
    }
}
