package com.candlesignal.backend.service;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.exception.SignalPersistenceException;
import com.candlesignal.backend.model.BatchResult;
import com.candlesignal.backend.model.DetectionMode;
import com.candlesignal.backend.model.Instrument;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalRecord;
import com.candlesignal.backend.service.SignalRetentionPolicy.RetentionPlan;
import com.candlesignal.backend.signal.pipeline.CandleSeriesProvider;
import com.candlesignal.backend.signal.pipeline.SignalStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Generates, deduplicates and persists signals for a list of instruments.
 * <p>
 * Instruments are evaluated in parallel, at most {@code signals.batch.max-in-flight} at a time; a
 * failing or rejected instrument is recorded in the result and never aborts the batch. Only a failure to save the surviving signals fails the whole run.
 */
@Service
@Slf4j
public class SignalBatchCoordinator {

    private static final String BATCH_ID = "batchId";

    private final CandleSeriesProvider candleSeriesProvider;
    private final SignalOrchestrator signalOrchestrator;
    private final SignalRetentionPolicy retentionPolicy;
    private final SignalStore signalStore;
    private final SignalMetricsService metricsService;
    private final SignalProperties signalProperties;
    private final Clock clock;
    private final Executor signalExecutor;
    private final Executor scannerExecutor;

    public SignalBatchCoordinator(CandleSeriesProvider candleSeriesProvider,
                                  SignalOrchestrator signalOrchestrator,
                                  SignalRetentionPolicy retentionPolicy,
                                  SignalStore signalStore,
                                  SignalMetricsService metricsService,
                                  SignalProperties signalProperties,
                                  Clock clock,
                                  @Qualifier("signalExecutor") Executor signalExecutor,
                                  @Qualifier("scannerExecutor") Executor scannerExecutor) {
        this.candleSeriesProvider = candleSeriesProvider;
        this.signalOrchestrator = signalOrchestrator;
        this.retentionPolicy = retentionPolicy;
        this.signalStore = signalStore;
        this.metricsService = metricsService;
        this.signalProperties = signalProperties;
        this.clock = clock;
        this.signalExecutor = signalExecutor;
        this.scannerExecutor = scannerExecutor;
    }

    private enum OutcomeStatus { PROCESSED, SKIPPED, FAILED }

    private record InstrumentOutcome(Instrument instrument, OutcomeStatus status, List<SignalRecord> records, String message) {}

    public BatchResult generateBatch(List<Instrument> instruments) {
        return generateBatch(instruments, signalProperties.getDetection().getMode());
    }

    public CompletableFuture<BatchResult> generateBatchAsync(List<Instrument> instruments, DetectionMode mode) {
        return CompletableFuture.supplyAsync(() -> generateBatch(instruments, mode), scannerExecutor);
    }

    public BatchResult generateBatch(List<Instrument> instruments, DetectionMode mode) {
        String batchId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        String previousBatchId = MDC.get(BATCH_ID);
        MDC.put(BATCH_ID, batchId);
        try {
            log.info("🔭 Signal batch {} started: {} instruments, mode {}", batchId, instruments.size(), mode);

            ConcurrentLinkedQueue<InstrumentOutcome> outcomes = new ConcurrentLinkedQueue<>();
            Semaphore permits = new Semaphore(signalProperties.getBatch().getMaxInFlight());
            List<CompletableFuture<Void>> futures = new ArrayList<>(instruments.size());
            for (Instrument instrument : instruments) {
                permits.acquireUninterruptibly();
                futures.add(submit(batchId, instrument, mode, outcomes, permits));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            BatchResult result = summarize(batchId, mode, startedAt, instruments.size(), new ArrayList<>(outcomes));
            metricsService.recordBatchDuration(Duration.between(startedAt, result.getCompletedAt()));
            log.info("✅ Signal batch {} {}: {} processed, {} skipped, {} failed, {} signals saved, {} superseded, {} purged",
                    batchId, result.getStatus(), result.getInstrumentsProcessed(), result.getInstrumentsSkipped(),
                    result.getInstrumentsFailed(), result.signalCount(), result.getSupersededCount(), result.getPurgedCount());
            return result;
        } finally {
            restoreBatchId(previousBatchId);
        }
    }

    private CompletableFuture<Void> submit(String batchId, Instrument instrument, DetectionMode mode,
                                           ConcurrentLinkedQueue<InstrumentOutcome> outcomes, Semaphore permits) {
        try {
            return CompletableFuture.runAsync(() -> {
                try {
                    outcomes.add(processInstrument(batchId, instrument, mode));
                } finally {
                    permits.release();
                }
            }, signalExecutor);
        } catch (RejectedExecutionException e) {
            permits.release();
            log.error("❌ Signal executor rejected {}", instrument.symbol(), e);
            metricsService.recordInstrumentFailed();
            outcomes.add(new InstrumentOutcome(instrument, OutcomeStatus.FAILED, List.of(),
                    "Rejected by signal executor"));
            return CompletableFuture.completedFuture(null);
        }
    }

    private InstrumentOutcome processInstrument(String batchId, Instrument instrument, DetectionMode mode) {
        String previousBatchId = MDC.get(BATCH_ID);
        MDC.put(BATCH_ID, batchId);
        try {
            SignalProperties.Batch config = signalProperties.getBatch();
            int lookback = instrument.isCrypto() ? config.getCryptoLookbackCandles() : config.getStockLookbackDays();
            PriceSeries series = candleSeriesProvider.fetchSeries(instrument, lookback);
            if (series == null || series.size() < config.getMinCandles()) {
                int available = series == null ? 0 : series.size();
                log.warn("⚠️ Skipping {}: {} candles, need {}", instrument.displayName(), available, config.getMinCandles());
                metricsService.recordInstrumentSkipped();
                return new InstrumentOutcome(instrument, OutcomeStatus.SKIPPED, List.of(),
                        "Insufficient data: " + available + " candles");
            }
            List<SignalRecord> records = signalOrchestrator.generate(instrument, series, mode);
            records.forEach(record -> metricsService.recordSignalGenerated(record.getDetector()));
            return new InstrumentOutcome(instrument, OutcomeStatus.PROCESSED, records, null);
        } catch (Exception e) {
            log.error("❌ Signal generation failed for {}", instrument.symbol(), e);
            metricsService.recordInstrumentFailed();
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new InstrumentOutcome(instrument, OutcomeStatus.FAILED, List.of(), message);
        } finally {
            restoreBatchId(previousBatchId);
        }
    }

    // tasks may run on the submitting thread, which keeps its own batch id
    private static void restoreBatchId(String previousBatchId) {
        if (previousBatchId == null) {
            MDC.remove(BATCH_ID);
        } else {
            MDC.put(BATCH_ID, previousBatchId);
        }
    }

    private BatchResult summarize(String batchId, DetectionMode mode, Instant startedAt, int requested,
                                  List<InstrumentOutcome> outcomes) {
        List<SignalRecord> generated = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        for (InstrumentOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case PROCESSED -> {
                    processed++;
                    generated.addAll(outcome.records());
                }
                case SKIPPED -> skipped++;
                case FAILED -> {
                    failed++;
                    failures.put(outcome.instrument().symbol(), outcome.message());
                }
            }
        }
        // completion order is arbitrary; ties in dedup resolve by generation time
        generated.sort(Comparator.comparing(SignalRecord::getGeneratedAt, Comparator.nullsFirst(Comparator.naturalOrder())));

        LocalDate today = LocalDate.now(clock);
        RetentionPlan plan = retentionPolicy.plan(generated, today);
        int purged = purgeExpired(plan.cutoff());
        persist(batchId, plan.retained());

        return BatchResult.builder()
                .batchId(batchId)
                .mode(mode)
                .status(failed > 0 ? BatchResult.Status.COMPLETED_WITH_ERRORS : BatchResult.Status.COMPLETED)
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .instrumentsRequested(requested)
                .instrumentsProcessed(processed)
                .instrumentsSkipped(skipped)
                .instrumentsFailed(failed)
                .signals(List.copyOf(plan.retained()))
                .supersededCount(plan.supersededCount())
                .purgedCount(purged)
                .retentionCutoff(plan.cutoff())
                .failures(failures)
                .build();
    }

    private int purgeExpired(LocalDate cutoff) {
        try {
            return signalStore.purgeBefore(cutoff);
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to purge signals older than {}", cutoff, e);
            return 0;
        }
    }

    private void persist(String batchId, List<SignalRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        try {
            signalStore.saveAll(records);
        } catch (RuntimeException e) {
            throw new SignalPersistenceException("Failed to save " + records.size() + " signals for batch " + batchId, e);
        }
    }
}
