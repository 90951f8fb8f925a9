package com.candlesignal.backend.service;

import com.candlesignal.backend.config.MarketHoursProperties;
import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.DetectionMode;
import com.candlesignal.backend.model.DetectorType;
import com.candlesignal.backend.model.Instrument;
import com.candlesignal.backend.model.MarketType;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalRecord;
import com.candlesignal.backend.model.SignalStrength;
import com.candlesignal.backend.model.SignalType;
import com.candlesignal.backend.service.detector.ConfirmedBuyDetector;
import com.candlesignal.backend.service.detector.EmaCrossoverDetector;
import com.candlesignal.backend.service.detector.GoldenCrossDetector;
import com.candlesignal.backend.service.detector.SignalDetector;
import com.candlesignal.backend.service.detector.SignalDetectorRegistry;
import com.candlesignal.backend.service.detector.SmaTrendDetector;
import com.candlesignal.backend.service.detector.SmaVolumeBreakoutDetector;
import com.candlesignal.backend.service.indicator.MacdService;
import com.candlesignal.backend.service.indicator.MovingAverageService;
import com.candlesignal.backend.service.indicator.RsiService;
import com.candlesignal.backend.service.market.MarketHoursService;
import com.candlesignal.backend.util.TestSeriesFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalOrchestratorTest {

    // Wednesday, 10:00 in New York
    private static final Instant NOW = Instant.parse("2024-01-10T15:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);
    private static final LocalDate YESTERDAY = LocalDate.of(2024, 1, 9);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private MarketHoursService marketHoursService;
    private SignalOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        SignalProperties properties = new SignalProperties();
        MovingAverageService movingAverageService = new MovingAverageService();
        RsiService rsiService = new RsiService();
        List<SignalDetector> detectors = List.of(
                new SmaTrendDetector(movingAverageService, properties),
                new EmaCrossoverDetector(movingAverageService, rsiService, properties),
                new GoldenCrossDetector(movingAverageService, properties),
                new SmaVolumeBreakoutDetector(movingAverageService, properties),
                new ConfirmedBuyDetector(movingAverageService, rsiService,
                        new MacdService(movingAverageService, properties), properties, clock));
        marketHoursService = new MarketHoursService(new MarketHoursProperties(), clock);
        orchestrator = new SignalOrchestrator(marketHoursService, new SignalDetectorRegistry(detectors),
                new ObjectMapper(), clock);
    }

    private static TestSeriesFactory tst() {
        // 70 candles; the 5 EMA crosses the 20 EMA five candles before the end
        return TestSeriesFactory.startingAt(120).steps(58, -1, 0.4).steps(11, 2, -1.2);
    }

    @Test
    void confirmedBuyForYesterdaysCandleIsDatedToday() {
        Instrument instrument = Instrument.stock(7L, "TST", "NASDAQ");

        List<SignalRecord> records = orchestrator.generate(instrument, tst().endingOn(YESTERDAY).build(),
                DetectionMode.CONFIRMED_BUY_ONLY);

        assertThat(records).hasSize(1);
        SignalRecord record = records.get(0);
        assertThat(record.getInstrumentId()).isEqualTo(7L);
        assertThat(record.getSymbol()).isEqualTo("TST");
        assertThat(record.getExchange()).isEqualTo("NASDAQ");
        assertThat(record.getDetector()).isEqualTo(DetectorType.CONFIRMED_BUY);
        assertThat(record.getSignalType()).isEqualTo(SignalType.BUY);
        assertThat(record.getSignalStrength()).isEqualTo(SignalStrength.STRONG);
        assertThat(record.getConfidenceScore()).isEqualTo(0.95);
        assertThat(record.getPrice()).isCloseTo(108.6, within(1e-9));
        assertThat(record.getVolume()).isEqualTo(1345.0);
        assertThat(record.getSignalDate()).isEqualTo(TODAY);
        assertThat(record.getGeneratedAt()).isEqualTo(NOW);
        assertThat(record.isProcessed()).isFalse();
        assertThat(record.getDetails()).containsEntry("crossover_offset", -5);
        assertThat(record.getSignalData()).contains("\"type\":\"confirmed_buy_volume\"");
        assertThat(record.getJustification()).isEqualTo(
                "Using all data - last candle from 2024-01-09; Signal date: 2024-01-10 (based on 2024-01-09 candle)");
    }

    @Test
    void formingCandleIsIgnoredWhileMarketOpen() {
        // a collapsing candle for today that would break every gate if used
        PriceSeries series = tst().steps(1, -30).tailVolume(6, 1345).endingOn(TODAY).build();

        List<SignalRecord> records = orchestrator.generate(Instrument.stock(7L, "TST", "NASDAQ"), series,
                DetectionMode.CONFIRMED_BUY_ONLY);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getPrice()).isCloseTo(108.6, within(1e-9));
        assertThat(records.get(0).getJustification())
                .startsWith("Market open - removed today's forming candle, using 2024-01-09");
    }

    @Test
    void cryptoPairsUseTheWholeSeries() {
        Instrument pair = Instrument.cryptoPair(3L, "SOL", "ETH");
        PriceSeries series = TestSeriesFactory.confirmedBuyBase().endingOn(TODAY).build();

        List<SignalRecord> records = orchestrator.generate(pair, series, DetectionMode.CONFIRMED_BUY_ONLY);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getMarketType()).isEqualTo(MarketType.CRYPTO);
        assertThat(records.get(0).getBaseAsset()).isEqualTo("ETH");
        assertThat(records.get(0).getPrice()).isCloseTo(114.4, within(1e-9));
        assertThat(records.get(0).getJustification()).startsWith("Continuous market");
    }

    @Test
    void allDetectorsModeRunsEveryDetector() {
        List<SignalRecord> records = orchestrator.generate(Instrument.stock(7L, "TST", "NASDAQ"),
                tst().endingOn(YESTERDAY).build(), DetectionMode.ALL_DETECTORS);

        assertThat(records).extracting(SignalRecord::getDetector).contains(DetectorType.CONFIRMED_BUY);
        assertThat(records).allSatisfy(record -> assertThat(record.getSignalDate()).isEqualTo(TODAY));
    }

    @Test
    void emptySeriesGivesNoSignals() {
        assertThat(orchestrator.generate(Instrument.stock(7L, "TST", "NASDAQ"), PriceSeries.empty(),
                DetectionMode.ALL_DETECTORS)).isEmpty();
    }

    @Test
    void failingDetectorDoesNotStopTheOthers() {
        SignalDetector broken = mock(SignalDetector.class);
        when(broken.type()).thenReturn(DetectorType.SMA_TREND);
        when(broken.detect(any())).thenThrow(new IllegalStateException("boom"));
        SignalDetectorRegistry registry = mock(SignalDetectorRegistry.class);
        MovingAverageService movingAverageService = new MovingAverageService();
        SignalProperties properties = new SignalProperties();
        SignalDetector confirmedBuy = new ConfirmedBuyDetector(movingAverageService, new RsiService(),
                new MacdService(movingAverageService, properties), properties, clock);
        when(registry.forMode(DetectionMode.ALL_DETECTORS)).thenReturn(List.of(broken, confirmedBuy));
        SignalOrchestrator guarded = new SignalOrchestrator(marketHoursService, registry, new ObjectMapper(), clock);

        List<SignalRecord> records = guarded.generate(Instrument.stock(7L, "TST", "NASDAQ"),
                tst().endingOn(YESTERDAY).build(), DetectionMode.ALL_DETECTORS);

        assertThat(records).extracting(SignalRecord::getDetector).containsExactly(DetectorType.CONFIRMED_BUY);
    }
}
