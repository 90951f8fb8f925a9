package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.DetectorType;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalStrength;
import com.candlesignal.backend.model.SignalType;
import com.candlesignal.backend.model.SignalVerdict;
import com.candlesignal.backend.service.indicator.IndicatorSeries;
import com.candlesignal.backend.service.indicator.MacdService;
import com.candlesignal.backend.service.indicator.MacdService.MacdSeries;
import com.candlesignal.backend.service.indicator.MovingAverageService;
import com.candlesignal.backend.service.indicator.RsiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Six-gate buy confirmation on the last closed candle:
 * <ol>
 *     <li>fast EMA crossed above slow EMA inside the lookback window, excluding the last candle, and is still above</li>
 *     <li>open and close both above both EMAs</li>
 *     <li>close above the trend SMA</li>
 *     <li>short volume average above the long one</li>
 *     <li>RSI above its floor</li>
 *     <li>MACD line above its signal line</li>
 * </ol>
 * With partial credit enabled, a verdict where only the volume gate fails is emitted at a lower grade.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfirmedBuyDetector extends AbstractSignalDetector {

    static final String TYPE_VOLUME_CONFIRMED = "confirmed_buy_volume";
    static final String TYPE_NO_VOLUME = "confirmed_buy_no_volume";

    private final MovingAverageService movingAverageService;
    private final RsiService rsiService;
    private final MacdService macdService;
    private final SignalProperties signalProperties;
    private final Clock clock;

    @Override
    public DetectorType type() {
        return DetectorType.CONFIRMED_BUY;
    }

    @Override
    protected Optional<SignalVerdict> evaluate(PriceSeries series) {
        GateEvaluation gates = evaluateGates(series);
        if (log.isDebugEnabled()) {
            log.debug("Confirmed buy gates for {}: {}", series, gates);
        }

        if (gates.allPassed()) {
            return Optional.of(verdict(series, gates, SignalStrength.STRONG, 0.95, TYPE_VOLUME_CONFIRMED,
                    "Confirmed buy signal - all 6 conditions met: 5EMA/20EMA crossover in lookback window, "
                            + "price above EMAs, price above 50 SMA, volume spike, RSI > 50, MACD > Signal Line"));
        }
        if (signalProperties.getConfirmedBuy().isPartialCreditEnabled() && gates.allButVolumePassed()) {
            return Optional.of(verdict(series, gates, SignalStrength.MODERATE, 0.85, TYPE_NO_VOLUME,
                    "Confirmed buy signal without volume confirmation - 5 of 6 conditions met"));
        }
        return Optional.empty();
    }

    GateEvaluation evaluateGates(PriceSeries series) {
        SignalProperties.ConfirmedBuy config = signalProperties.getConfirmedBuy();
        int required = Math.max(config.getMinCandles(), config.getCrossoverWindow() + 2);
        requireCandles(series, required);

        double[] closes = series.closes();
        IndicatorSeries fastEma = movingAverageService.ema(closes, config.getFastEma());
        IndicatorSeries slowEma = movingAverageService.ema(closes, config.getSlowEma());
        IndicatorSeries trendSma = movingAverageService.sma(closes, config.getTrendSma());
        IndicatorSeries rsi = rsiService.rsi(closes, signalProperties.getRsi().getPeriod());
        MacdSeries macd = macdService.macd(closes);

        double open = series.last().getOpen();
        double close = closes[closes.length - 1];
        double ema5 = fastEma.last();
        double ema20 = slowEma.last();
        double sma50 = trendSma.last();
        double currentRsi = rsi.last();
        double macdLine = macd.macdLine().last();
        double signalLine = macd.signalLine().last();

        Integer crossOffset = mostRecentCrossOffset(fastEma, slowEma, config.getCrossoverWindow());
        boolean crossover = crossOffset != null && ema5 > ema20;
        boolean priceAboveEmas = open > ema5 && open > ema20 && close > ema5 && close > ema20;
        boolean priceAboveSma = close > sma50;
        double volumeRatio = volumeRatio(series, config);
        boolean volumeConfirmed = volumeRatio > config.getVolumeRatioThreshold();
        boolean rsiBullish = currentRsi > config.getRsiFloor();
        boolean macdAboveSignal = macdLine > signalLine;

        return new GateEvaluation(open, close, ema5, ema20, sma50, currentRsi, macdLine, signalLine, volumeRatio,
                crossOffset, crossover, priceAboveEmas, priceAboveSma, volumeConfirmed, rsiBullish, macdAboveSignal);
    }

    /**
     * Smallest offset from the end (2 = the candle before the last) at which the fast EMA moved from
     * at-or-below to above the slow EMA, or {@code null} when no such cross exists in the window.
     */
    private static Integer mostRecentCrossOffset(IndicatorSeries fast, IndicatorSeries slow, int window) {
        for (int offset = 2; offset <= window + 1; offset++) {
            if (crossedAbove(fast.fromEnd(offset + 1), slow.fromEnd(offset + 1), fast.fromEnd(offset), slow.fromEnd(offset))) {
                return offset;
            }
        }
        return null;
    }

    private double volumeRatio(PriceSeries series, SignalProperties.ConfirmedBuy config) {
        if (!series.hasVolume()) {
            log.debug("No volume for {}, volume gate fails", series);
            return 0.0;
        }
        double[] volumes = series.volumes();
        double shortMean = movingAverageService.trailingMean(volumes, config.getVolumeShortWindow());
        double longMean = movingAverageService.trailingMean(volumes, config.getVolumeLongWindow());
        if (longMean == 0) {
            return 0.0;
        }
        return shortMean / longMean;
    }

    private SignalVerdict verdict(PriceSeries series, GateEvaluation gates, SignalStrength strength, double confidence,
                                  String signalKind, String reason) {
        return SignalVerdict.builder()
                .detector(type())
                .signalType(SignalType.BUY)
                .strength(strength)
                .confidenceScore(confidence)
                .price(gates.close())
                .volume(series.last().getVolume())
                .signalDate(LocalDate.now(clock))
                .detail("type", signalKind)
                .detail("price", gates.close())
                .detail("open_price", gates.open())
                .detail("ema_5", gates.ema5())
                .detail("ema_20", gates.ema20())
                .detail("sma_50", gates.sma50())
                .detail("rsi", gates.rsi())
                .detail("macd", gates.macd())
                .detail("macd_signal", gates.macdSignal())
                .detail("volume_ratio", gates.volumeRatio())
                .detail("crossover_offset", gates.crossOffset() == null ? -1 : -gates.crossOffset())
                .detail("conditions_met", gates.passedCount())
                .detail("ema_crossover", gates.crossover())
                .detail("price_above_emas", gates.priceAboveEmas())
                .detail("price_above_sma50", gates.priceAboveSma())
                .detail("volume_confirmation", gates.volumeConfirmed())
                .detail("rsi_bullish", gates.rsiBullish())
                .detail("macd_cross", gates.macdAboveSignal())
                .detail("reason", reason)
                .build();
    }

    record GateEvaluation(
            double open,
            double close,
            double ema5,
            double ema20,
            double sma50,
            double rsi,
            double macd,
            double macdSignal,
            double volumeRatio,
            Integer crossOffset,
            boolean crossover,
            boolean priceAboveEmas,
            boolean priceAboveSma,
            boolean volumeConfirmed,
            boolean rsiBullish,
            boolean macdAboveSignal
    ) {
        boolean allButVolumePassed() {
            return crossover && priceAboveEmas && priceAboveSma && rsiBullish && macdAboveSignal;
        }

        boolean allPassed() {
            return allButVolumePassed() && volumeConfirmed;
        }

        int passedCount() {
            int count = 0;
            for (boolean gate : new boolean[]{crossover, priceAboveEmas, priceAboveSma, volumeConfirmed, rsiBullish, macdAboveSignal}) {
                if (gate) {
                    count++;
                }
            }
            return count;
        }
    }
}
