package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.DetectorType;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalStrength;
import com.candlesignal.backend.model.SignalType;
import com.candlesignal.backend.model.SignalVerdict;
import com.candlesignal.backend.service.indicator.IndicatorSeries;
import com.candlesignal.backend.service.indicator.MovingAverageService;
import com.candlesignal.backend.service.indicator.RsiService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Fast/slow EMA crossover on the last candle, filtered by RSI so overbought buys and
 * oversold sells are ignored.
 */
@Component
@RequiredArgsConstructor
public class EmaCrossoverDetector extends AbstractSignalDetector {

    private final MovingAverageService movingAverageService;
    private final RsiService rsiService;
    private final SignalProperties signalProperties;

    @Override
    public DetectorType type() {
        return DetectorType.EMA_CROSSOVER;
    }

    @Override
    protected Optional<SignalVerdict> evaluate(PriceSeries series) {
        SignalProperties.EmaCrossover config = signalProperties.getEmaCrossover();
        requireCandles(series, config.getSlowPeriod());

        double[] closes = series.closes();
        IndicatorSeries fast = movingAverageService.ema(closes, config.getFastPeriod());
        IndicatorSeries slow = movingAverageService.ema(closes, config.getSlowPeriod());
        double rsi = rsiService.rsi(closes, signalProperties.getRsi().getPeriod()).last();

        boolean bullish = crossedAbove(fast.fromEnd(2), slow.fromEnd(2), fast.fromEnd(1), slow.fromEnd(1));
        boolean bearish = crossedBelow(fast.fromEnd(2), slow.fromEnd(2), fast.fromEnd(1), slow.fromEnd(1));

        SignalType signalType;
        String reason;
        if (bullish && rsi < config.getOverbought()) {
            signalType = SignalType.BUY;
            reason = "Bullish EMA crossover with RSI confirmation";
        } else if (bearish && rsi > config.getOversold()) {
            signalType = SignalType.SELL;
            reason = "Bearish EMA crossover with RSI confirmation";
        } else {
            return Optional.empty();
        }

        return Optional.of(SignalVerdict.builder()
                .detector(type())
                .signalType(signalType)
                .strength(SignalStrength.MODERATE)
                .confidenceScore(0.7)
                .price(closes[closes.length - 1])
                .volume(series.last().getVolume())
                .detail("type", type().code())
                .detail("ema_" + config.getFastPeriod(), fast.last())
                .detail("ema_" + config.getSlowPeriod(), slow.last())
                .detail("rsi", rsi)
                .detail("reason", reason)
                .build());
    }
}
