package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.config.SignalProperties;
import com.candlesignal.backend.model.Candle;
import com.candlesignal.backend.model.DetectorType;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.model.SignalStrength;
import com.candlesignal.backend.model.SignalType;
import com.candlesignal.backend.model.SignalVerdict;
import com.candlesignal.backend.service.indicator.IndicatorSeries;
import com.candlesignal.backend.service.indicator.MovingAverageService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Close crossing above its 50-period SMA, or holding above it while rising.
 */
@Component
@RequiredArgsConstructor
public class SmaTrendDetector extends AbstractSignalDetector {

    private final MovingAverageService movingAverageService;
    private final SignalProperties signalProperties;

    @Override
    public DetectorType type() {
        return DetectorType.SMA_TREND;
    }

    @Override
    protected Optional<SignalVerdict> evaluate(PriceSeries series) {
        int period = signalProperties.getSmaTrend().getSmaPeriod();
        requireCandles(series, period);

        double[] closes = series.closes();
        IndicatorSeries sma = movingAverageService.sma(closes, period);
        double price = closes[closes.length - 1];
        double previousPrice = closes[closes.length - 2];
        double currentSma = sma.fromEnd(1);
        double previousSma = sma.fromEnd(2);

        boolean crossed = crossedAbove(previousPrice, previousSma, price, currentSma);
        boolean trendingUp = price > currentSma && price > previousPrice;
        if (!crossed && !trendingUp) {
            return Optional.empty();
        }

        // a firing close is always above the SMA, so the grade never depends on the cross
        Candle last = series.last();
        return Optional.of(SignalVerdict.builder()
                .detector(type())
                .signalType(SignalType.BUY)
                .strength(SignalStrength.WEAK)
                .confidenceScore(0.5)
                .price(price)
                .volume(last.getVolume())
                .detail("type", type().code())
                .detail("price", price)
                .detail("sma_" + period, currentSma)
                .detail("crossed_above", crossed)
                .detail("reason", crossed ? "Price crossed above SMA " + period : "Price above SMA " + period + " and trending up")
                .build());
    }
}
