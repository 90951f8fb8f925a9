package com.candlesignal.backend.service.detector;

import com.candlesignal.backend.config.SignalProperties;
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
 * 50/200 SMA golden cross (buy) and death cross (sell).
 */
@Component
@RequiredArgsConstructor
public class GoldenCrossDetector extends AbstractSignalDetector {

    private final MovingAverageService movingAverageService;
    private final SignalProperties signalProperties;

    @Override
    public DetectorType type() {
        return DetectorType.GOLDEN_CROSS;
    }

    @Override
    protected Optional<SignalVerdict> evaluate(PriceSeries series) {
        SignalProperties.GoldenCross config = signalProperties.getGoldenCross();
        requireCandles(series, config.getSlowPeriod());

        double[] closes = series.closes();
        IndicatorSeries fast = movingAverageService.sma(closes, config.getFastPeriod());
        IndicatorSeries slow = movingAverageService.sma(closes, config.getSlowPeriod());

        String fastKey = "sma_" + config.getFastPeriod();
        String slowKey = "sma_" + config.getSlowPeriod();
        SignalVerdict.SignalVerdictBuilder verdict = SignalVerdict.builder()
                .detector(type())
                .strength(SignalStrength.STRONG)
                .confidenceScore(0.85)
                .price(closes[closes.length - 1])
                .volume(series.last().getVolume());

        if (crossedAbove(fast.fromEnd(2), slow.fromEnd(2), fast.fromEnd(1), slow.fromEnd(1))) {
            return Optional.of(verdict
                    .signalType(SignalType.BUY)
                    .detail("type", "golden_cross")
                    .detail(fastKey, fast.last())
                    .detail(slowKey, slow.last())
                    .detail("reason", "Golden Cross - " + config.getFastPeriod() + " SMA crossed above "
                            + config.getSlowPeriod() + " SMA")
                    .build());
        }
        if (crossedBelow(fast.fromEnd(2), slow.fromEnd(2), fast.fromEnd(1), slow.fromEnd(1))) {
            return Optional.of(verdict
                    .signalType(SignalType.SELL)
                    .detail("type", "death_cross")
                    .detail(fastKey, fast.last())
                    .detail(slowKey, slow.last())
                    .detail("reason", "Death Cross - " + config.getFastPeriod() + " SMA crossed below "
                            + config.getSlowPeriod() + " SMA")
                    .build());
        }
        return Optional.empty();
    }
}
