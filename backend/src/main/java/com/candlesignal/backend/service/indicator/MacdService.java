package com.candlesignal.backend.service.indicator;

import com.candlesignal.backend.config.SignalProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MacdService {

    private final MovingAverageService movingAverageService;
    private final SignalProperties signalProperties;

    public MacdSeries macd(double[] values) {
        SignalProperties.Macd config = signalProperties.getMacd();
        return macd(values, config.getFastPeriod(), config.getSlowPeriod(), config.getSignalPeriod());
    }

    public MacdSeries macd(double[] values, int fast, int slow, int signal) {
        if (fast >= slow) {
            throw new IllegalArgumentException("Fast period " + fast + " must be shorter than slow period " + slow);
        }
        IndicatorSeries fastSeries = movingAverageService.ema(values, fast);
        IndicatorSeries slowSeries = movingAverageService.ema(values, slow);
        IndicatorSeries macdLine = fastSeries.minus(slowSeries);
        IndicatorSeries signalLine = movingAverageService.ema(macdLine, signal);
        IndicatorSeries histogram = macdLine.minus(signalLine);
        return new MacdSeries(macdLine, signalLine, histogram);
    }

    public record MacdSeries(IndicatorSeries macdLine, IndicatorSeries signalLine, IndicatorSeries histogram) {

        public boolean isBullish() {
            return macdLine.last() > signalLine.last();
        }
    }
}
