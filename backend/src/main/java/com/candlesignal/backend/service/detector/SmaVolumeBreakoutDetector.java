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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Close crossing the 200-period SMA on a volume spike. The volume average includes the
 * crossing candle itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmaVolumeBreakoutDetector extends AbstractSignalDetector {

    private final MovingAverageService movingAverageService;
    private final SignalProperties signalProperties;

    @Override
    public DetectorType type() {
        return DetectorType.SMA_VOLUME;
    }

    @Override
    protected Optional<SignalVerdict> evaluate(PriceSeries series) {
        SignalProperties.SmaVolume config = signalProperties.getSmaVolume();
        requireCandles(series, config.getSmaPeriod());
        if (!series.hasVolume()) {
            log.debug("{} skipped: series has no volume", type());
            return Optional.empty();
        }

        double[] closes = series.closes();
        double[] volumes = series.volumes();
        IndicatorSeries sma = movingAverageService.sma(closes, config.getSmaPeriod());
        IndicatorSeries volumeAverage = movingAverageService.sma(volumes, config.getVolumePeriod());

        double price = closes[closes.length - 1];
        double previousPrice = closes[closes.length - 2];
        double volume = volumes[volumes.length - 1];
        double averageVolume = volumeAverage.last();
        boolean highVolume = volume > averageVolume * config.getVolumeMultiplier();
        if (!highVolume) {
            return Optional.empty();
        }

        String smaKey = "sma_" + config.getSmaPeriod();
        SignalVerdict.SignalVerdictBuilder verdict = SignalVerdict.builder()
                .detector(type())
                .strength(SignalStrength.STRONG)
                .confidenceScore(0.8)
                .price(price)
                .volume(volume);

        if (crossedAbove(previousPrice, sma.fromEnd(2), price, sma.fromEnd(1))) {
            verdict.signalType(SignalType.BUY)
                    .detail("type", "sma_volume_breakout");
        } else if (crossedBelow(previousPrice, sma.fromEnd(2), price, sma.fromEnd(1))) {
            verdict.signalType(SignalType.SELL)
                    .detail("type", "sma_volume_breakdown");
        } else {
            return Optional.empty();
        }
        String direction = price > sma.last() ? "above" : "below";
        return Optional.of(verdict
                .detail("price", price)
                .detail(smaKey, sma.last())
                .detail("volume", volume)
                .detail("avg_volume", averageVolume)
                .detail("volume_ratio", volume / averageVolume)
                .detail("reason", "Price crossed " + direction + " " + config.getSmaPeriod() + " SMA with high volume")
                .build());
    }
}
