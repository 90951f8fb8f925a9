package com.candlesignal.backend.config;

import com.candlesignal.backend.model.DetectionMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "signals")
@Data
@Validated
public class SignalProperties {

    @Valid
    private Detection detection = new Detection();
    @Valid
    private ConfirmedBuy confirmedBuy = new ConfirmedBuy();
    @Valid
    private EmaCrossover emaCrossover = new EmaCrossover();
    @Valid
    private GoldenCross goldenCross = new GoldenCross();
    @Valid
    private SmaVolume smaVolume = new SmaVolume();
    @Valid
    private SmaTrend smaTrend = new SmaTrend();
    @Valid
    private Macd macd = new Macd();
    @Valid
    private Rsi rsi = new Rsi();
    @Valid
    private Retention retention = new Retention();
    @Valid
    private Batch batch = new Batch();

    @Data
    public static class Detection {
        @NotNull
        private DetectionMode mode = DetectionMode.CONFIRMED_BUY_ONLY;
    }

    @Data
    public static class ConfirmedBuy {
        @Positive
        private int minCandles = 50;
        @Positive
        private int fastEma = 5;
        @Positive
        private int slowEma = 20;
        @Positive
        private int trendSma = 50;
        // offsets -2 .. -(window + 1) from the series end
        @Positive
        private int crossoverWindow = 10;
        @Positive
        private int volumeShortWindow = 5;
        @Positive
        private int volumeLongWindow = 50;
        private double volumeRatioThreshold = 1.0;
        private double rsiFloor = 50.0;
        private boolean partialCreditEnabled = false;
    }

    @Data
    public static class EmaCrossover {
        @Positive
        private int fastPeriod = 12;
        @Positive
        private int slowPeriod = 26;
        private double overbought = 70.0;
        private double oversold = 30.0;
    }

    @Data
    public static class GoldenCross {
        @Positive
        private int fastPeriod = 50;
        @Positive
        private int slowPeriod = 200;
    }

    @Data
    public static class SmaVolume {
        @Positive
        private int smaPeriod = 200;
        @Positive
        private int volumePeriod = 20;
        @DecimalMin("1.0")
        private double volumeMultiplier = 1.2;
    }

    @Data
    public static class SmaTrend {
        @Positive
        private int smaPeriod = 50;
    }

    @Data
    public static class Macd {
        @Positive
        private int fastPeriod = 12;
        @Positive
        private int slowPeriod = 26;
        @Positive
        private int signalPeriod = 9;
    }

    @Data
    public static class Rsi {
        @Positive
        private int period = 14;
    }

    @Data
    public static class Retention {
        @Min(1)
        private int days = 10;
    }

    @Data
    public static class Batch {
        @Positive
        private int minCandles = 51;
        @Positive
        private int stockLookbackDays = 60;
        @Positive
        private int cryptoLookbackCandles = 100;
        /**
         * Instruments submitted to the signal executor at once. Must not exceed the executor's queue
         * capacity: a worker still counts as busy after its task has released its slot.
         */
        @Positive
        private int maxInFlight = 16;
    }
}
