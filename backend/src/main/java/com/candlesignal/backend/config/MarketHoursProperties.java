package com.candlesignal.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Regular trading session per exchange, in exchange-local time.
 * No holiday calendar: weekends are the only closed days the oracle knows about.
 */
@Configuration
@ConfigurationProperties(prefix = "market-hours")
@Data
@Validated
public class MarketHoursProperties {

    @Valid
    private Map<String, Exchange> exchanges = defaultExchanges();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Exchange {
        @NotBlank
        private String timezone;
        @Pattern(regexp = "\\d{2}:\\d{2}")
        private String open;
        @Pattern(regexp = "\\d{2}:\\d{2}")
        private String close;
    }

    private static Map<String, Exchange> defaultExchanges() {
        Map<String, Exchange> exchanges = new LinkedHashMap<>();
        exchanges.put("NYSE", new Exchange("America/New_York", "09:30", "16:00"));
        exchanges.put("NASDAQ", new Exchange("America/New_York", "09:30", "16:00"));
        exchanges.put("ASX", new Exchange("Australia/Sydney", "10:00", "16:00"));
        return exchanges;
    }
}
