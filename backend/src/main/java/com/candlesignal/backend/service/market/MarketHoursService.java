package com.candlesignal.backend.service.market;

import com.candlesignal.backend.config.MarketHoursProperties;
import com.candlesignal.backend.model.MarketState;
import com.candlesignal.backend.model.MarketValidationResult;
import com.candlesignal.backend.model.PriceSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether the newest candle of a series may be used, and which date signals carry.
 * <p>
 * A candle dated today while its exchange is still trading is forming and gets removed. Signals are
 * always dated today; the justification names the candle they are actually based on.
 */
@Slf4j
@Service
public class MarketHoursService {

    private static final DateTimeFormatter SESSION_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final Clock clock;
    private final Map<String, ExchangeSchedule> schedules;

    public MarketHoursService(MarketHoursProperties properties, Clock clock) {
        this.clock = clock;
        this.schedules = buildSchedules(properties);
    }

    public Optional<ExchangeSchedule> schedule(String exchange) {
        if (exchange == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schedules.get(exchange.trim().toUpperCase(Locale.ROOT)));
    }

    public boolean isMarketOpen(String exchange, Instant instant) {
        Optional<ExchangeSchedule> schedule = schedule(exchange);
        if (schedule.isEmpty()) {
            log.warn("Unknown exchange {}, assuming closed", exchange);
            return false;
        }
        return schedule.get().isOpenAt(instant);
    }

    public boolean isMarketOpen(String exchange) {
        return isMarketOpen(exchange, clock.instant());
    }

    public Optional<Instant> marketCloseUtc(String exchange, LocalDate date) {
        return schedule(exchange).map(s -> s.closeOn(date));
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Signals are attributed to the day they are generated on, never to the candle date.
     */
    public LocalDate signalDate() {
        return today();
    }

    public MarketValidationResult validate(PriceSeries series, String exchange) {
        LocalDate today = today();
        if (series == null || series.isEmpty()) {
            return new MarketValidationResult(PriceSeries.empty(), today, "No data provided", MarketState.CLOSED, false);
        }
        LocalDate lastCandleDate = series.lastDate();
        if (lastCandleDate.isBefore(today)) {
            return new MarketValidationResult(series, today,
                    "Using all data - last candle from " + lastCandleDate, currentState(exchange), false);
        }

        Instant now = clock.instant();
        if (isMarketOpen(exchange, now)) {
            if (series.size() > 1) {
                PriceSeries closed = series.withoutLast();
                return new MarketValidationResult(closed, today,
                        "Market open - removed today's forming candle, using " + closed.lastDate(),
                        MarketState.OPEN, false);
            }
            return new MarketValidationResult(series, today,
                    "Market open but only one candle available - using " + lastCandleDate + " with caution",
                    MarketState.OPEN, true);
        }

        Optional<Instant> close = marketCloseUtc(exchange, today);
        String reason;
        if (close.isEmpty()) {
            reason = "Unknown exchange " + exchange + " - treated as closed, using " + lastCandleDate;
        } else if (!now.isBefore(close.get())) {
            reason = "Market closed - using today's closed candle " + lastCandleDate;
        } else {
            reason = "Market closed (weekend/holiday?) - using " + lastCandleDate;
        }
        return new MarketValidationResult(series, today, reason, MarketState.CLOSED, false);
    }

    /**
     * Validation plus signal date, with both explanations joined into one justification.
     */
    public MarketValidationResult validateForSignals(PriceSeries series, String exchange) {
        MarketValidationResult validation = validate(series, exchange);
        return withSignalDate(validation);
    }

    /**
     * Round-the-clock markets have no forming daily candle to strip; the whole series is used.
     */
    public MarketValidationResult continuousMarket(PriceSeries series) {
        LocalDate today = today();
        if (series == null || series.isEmpty()) {
            return withSignalDate(new MarketValidationResult(PriceSeries.empty(), today, "No data provided",
                    MarketState.OPEN, false));
        }
        return withSignalDate(new MarketValidationResult(series, today,
                "Continuous market - using all data, last candle from " + series.lastDate(), MarketState.OPEN, false));
    }

    private MarketValidationResult withSignalDate(MarketValidationResult validation) {
        LocalDate signalDate = signalDate();
        String dateReason = validation.hasData()
                ? "Signal date: " + signalDate + " (based on " + validation.series().lastDate() + " candle)"
                : "No data available - using today's date";
        return new MarketValidationResult(validation.series(), signalDate,
                validation.justification() + "; " + dateReason, validation.marketState(), validation.lowConfidence());
    }

    private MarketState currentState(String exchange) {
        return schedule(exchange).map(s -> s.isOpenAt(clock.instant()) ? MarketState.OPEN : MarketState.CLOSED)
                .orElse(MarketState.CLOSED);
    }

    private static Map<String, ExchangeSchedule> buildSchedules(MarketHoursProperties properties) {
        Map<String, ExchangeSchedule> result = new LinkedHashMap<>();
        if (properties.getExchanges() == null) {
            return result;
        }
        properties.getExchanges().forEach((name, exchange) -> {
            String key = name.trim().toUpperCase(Locale.ROOT);
            result.put(key, new ExchangeSchedule(key,
                    ZoneId.of(exchange.getTimezone()),
                    LocalTime.parse(exchange.getOpen(), SESSION_FORMAT),
                    LocalTime.parse(exchange.getClose(), SESSION_FORMAT)));
        });
        return Collections.unmodifiableMap(result);
    }
}
