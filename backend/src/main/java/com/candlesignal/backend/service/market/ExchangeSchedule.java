package com.candlesignal.backend.service.market;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Regular weekday session of one exchange in its local time zone.
 */
public record ExchangeSchedule(String exchange, ZoneId zone, LocalTime open, LocalTime close) {

    public boolean isOpenAt(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        DayOfWeek day = local.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(open) && !time.isAfter(close);
    }

    public Instant closeOn(LocalDate date) {
        return date.atTime(close).atZone(zone).toInstant();
    }
}
