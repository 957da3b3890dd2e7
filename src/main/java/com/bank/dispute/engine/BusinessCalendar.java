package com.bank.dispute.engine;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * Calendar and business-day arithmetic in a fixed zone. Weekends and the
 * configured holidays are not business days. Business hours run from
 * {@code dayStart} to {@code dayEnd} on business days.
 *
 * Immutable and safe to share between threads.
 */
public class BusinessCalendar {

    private final ZoneId zone;
    private final Set<LocalDate> holidays;
    private final LocalTime dayStart;
    private final LocalTime dayEnd;

    public BusinessCalendar(ZoneId zone, Set<LocalDate> holidays, LocalTime dayStart, LocalTime dayEnd) {
        if (!dayEnd.isAfter(dayStart)) {
            throw new IllegalArgumentException("Business day end must be after start: " + dayStart + "-" + dayEnd);
        }
        this.zone = zone;
        this.holidays = Set.copyOf(holidays);
        this.dayStart = dayStart;
        this.dayEnd = dayEnd;
    }

    public ZoneId getZone() {
        return zone;
    }

    public boolean isBusinessDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    /**
     * Same local wall-clock time, {@code days} calendar days later in the
     * calendar's zone. Across a daylight-saving change the elapsed time is an
     * hour more or less than {@code days * 24h}; regulatory day counts follow
     * the local calendar, not elapsed hours.
     */
    public Instant plusCalendarDays(Instant start, int days) {
        return start.atZone(zone).plusDays(days).toInstant();
    }

    /**
     * Same local time on the {@code days}-th business day after the start date.
     * The start date itself is never counted.
     */
    public Instant plusBusinessDays(Instant start, int days) {
        ZonedDateTime cursor = start.atZone(zone);
        int counted = 0;
        while (counted < days) {
            cursor = cursor.plusDays(1);
            if (isBusinessDay(cursor.toLocalDate())) {
                counted++;
            }
        }
        return cursor.toInstant();
    }

    /**
     * Adds working time, consuming only the business-hours window of business
     * days. A start outside business hours begins counting at the next opening.
     */
    public Instant plusBusinessHours(Instant start, long hours) {
        Duration remaining = Duration.ofHours(hours);
        ZonedDateTime cursor = start.atZone(zone);

        while (true) {
            LocalDate date = cursor.toLocalDate();
            if (!isBusinessDay(date) || !cursor.toLocalTime().isBefore(dayEnd)) {
                cursor = nextOpening(date);
                continue;
            }
            if (cursor.toLocalTime().isBefore(dayStart)) {
                cursor = ZonedDateTime.of(date, dayStart, zone);
            }
            Duration available = Duration.between(cursor, ZonedDateTime.of(date, dayEnd, zone));
            if (remaining.compareTo(available) <= 0) {
                return cursor.plus(remaining).toInstant();
            }
            remaining = remaining.minus(available);
            cursor = nextOpening(date);
        }
    }

    private ZonedDateTime nextOpening(LocalDate after) {
        LocalDate date = after.plusDays(1);
        while (!isBusinessDay(date)) {
            date = date.plusDays(1);
        }
        return ZonedDateTime.of(date, dayStart, zone);
    }
}
