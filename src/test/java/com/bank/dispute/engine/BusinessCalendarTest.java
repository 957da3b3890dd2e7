package com.bank.dispute.engine;

import com.bank.dispute.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

import static com.bank.dispute.testutil.TestDataFactory.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BusinessCalendarTest {

    private final BusinessCalendar calendar = TestDataFactory.businessCalendar();

    @Test
    void plusBusinessDays_skipsWeekendsAndKeepsLocalTime() {
        // Mon 2 Mar + 10 business days crosses two weekends and the DST change
        assertThat(calendar.plusBusinessDays(at(2026, 3, 2, 10, 0), 10)).isEqualTo(at(2026, 3, 16, 10, 0));
    }

    @Test
    void plusBusinessDays_skipsHolidays() {
        // 16 Feb 2026 is a configured holiday
        assertThat(calendar.plusBusinessDays(at(2026, 2, 9, 10, 0), 10)).isEqualTo(at(2026, 2, 24, 10, 0));
    }

    @Test
    void plusBusinessDays_fromWeekendStartsCountingNextBusinessDay() {
        assertThat(calendar.plusBusinessDays(at(2026, 3, 7, 12, 0), 1)).isEqualTo(at(2026, 3, 9, 12, 0));
    }

    @Test
    void plusCalendarDays_keepsLocalTimeAcrossDst() {
        assertThat(calendar.plusCalendarDays(at(2026, 3, 2, 10, 0), 45)).isEqualTo(at(2026, 4, 16, 10, 0));
    }

    @Test
    void plusCalendarDays_springForward_isOneHourShortOfWholeDays() {
        Instant start = at(2026, 3, 2, 10, 0);
        Instant due = calendar.plusCalendarDays(start, 45);

        assertThat(due.atZone(TestDataFactory.ZONE).toLocalTime()).isEqualTo(LocalTime.of(10, 0));
        assertThat(Duration.between(start, due)).isEqualTo(Duration.ofDays(45).minusHours(1));
    }

    @Test
    void plusCalendarDays_fallBack_isOneHourOverWholeDays() {
        // 1 Nov 2026 clocks go back in New York
        Instant start = at(2026, 10, 20, 10, 0);
        Instant due = calendar.plusCalendarDays(start, 30);

        assertThat(due).isEqualTo(at(2026, 11, 19, 10, 0));
        assertThat(Duration.between(start, due)).isEqualTo(Duration.ofDays(30).plusHours(1));
    }

    @Test
    void plusBusinessHours_withinOneDay() {
        assertThat(calendar.plusBusinessHours(at(2026, 3, 2, 10, 0), 4)).isEqualTo(at(2026, 3, 2, 14, 0));
    }

    @Test
    void plusBusinessHours_spillsOverWeekend() {
        // Friday 16:00 + 4h: one hour on Friday, three on Monday
        assertThat(calendar.plusBusinessHours(at(2026, 3, 6, 16, 0), 4)).isEqualTo(at(2026, 3, 9, 12, 0));
    }

    @Test
    void plusBusinessHours_beforeOpeningStartsAtOpening() {
        assertThat(calendar.plusBusinessHours(at(2026, 3, 2, 7, 0), 4)).isEqualTo(at(2026, 3, 2, 13, 0));
    }

    @Test
    void plusBusinessHours_afterCloseStartsNextBusinessDay() {
        assertThat(calendar.plusBusinessHours(at(2026, 3, 2, 18, 30), 8)).isEqualTo(at(2026, 3, 3, 17, 0));
    }

    @Test
    void isBusinessDay_excludesWeekendsAndHolidays() {
        assertThat(calendar.isBusinessDay(LocalDate.of(2026, 3, 2))).isTrue();
        assertThat(calendar.isBusinessDay(LocalDate.of(2026, 3, 7))).isFalse();
        assertThat(calendar.isBusinessDay(LocalDate.of(2026, 12, 25))).isFalse();
    }

    @Test
    void constructor_rejectsInvertedBusinessDay() {
        assertThatThrownBy(() -> new BusinessCalendar(TestDataFactory.ZONE, Set.of(),
                LocalTime.of(17, 0), LocalTime.of(9, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
