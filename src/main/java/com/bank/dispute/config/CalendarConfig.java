package com.bank.dispute.config;

import com.bank.dispute.engine.BusinessCalendar;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.HashSet;

@Configuration
public class CalendarConfig {

    // Only the scheduler and the REST adapters read the clock; the engine takes explicit instants
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BusinessCalendar businessCalendar(DeadlineConfig deadlineConfig, RoutingConfig routingConfig) {
        return new BusinessCalendar(
                ZoneId.of(deadlineConfig.getZone()),
                new HashSet<>(deadlineConfig.getHolidays()),
                routingConfig.getBusinessDayStart(),
                routingConfig.getBusinessDayEnd());
    }
}
