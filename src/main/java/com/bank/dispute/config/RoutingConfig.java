package com.bank.dispute.config;

import com.bank.dispute.model.DisputeReason;
import com.bank.dispute.model.QueueType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.LocalTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "dispute.routing")
public class RoutingConfig {

    // Below this automated-decision confidence a manager must review
    private double confidenceThreshold = 0.7;

    // Disputed amounts above this (minor units) always go to a manager
    private long highValueThresholdMinor = 500_000;

    // Credit-card reasons that may still be resolved straight-through
    private Set<DisputeReason> automatableCreditReasons =
            EnumSet.of(DisputeReason.DUPLICATE, DisputeReason.CREDIT_NOT_PROCESSED);

    // Acknowledgment windows, counted in business hours
    private int specialistAckBusinessHours = 4;
    private int managerAckBusinessHours = 8;

    private LocalTime businessDayStart = LocalTime.of(9, 0);
    private LocalTime businessDayEnd = LocalTime.of(17, 0);

    private int tickIntervalSeconds = 60;

    // Queue depth above which a QueueBacklog signal is raised
    private Map<QueueType, Integer> backlogThresholds = defaultBacklogThresholds();

    public int ackWindowHours(QueueType queue) {
        return switch (queue) {
            case SPECIALIST -> specialistAckBusinessHours;
            case MANAGER -> managerAckBusinessHours;
            default -> 0;
        };
    }

    public int backlogThreshold(QueueType queue) {
        return backlogThresholds.getOrDefault(queue, Integer.MAX_VALUE);
    }

    private static Map<QueueType, Integer> defaultBacklogThresholds() {
        Map<QueueType, Integer> thresholds = new EnumMap<>(QueueType.class);
        thresholds.put(QueueType.AUTO, 500);
        thresholds.put(QueueType.SPECIALIST, 50);
        thresholds.put(QueueType.MANAGER, 20);
        return thresholds;
    }
}
