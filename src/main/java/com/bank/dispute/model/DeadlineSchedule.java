package com.bank.dispute.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Output of the deadline calculator for one dispute snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadlineSchedule {
    private Regulation regulation;              // null when the instrument class is unrecognized
    private List<Deadline> deadlines;
    private boolean requiresManualClassification;
    private Instant asOf;
}
