package com.bank.dispute.engine;

import com.bank.dispute.config.DeadlineConfig;
import com.bank.dispute.exception.DeadlineComputationException;
import com.bank.dispute.model.Deadline;
import com.bank.dispute.model.DeadlineAction;
import com.bank.dispute.model.DeadlineSchedule;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.Regulation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Computes regulatory due-dates for a dispute snapshot.
 *
 * Regime A (Reg E, debit and prepaid):
 *   - provisional credit within N business days of filing, unless the
 *     investigation concluded first
 *   - investigation within 45 calendar days, or 90 when the account is new,
 *     the transaction was cross-border, or it originated at a point of sale
 *
 * Regime B (Reg Z, credit):
 *   - acknowledgment within 30 calendar days
 *   - resolution within two billing cycles, capped at 90 calendar days
 *
 * The calculator never reads a clock; {@code asOf} decides which actions count
 * as already performed. Same snapshot and {@code asOf} always give the same output.
 */
@Component
public class DeadlineCalculator {

    static final String PROVISIONAL_CREDIT = "Provisional Credit Deadline";
    static final String INVESTIGATION = "Investigation Deadline";
    static final String ACKNOWLEDGMENT = "Acknowledgment Deadline";
    static final String RESOLUTION = "Resolution Deadline";

    private final BusinessCalendar calendar;
    private final DeadlineConfig config;

    public DeadlineCalculator(BusinessCalendar calendar, DeadlineConfig config) {
        this.calendar = calendar;
        this.config = config;
    }

    public DeadlineSchedule compute(Dispute snapshot, Instant asOf) {
        if (snapshot.getCreatedAt() == null) {
            throw new DeadlineComputationException(snapshot.getId(), "Dispute has no filing timestamp");
        }
        if (asOf == null) {
            throw new DeadlineComputationException(snapshot.getId(), "No as-of instant supplied");
        }

        Regulation regulation = Regulation.forInstrument(snapshot.getInstrumentClass());
        if (regulation == null) {
            return DeadlineSchedule.builder()
                    .deadlines(Collections.emptyList())
                    .requiresManualClassification(true)
                    .asOf(asOf)
                    .build();
        }

        List<Deadline> deadlines = regulation == Regulation.REG_E
                ? regimeA(snapshot, asOf)
                : regimeB(snapshot, asOf);

        return DeadlineSchedule.builder()
                .regulation(regulation)
                .deadlines(deadlines)
                .requiresManualClassification(false)
                .asOf(asOf)
                .build();
    }

    /**
     * Deadlines that are past due as of {@code asOf} and were not satisfied.
     */
    public List<Deadline> breached(List<Deadline> deadlines, Instant asOf) {
        if (deadlines == null) return Collections.emptyList();
        return deadlines.stream()
                .filter(d -> !d.isSatisfied() && d.getDueAt().isBefore(asOf))
                .toList();
    }

    public boolean isExtendedInvestigation(Dispute snapshot) {
        boolean newAccount = snapshot.getAccountAgeDays() != null
                && snapshot.getAccountAgeDays() < config.getNewAccountDays();
        return newAccount || snapshot.isCrossBorder() || snapshot.isPointOfSale();
    }

    private List<Deadline> regimeA(Dispute snapshot, Instant asOf) {
        Instant filed = snapshot.getCreatedAt();
        List<Deadline> deadlines = new ArrayList<>();

        Instant provisionalDue = calendar.plusBusinessDays(filed, config.getProvisionalCreditBusinessDays());
        boolean concludedBeforeProvisional = happenedBy(snapshot.getConcludedAt(), asOf)
                && !snapshot.getConcludedAt().isAfter(provisionalDue);
        if (!concludedBeforeProvisional) {
            deadlines.add(Deadline.builder()
                    .label(PROVISIONAL_CREDIT)
                    .dueAt(provisionalDue)
                    .regulation(Regulation.REG_E)
                    .actionRequired(DeadlineAction.PROVISIONAL_CREDIT)
                    .description(String.format(
                            "Provide provisional credit within %d business days if the investigation is not complete.",
                            config.getProvisionalCreditBusinessDays()))
                    .satisfied(performedBy(snapshot.getProvisionalCreditIssuedAt(), provisionalDue, asOf))
                    .build());
        }

        int investigationDays = isExtendedInvestigation(snapshot)
                ? config.getExtendedInvestigationDays()
                : config.getInvestigationDays();
        Instant investigationDue = calendar.plusCalendarDays(filed, investigationDays);
        deadlines.add(Deadline.builder()
                .label(INVESTIGATION)
                .dueAt(investigationDue)
                .regulation(Regulation.REG_E)
                .actionRequired(DeadlineAction.RESOLUTION)
                .description(String.format("Complete the investigation within %d calendar days.", investigationDays))
                .satisfied(performedBy(snapshot.getConcludedAt(), investigationDue, asOf))
                .build());

        return deadlines;
    }

    private List<Deadline> regimeB(Dispute snapshot, Instant asOf) {
        Instant filed = snapshot.getCreatedAt();
        List<Deadline> deadlines = new ArrayList<>();

        Instant ackDue = calendar.plusCalendarDays(filed, config.getAcknowledgmentDays());
        deadlines.add(Deadline.builder()
                .label(ACKNOWLEDGMENT)
                .dueAt(ackDue)
                .regulation(Regulation.REG_Z)
                .actionRequired(DeadlineAction.ACKNOWLEDGMENT)
                .description(String.format("Acknowledge the billing error notice within %d calendar days.",
                        config.getAcknowledgmentDays()))
                .satisfied(performedBy(snapshot.getInvestigationStartedAt(), ackDue, asOf))
                .build());

        int cycleDays = snapshot.getBillingCycleDays() != null && snapshot.getBillingCycleDays() > 0
                ? snapshot.getBillingCycleDays()
                : config.getDefaultBillingCycleDays();
        int resolutionDays = Math.min(2 * cycleDays, config.getResolutionCapDays());
        Instant resolutionDue = calendar.plusCalendarDays(filed, resolutionDays);
        deadlines.add(Deadline.builder()
                .label(RESOLUTION)
                .dueAt(resolutionDue)
                .regulation(Regulation.REG_Z)
                .actionRequired(DeadlineAction.RESOLUTION)
                .description(String.format(
                        "Resolve within two billing cycles (%d days, capped at %d).",
                        resolutionDays, config.getResolutionCapDays()))
                .satisfied(performedBy(snapshot.getConcludedAt(), resolutionDue, asOf))
                .build());

        return deadlines;
    }

    private static boolean happenedBy(Instant action, Instant asOf) {
        return action != null && !action.isAfter(asOf);
    }

    private static boolean performedBy(Instant action, Instant due, Instant asOf) {
        return happenedBy(action, asOf) && !action.isAfter(due);
    }
}
