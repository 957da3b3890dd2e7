package com.bank.dispute.engine;

import com.bank.dispute.exception.DeadlineComputationException;
import com.bank.dispute.model.Deadline;
import com.bank.dispute.model.DeadlineAction;
import com.bank.dispute.model.DeadlineSchedule;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.PaymentInstrumentClass;
import com.bank.dispute.model.Regulation;
import com.bank.dispute.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.bank.dispute.testutil.TestDataFactory.FILED_AT;
import static com.bank.dispute.testutil.TestDataFactory.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlineCalculatorTest {

    private final DeadlineCalculator calculator = TestDataFactory.deadlineCalculator();

    @Test
    void debitDispute_producesProvisionalCreditAndInvestigationDeadlines() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED);

        DeadlineSchedule schedule = calculator.compute(dispute, FILED_AT);

        assertThat(schedule.getRegulation()).isEqualTo(Regulation.REG_E);
        assertThat(schedule.isRequiresManualClassification()).isFalse();
        assertThat(schedule.getDeadlines()).extracting(Deadline::getLabel)
                .containsExactly(DeadlineCalculator.PROVISIONAL_CREDIT, DeadlineCalculator.INVESTIGATION);
        assertThat(schedule.getDeadlines().get(0).getDueAt()).isEqualTo(at(2026, 3, 16, 10, 0));
        assertThat(schedule.getDeadlines().get(0).getActionRequired()).isEqualTo(DeadlineAction.PROVISIONAL_CREDIT);
        assertThat(schedule.getDeadlines().get(1).getDueAt()).isEqualTo(at(2026, 4, 16, 10, 0));
        assertThat(schedule.getDeadlines()).noneMatch(Deadline::isSatisfied);
    }

    @Test
    void sameSnapshotAndAsOf_giveIdenticalSchedules() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.PREPAID, DisputeStatus.FILED);
        Instant asOf = FILED_AT.plusSeconds(86_400);

        assertThat(calculator.compute(dispute, asOf)).isEqualTo(calculator.compute(dispute, asOf));
    }

    @Test
    void newAccount_extendsInvestigationTo90Days() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED);
        dispute.setAccountAgeDays(10);

        Deadline investigation = calculator.compute(dispute, FILED_AT).getDeadlines().get(1);

        assertThat(investigation.getDueAt()).isEqualTo(at(2026, 5, 31, 10, 0));
    }

    @Test
    void crossBorderOrPointOfSale_extendsInvestigation() {
        Dispute crossBorder = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED);
        crossBorder.setCrossBorder(true);
        Dispute pos = TestDataFactory.createDispute("D-2", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED);
        pos.setPointOfSale(true);

        assertThat(calculator.isExtendedInvestigation(crossBorder)).isTrue();
        assertThat(calculator.isExtendedInvestigation(pos)).isTrue();
        assertThat(calculator.isExtendedInvestigation(
                TestDataFactory.createDispute("D-3", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED))).isFalse();
    }

    @Test
    void provisionalCredit_omittedWhenConcludedBeforeItsDeadline() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.APPROVED);
        dispute.setConcludedAt(at(2026, 3, 5, 12, 0));

        List<Deadline> deadlines = calculator.compute(dispute, at(2026, 3, 6, 9, 0)).getDeadlines();

        assertThat(deadlines).extracting(Deadline::getLabel).containsExactly(DeadlineCalculator.INVESTIGATION);
        assertThat(deadlines.get(0).isSatisfied()).isTrue();
    }

    @Test
    void conclusionAfterAsOf_doesNotCountYet() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.APPROVED);
        dispute.setConcludedAt(at(2026, 3, 5, 12, 0));

        List<Deadline> deadlines = calculator.compute(dispute, at(2026, 3, 4, 9, 0)).getDeadlines();

        assertThat(deadlines).hasSize(2);
        assertThat(deadlines).noneMatch(Deadline::isSatisfied);
    }

    @Test
    void provisionalCredit_satisfiedWhenIssuedInTime() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.UNDER_REVIEW);
        dispute.setProvisionalCreditIssuedAt(at(2026, 3, 10, 11, 0));

        Deadline provisional = calculator.compute(dispute, at(2026, 3, 20, 9, 0)).getDeadlines().get(0);

        assertThat(provisional.isSatisfied()).isTrue();
    }

    @Test
    void creditDispute_usesRegimeBWithoutProvisionalCredit() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.CREDIT, DisputeStatus.FILED);
        dispute.setAmountMinor(200_000);

        DeadlineSchedule schedule = calculator.compute(dispute, FILED_AT);

        assertThat(schedule.getRegulation()).isEqualTo(Regulation.REG_Z);
        assertThat(schedule.getDeadlines()).extracting(Deadline::getLabel)
                .containsExactly(DeadlineCalculator.ACKNOWLEDGMENT, DeadlineCalculator.RESOLUTION);
        assertThat(schedule.getDeadlines()).noneMatch(d -> d.getActionRequired() == DeadlineAction.PROVISIONAL_CREDIT);
        assertThat(schedule.getDeadlines().get(0).getDueAt()).isEqualTo(at(2026, 4, 1, 10, 0));
        // two 30-day cycles
        assertThat(schedule.getDeadlines().get(1).getDueAt()).isEqualTo(at(2026, 5, 1, 10, 0));
    }

    @Test
    void creditResolution_cappedAt90Days() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.CREDIT, DisputeStatus.FILED);
        dispute.setBillingCycleDays(60);

        Deadline resolution = calculator.compute(dispute, FILED_AT).getDeadlines().get(1);

        assertThat(resolution.getDueAt()).isEqualTo(at(2026, 5, 31, 10, 0));
    }

    @Test
    void creditAcknowledgment_satisfiedOnceInvestigationStarted() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.CREDIT, DisputeStatus.AWAITING_EVIDENCE);
        dispute.setInvestigationStartedAt(at(2026, 3, 3, 10, 0));

        Deadline ack = calculator.compute(dispute, at(2026, 3, 4, 10, 0)).getDeadlines().get(0);

        assertThat(ack.isSatisfied()).isTrue();
    }

    @Test
    void unrecognizedInstrument_requiresManualClassification() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.UNRECOGNIZED, DisputeStatus.FILED);

        DeadlineSchedule schedule = calculator.compute(dispute, FILED_AT);

        assertThat(schedule.isRequiresManualClassification()).isTrue();
        assertThat(schedule.getRegulation()).isNull();
        assertThat(schedule.getDeadlines()).isEmpty();
    }

    @Test
    void missingFilingTimestamp_throws() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED);
        dispute.setCreatedAt(null);

        assertThatThrownBy(() -> calculator.compute(dispute, FILED_AT))
                .isInstanceOf(DeadlineComputationException.class);
    }

    @Test
    void breached_returnsOnlyUnsatisfiedPastDeadlines() {
        Dispute dispute = TestDataFactory.createDispute("D-1", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED);
        List<Deadline> deadlines = calculator.compute(dispute, FILED_AT).getDeadlines();

        assertThat(calculator.breached(deadlines, at(2026, 3, 16, 9, 0))).isEmpty();
        assertThat(calculator.breached(deadlines, at(2026, 3, 17, 9, 0)))
                .extracting(Deadline::getLabel).containsExactly(DeadlineCalculator.PROVISIONAL_CREDIT);
        assertThat(calculator.breached(null, FILED_AT)).isEmpty();
    }
}
