package com.bank.dispute.engine;

import com.bank.dispute.model.AuditEntry;
import com.bank.dispute.model.DeadlineSchedule;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EvidencePackage;
import com.bank.dispute.model.RoutingDirective;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TransitionOutcome {
    Dispute dispute;
    DisputeStatus fromStatus;
    DisputeStatus toStatus;
    RoutingDirective routing;
    EvidencePackage evidencePackage;        // null unless the dispute entered review
    DeadlineSchedule deadlineSchedule;      // null unless deadlines were (re)computed
    List<AuditEntry> newAuditEntries;
}
