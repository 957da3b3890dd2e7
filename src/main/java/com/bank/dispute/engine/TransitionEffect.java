package com.bank.dispute.engine;

import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.RoutingDirective;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TransitionEffect {
    DisputeStatus targetStatus;             // null keeps the current status
    @Builder.Default
    RoutingDirective routing = RoutingDirective.none();
    String detail;
    boolean emitEvidencePackage;
}
