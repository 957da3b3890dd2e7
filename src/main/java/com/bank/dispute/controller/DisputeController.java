package com.bank.dispute.controller;

import com.bank.dispute.model.AuditEntry;
import com.bank.dispute.model.CreateDisputeRequest;
import com.bank.dispute.model.DeadlineSchedule;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeEvent;
import com.bank.dispute.model.NetworkOutcome;
import com.bank.dispute.model.RoutedItem;
import com.bank.dispute.model.TransitionResult;
import com.bank.dispute.service.AuditLogService;
import com.bank.dispute.service.DisputeWorkflowService;
import com.bank.dispute.service.RoutingEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/disputes")
@Tag(name = "Disputes", description = "Dispute intake, lifecycle events and regulatory deadlines")
public class DisputeController {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final DisputeWorkflowService workflowService;
    private final AuditLogService auditLogService;
    private final RoutingEngine routingEngine;

    public DisputeController(DisputeWorkflowService workflowService,
                             AuditLogService auditLogService,
                             RoutingEngine routingEngine) {
        this.workflowService = workflowService;
        this.auditLogService = auditLogService;
        this.routingEngine = routingEngine;
    }

    @PostMapping
    @Operation(summary = "File a dispute",
               description = "Creates a FILED dispute and routes it. Narratives containing card numbers, " +
                       "verification codes or PINs are rejected with 422.")
    public ResponseEntity<Dispute> createDispute(@RequestBody CreateDisputeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workflowService.createDispute(request));
    }

    @GetMapping("/{disputeId}")
    @Operation(summary = "Get a dispute", description = "Current snapshot including deadlines, routing and audit trail")
    public ResponseEntity<Dispute> getDispute(@PathVariable String disputeId) {
        return ResponseEntity.ok(workflowService.getDispute(disputeId));
    }

    @PostMapping("/{disputeId}/events")
    @Operation(summary = "Apply a lifecycle event",
               description = "Moves the dispute through its lifecycle. Requires an Idempotency-Key header; " +
                       "a repeated key for the same event returns the original result.")
    public ResponseEntity<TransitionResult> applyEvent(@PathVariable String disputeId,
                                                       @RequestHeader(IDEMPOTENCY_HEADER) String idempotencyKey,
                                                       @RequestBody DisputeEvent event) {
        event.setIdempotencyKey(idempotencyKey);
        return ResponseEntity.ok(workflowService.applyEvent(disputeId, event));
    }

    @PostMapping("/{disputeId}/network-outcome")
    @Operation(summary = "Record the card network outcome",
               description = "ACCEPTED approves, REJECTED denies, TIMEOUT escalates to a manager")
    public ResponseEntity<TransitionResult> recordNetworkOutcome(@PathVariable String disputeId,
                                                                 @RequestHeader(IDEMPOTENCY_HEADER) String idempotencyKey,
                                                                 @RequestBody Map<String, String> body) {
        String outcome = body.get("outcome");
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        return ResponseEntity.ok(workflowService.recordNetworkOutcome(
                disputeId, NetworkOutcome.valueOf(outcome.toUpperCase()), idempotencyKey, body.get("actor")));
    }

    @PostMapping("/{disputeId}/acknowledge")
    @Operation(summary = "Acknowledge a routed dispute", description = "Stops the acknowledgment SLA clock")
    public ResponseEntity<TransitionResult> acknowledge(@PathVariable String disputeId,
                                                        @RequestHeader(IDEMPOTENCY_HEADER) String idempotencyKey,
                                                        @RequestParam(defaultValue = "ops") String actor) {
        return ResponseEntity.ok(workflowService.acknowledge(disputeId, idempotencyKey, actor));
    }

    @GetMapping("/{disputeId}/deadlines")
    @Operation(summary = "Compute deadlines",
               description = "Regulatory deadlines as of the given instant (defaults to now). Read-only.")
    public ResponseEntity<DeadlineSchedule> getDeadlines(
            @PathVariable String disputeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        return ResponseEntity.ok(workflowService.computeDeadlines(disputeId, asOf));
    }

    @GetMapping("/{disputeId}/valid-events")
    @Operation(summary = "List events accepted in the current status")
    public ResponseEntity<List<String>> getValidEvents(@PathVariable String disputeId) {
        return ResponseEntity.ok(workflowService.validEvents(disputeId));
    }

    @GetMapping("/{disputeId}/audit")
    @Operation(summary = "Audit trail of one dispute", description = "Append-only entries in sequence order")
    public ResponseEntity<List<AuditEntry>> getAuditTrail(@PathVariable String disputeId) {
        return ResponseEntity.ok(auditLogService.forDispute(disputeId));
    }

    @GetMapping("/{disputeId}/routing")
    @Operation(summary = "Routing history of one dispute")
    public ResponseEntity<List<RoutedItem>> getRoutingHistory(@PathVariable String disputeId) {
        return ResponseEntity.ok(routingEngine.history(disputeId));
    }
}
