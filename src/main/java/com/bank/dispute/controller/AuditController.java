package com.bank.dispute.controller;

import com.bank.dispute.model.AuditEntry;
import com.bank.dispute.model.PagedResponse;
import com.bank.dispute.service.AuditLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Export feed of the append-only audit log")
public class AuditController {

    private final AuditLogService auditLogService;

    public AuditController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @GetMapping
    @Operation(summary = "Export audit entries",
               description = "Entries in ascending time order. Pass nextCursor from the previous page as 'after'.")
    public ResponseEntity<PagedResponse<AuditEntry>> exportFeed(
            @RequestParam(required = false) String disputeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String after) {
        return ResponseEntity.ok(auditLogService.exportFeed(disputeId, since, limit, after));
    }
}
