package com.bank.dispute.service;

import com.bank.dispute.engine.ComplianceGuardrail;
import com.bank.dispute.model.AuditEntry;
import com.bank.dispute.model.PagedResponse;
import com.bank.dispute.repository.AuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    static final int MAX_PAGE_SIZE = 500;

    private final AuditRepository repository;
    private final ComplianceGuardrail guardrail;

    public AuditLogService(AuditRepository repository, ComplianceGuardrail guardrail) {
        this.repository = repository;
        this.guardrail = guardrail;
    }

    public void append(List<AuditEntry> entries) {
        int written = 0;
        for (AuditEntry entry : entries) {
            if (repository.append(entry)) {
                written++;
            } else {
                log.warn("Audit entry {}#{} already recorded; kept the stored copy",
                        entry.getDisputeId(), entry.getSequence());
            }
        }
        log.debug("Appended {} of {} audit entries", written, entries.size());
    }

    public List<AuditEntry> forDispute(String disputeId) {
        return repository.findByDisputeId(disputeId).stream().map(this::outbound).toList();
    }

    /**
     * Paged export feed for downstream audit consumers.
     */
    public PagedResponse<AuditEntry> exportFeed(String disputeId, Instant since, int limit, String cursor) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        PagedResponse<AuditEntry> page = repository.findAll(disputeId, since, pageSize, cursor);
        return new PagedResponse<>(page.data().stream().map(this::outbound).toList(), page.hasMore(), page.nextCursor());
    }

    // Entries were scanned on the way in; scanning again on the way out keeps the feed safe against older records
    private AuditEntry outbound(AuditEntry entry) {
        return entry.toBuilder()
                .detail(guardrail.sanitize(entry.getDetail()))
                .actor(guardrail.sanitize(entry.getActor()))
                .build();
    }
}
