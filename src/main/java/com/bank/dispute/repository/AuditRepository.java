package com.bank.dispute.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.dispute.config.AerospikeConfig;
import com.bank.dispute.model.AuditEntry;
import com.bank.dispute.model.PagedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only audit store. One record per {@code disputeId:sequence}; writes use
 * a create-only policy so existing history is never replaced.
 */
@Repository
public class AuditRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditRepository.class);

    static final Comparator<AuditEntry> FEED_ORDER = Comparator
            .comparing(AuditEntry::getTimestamp)
            .thenComparing(AuditEntry::getDisputeId)
            .thenComparingLong(AuditEntry::getSequence);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy appendOnlyPolicy;

    public AuditRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("appendOnlyWritePolicy") WritePolicy appendOnlyPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.appendOnlyPolicy = appendOnlyPolicy;
    }

    /**
     * @return false when an entry with the same dispute and sequence already exists
     */
    public boolean append(AuditEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, entry.getDisputeId() + ":" + entry.getSequence());

        Bin disputeIdBin = new Bin("disputeId", entry.getDisputeId());
        Bin sequenceBin = new Bin("sequence", entry.getSequence());
        Bin actorBin = new Bin("actor", entry.getActor() != null ? entry.getActor() : "");
        Bin actionBin = new Bin("action", entry.getAction());
        Bin timestampBin = new Bin("timestamp", RecordJson.millis(entry.getTimestamp()));
        Bin detailBin = new Bin("detail", entry.getDetail() != null ? entry.getDetail() : "");

        try {
            client.put(appendOnlyPolicy, key, disputeIdBin, sequenceBin, actorBin, actionBin, timestampBin, detailBin);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.warn("Audit entry {}:{} already recorded, keeping the existing entry",
                        entry.getDisputeId(), entry.getSequence());
                return false;
            }
            throw e;
        }
    }

    public List<AuditEntry> findByDisputeId(String disputeId) {
        List<AuditEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    try {
                        if (disputeId.equals(record.getString("disputeId"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AuditEntry::getSequence));
        return results;
    }

    /**
     * Export feed in ascending (timestamp, dispute, sequence) order.
     *
     * @param disputeId optional filter
     * @param since     optional lower bound on the entry timestamp (inclusive)
     * @param after     cursor returned by the previous page, or null
     */
    public PagedResponse<AuditEntry> findAll(String disputeId, Instant since, int limit, String after) {
        List<AuditEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        AuditEntry cursor = parseCursor(after);
        long sinceMillis = since != null ? since.toEpochMilli() : Long.MIN_VALUE;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    try {
                        if (disputeId != null && !disputeId.isEmpty()
                                && !disputeId.equals(record.getString("disputeId"))) return;
                        if (record.getLong("timestamp") < sinceMillis) return;
                        AuditEntry entry = mapRecord(record);
                        if (cursor != null && FEED_ORDER.compare(entry, cursor) <= 0) return;
                        synchronized (results) {
                            results.add(entry);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });

        results.sort(FEED_ORDER);
        boolean hasMore = results.size() > limit;
        List<AuditEntry> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? cursorOf(page.get(page.size() - 1)) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    static String cursorOf(AuditEntry entry) {
        return entry.getTimestamp().toEpochMilli() + "|" + entry.getDisputeId() + "|" + entry.getSequence();
    }

    static AuditEntry parseCursor(String cursor) {
        if (cursor == null || cursor.isEmpty()) return null;
        String[] parts = cursor.split("\\|");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed audit cursor: " + cursor);
        }
        try {
            return AuditEntry.builder()
                    .timestamp(Instant.ofEpochMilli(Long.parseLong(parts[0])))
                    .disputeId(parts[1])
                    .sequence(Long.parseLong(parts[2]))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed audit cursor: " + cursor, e);
        }
    }

    private AuditEntry mapRecord(Record record) {
        String actor = record.getString("actor");
        String detail = record.getString("detail");
        return AuditEntry.builder()
                .disputeId(record.getString("disputeId"))
                .sequence(record.getLong("sequence"))
                .actor(actor != null && !actor.isEmpty() ? actor : null)
                .action(record.getString("action"))
                .timestamp(RecordJson.instant(record.getLong("timestamp")))
                .detail(detail != null ? detail : "")
                .build();
    }
}
