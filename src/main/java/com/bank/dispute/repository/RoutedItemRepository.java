package com.bank.dispute.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.dispute.config.AerospikeConfig;
import com.bank.dispute.model.QueueType;
import com.bank.dispute.model.RoutedItem;
import com.bank.dispute.model.RoutedItemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
public class RoutedItemRepository {

    private static final Logger log = LoggerFactory.getLogger(RoutedItemRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public RoutedItemRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(RoutedItem item) {
        Key key = new Key(namespace, AerospikeConfig.SET_ROUTED_ITEMS, item.getItemId());

        Bin itemIdBin = new Bin("itemId", item.getItemId());
        Bin disputeIdBin = new Bin("disputeId", item.getDisputeId());
        Bin queueBin = new Bin("queue", item.getQueue().name());
        Bin statusBin = new Bin("status", item.getStatus().name());
        Bin reasonBin = new Bin("reason", item.getReason() != null ? item.getReason() : "");
        Bin amountBin = new Bin("amountMinor", item.getAmountMinor());
        Bin assignedAtBin = new Bin("assignedAt", RecordJson.millis(item.getAssignedAt()));
        Bin ackAtBin = new Bin("ackAt", RecordJson.millis(item.getAcknowledgedAt()));
        Bin actionedAtBin = new Bin("actionedAt", RecordJson.millis(item.getActionedAt()));
        Bin slaDueBin = new Bin("slaDueAt", RecordJson.millis(item.getSlaDueAt()));
        Bin reopenBin = new Bin("reopenCount", item.getReopenCount());

        client.put(writePolicy, key,
                itemIdBin, disputeIdBin, queueBin, statusBin, reasonBin, amountBin,
                assignedAtBin, ackAtBin, actionedAtBin, slaDueBin, reopenBin);
    }

    public List<RoutedItem> findByDisputeId(String disputeId) {
        List<RoutedItem> results = scan(record -> disputeId.equals(record.getString("disputeId")));
        results.sort(Comparator.comparing(RoutedItem::getAssignedAt));
        return results;
    }

    /**
     * Items still queued or acknowledged; used to rebuild the in-memory queues on startup.
     */
    public List<RoutedItem> findOpen() {
        return scan(record -> RoutedItemStatus.valueOf(record.getString("status")).isOpen());
    }

    public List<RoutedItem> findAll() {
        return scan(record -> true);
    }

    private List<RoutedItem> scan(Predicate<Record> filter) {
        List<RoutedItem> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ROUTED_ITEMS,
                (key, record) -> {
                    try {
                        if (filter.test(record)) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read routed item record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private RoutedItem mapRecord(Record record) {
        String reason = record.getString("reason");
        return RoutedItem.builder()
                .itemId(record.getString("itemId"))
                .disputeId(record.getString("disputeId"))
                .queue(QueueType.valueOf(record.getString("queue")))
                .status(RoutedItemStatus.valueOf(record.getString("status")))
                .reason(reason != null && !reason.isEmpty() ? reason : null)
                .amountMinor(record.getLong("amountMinor"))
                .assignedAt(RecordJson.instant(record.getLong("assignedAt")))
                .acknowledgedAt(RecordJson.instant(record.getLong("ackAt")))
                .actionedAt(RecordJson.instant(record.getLong("actionedAt")))
                .slaDueAt(RecordJson.instant(record.getLong("slaDueAt")))
                .reopenCount(record.getInt("reopenCount"))
                .build();
    }
}
