package com.bank.dispute.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.dispute.config.AerospikeConfig;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.DisputeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Disputes are stored as one record per id. Status and timestamps live in their
 * own bins for scans; the full aggregate is kept as JSON.
 */
@Repository
public class DisputeRepository {

    private static final Logger log = LoggerFactory.getLogger(DisputeRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public DisputeRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(Dispute dispute) {
        Key key = new Key(namespace, AerospikeConfig.SET_DISPUTES, dispute.getId());

        Bin idBin = new Bin("disputeId", dispute.getId());
        Bin statusBin = new Bin("status", dispute.getStatus().name());
        Bin createdAtBin = new Bin("createdAt", RecordJson.millis(dispute.getCreatedAt()));
        Bin lastTransitionBin = new Bin("lastTransAt", RecordJson.millis(dispute.getLastTransitionAt()));
        Bin versionBin = new Bin("version", dispute.getVersion());
        Bin payloadBin = new Bin("payload", RecordJson.write(dispute));

        client.put(writePolicy, key, idBin, statusBin, createdAtBin, lastTransitionBin, versionBin, payloadBin);
    }

    public Dispute findById(String disputeId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DISPUTES, disputeId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return RecordJson.read(record.getString("payload"), Dispute.class);
    }

    /**
     * All disputes not in a terminal status.
     */
    public List<Dispute> findOpen() {
        List<Dispute> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DISPUTES,
                (key, record) -> {
                    try {
                        DisputeStatus status = DisputeStatus.valueOf(record.getString("status"));
                        if (!status.isTerminal()) {
                            Dispute dispute = RecordJson.read(record.getString("payload"), Dispute.class);
                            synchronized (results) {
                                results.add(dispute);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read dispute record: {}", e.getMessage());
                    }
                });
        return results;
    }
}
