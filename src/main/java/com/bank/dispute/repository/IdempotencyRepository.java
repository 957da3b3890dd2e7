package com.bank.dispute.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.dispute.config.AerospikeConfig;
import com.bank.dispute.model.DisputeStatus;
import com.bank.dispute.model.EventType;
import com.bank.dispute.model.IdempotencyRecord;
import com.bank.dispute.model.TransitionResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Stored transition results keyed by {@code disputeId:idempotencyKey}. Records
 * expire with the server-side TTL.
 */
@Repository
public class IdempotencyRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public IdempotencyRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(IdempotencyRecord record, int ttlSeconds) {
        Key key = key(record.getDisputeId(), record.getIdempotencyKey());

        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = ttlSeconds;

        Bin disputeIdBin = new Bin("disputeId", record.getDisputeId());
        Bin idemKeyBin = new Bin("idemKey", record.getIdempotencyKey());
        Bin eventTypeBin = new Bin("eventType", record.getEventType().name());
        Bin sourceStatusBin = new Bin("srcStatus", record.getSourceStatus().name());
        Bin resultBin = new Bin("result", RecordJson.write(record.getResult()));
        Bin storedAtBin = new Bin("storedAt", record.getStoredAt());

        client.put(policy, key, disputeIdBin, idemKeyBin, eventTypeBin, sourceStatusBin, resultBin, storedAtBin);
    }

    public IdempotencyRecord find(String disputeId, String idempotencyKey) {
        Record record = client.get(readPolicy, key(disputeId, idempotencyKey));
        if (record == null) return null;
        return IdempotencyRecord.builder()
                .disputeId(record.getString("disputeId"))
                .idempotencyKey(record.getString("idemKey"))
                .eventType(EventType.valueOf(record.getString("eventType")))
                .sourceStatus(DisputeStatus.valueOf(record.getString("srcStatus")))
                .result(RecordJson.read(record.getString("result"), TransitionResult.class))
                .storedAt(record.getLong("storedAt"))
                .build();
    }

    private Key key(String disputeId, String idempotencyKey) {
        return new Key(namespace, AerospikeConfig.SET_IDEMPOTENCY, disputeId + ":" + idempotencyKey);
    }
}
