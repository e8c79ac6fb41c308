package com.bank.behaviorauth.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.behaviorauth.config.AerospikeConfig;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.LearningPhaseState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Write-through snapshots of learning-phase state, so phases survive restarts.
 */
@Repository
public class LearningPhaseRepository {

    private static final Logger log = LoggerFactory.getLogger(LearningPhaseRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public LearningPhaseRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(LearningPhaseState state) {
        Key key = new Key(namespace, AerospikeConfig.SET_PHASE_STATES, state.getUserId());

        Bin userIdBin = new Bin("userId", state.getUserId());
        Bin phaseBin = new Bin("phase", state.getPhase().getCode());
        Bin countBin = new Bin("sessionCount", state.getSessionCount());
        Bin lastSessionBin = new Bin("lastSession", state.getLastSessionId());
        Bin transitionBin = new Bin("transitionAt", state.getLastTransitionAt());
        Bin createdAtBin = new Bin("createdAt", state.getCreatedAt());

        client.put(writePolicy, key, userIdBin, phaseBin, countBin, lastSessionBin, transitionBin, createdAtBin);
    }

    public Optional<LearningPhaseState> findByUserId(String userId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PHASE_STATES, userId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(userId, record));
    }

    public List<LearningPhaseState> findAll() {
        List<LearningPhaseState> states = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PHASE_STATES,
                (key, record) -> {
                    try {
                        String userId = record.getString("userId");
                        if (userId != null) {
                            synchronized (states) {
                                states.add(mapRecord(userId, record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read phase state record: {}", e.getMessage());
                    }
                });
        return states;
    }

    public void delete(String userId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PHASE_STATES, userId);
        client.delete(writePolicy, key);
    }

    private LearningPhaseState mapRecord(String userId, Record record) {
        return LearningPhaseState.builder()
                .userId(userId)
                .phase(LearningPhase.fromCode(record.getString("phase")))
                .sessionCount(record.getLong("sessionCount"))
                .lastSessionId(record.getString("lastSession"))
                .lastTransitionAt(record.getLong("transitionAt"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
