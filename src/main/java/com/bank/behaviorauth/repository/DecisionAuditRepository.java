package com.bank.behaviorauth.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.behaviorauth.config.AerospikeConfig;
import com.bank.behaviorauth.model.AuthDecision;
import com.bank.behaviorauth.model.DecisionRecord;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.PagedResponse;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.model.PolicyRule;
import com.bank.behaviorauth.model.SignalContribution;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of authentication decisions.
 */
@Repository
public class DecisionAuditRepository {

    private static final Logger log = LoggerFactory.getLogger(DecisionAuditRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public DecisionAuditRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(DecisionRecord record) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISIONS, record.getDecisionId());

        Bin decisionIdBin = new Bin("decisionId", record.getDecisionId());
        Bin userIdBin = new Bin("userId", record.getUserId());
        Bin sessionIdBin = new Bin("sessionId", record.getSessionId());
        Bin decisionBin = new Bin("decision", record.getDecision().getCode());
        Bin riskBin = new Bin("fusedRisk", record.getFusedRisk());
        Bin phaseBin = new Bin("phase", record.getPhase().getCode());
        Bin levelBin = new Bin("policyLevel", record.getPolicyLevel() == null ? null : record.getPolicyLevel().getCode());
        Bin ruleBin = new Bin("ruleFired", record.getRuleFired().name());
        Bin breakdownBin = new Bin("breakdown", toJson(record.getBreakdown()));
        Bin degradedBin = new Bin("degraded", toJson(record.getDegradedSources()));
        Bin explanationBin = new Bin("explanation", record.getExplanation());
        Bin decidedAtBin = new Bin("decidedAt", record.getDecidedAt());
        Bin latencyBin = new Bin("latencyMs", record.getLatencyMs());

        client.put(writePolicy, key,
                decisionIdBin, userIdBin, sessionIdBin, decisionBin, riskBin, phaseBin,
                levelBin, ruleBin, breakdownBin, degradedBin, explanationBin, decidedAtBin, latencyBin);
    }

    public DecisionRecord findByDecisionId(String decisionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISIONS, decisionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public PagedResponse<DecisionRecord> findByUserId(String userId, int limit, Long before) {
        List<DecisionRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISIONS,
                (key, record) -> {
                    try {
                        if (!userId.equals(record.getString("userId"))) return;
                        if (before != null && record.getLong("decidedAt") >= before) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read decision record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(DecisionRecord::getDecidedAt).reversed());
        int pageSize = Math.max(1, limit);
        boolean hasMore = results.size() > pageSize;
        List<DecisionRecord> page = hasMore ? new ArrayList<>(results.subList(0, pageSize)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getDecidedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private DecisionRecord mapRecord(Record record) {
        String level = record.getString("policyLevel");
        return DecisionRecord.builder()
                .decisionId(record.getString("decisionId"))
                .userId(record.getString("userId"))
                .sessionId(record.getString("sessionId"))
                .decision(AuthDecision.fromCode(record.getString("decision")))
                .fusedRisk(record.getDouble("fusedRisk"))
                .phase(LearningPhase.fromCode(record.getString("phase")))
                .policyLevel(level == null ? null : PolicyLevel.fromCode(level))
                .ruleFired(PolicyRule.valueOf(record.getString("ruleFired")))
                .breakdown(readBreakdown(record.getString("breakdown")))
                .degradedSources(readSources(record.getString("degraded")))
                .explanation(record.getString("explanation"))
                .decidedAt(record.getLong("decidedAt"))
                .latencyMs(record.getLong("latencyMs"))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize decision field", e);
            return null;
        }
    }

    private Map<String, SignalContribution> readBreakdown(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, SignalContribution>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize decision breakdown", e);
            return Collections.emptyMap();
        }
    }

    private List<String> readSources(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize degraded sources", e);
            return Collections.emptyList();
        }
    }
}
