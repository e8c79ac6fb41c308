package com.bank.behaviorauth.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.behaviorauth.config.AerospikeConfig;
import com.bank.behaviorauth.model.DecisionRecord;
import com.bank.behaviorauth.model.PagedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;

@ExtendWith(MockitoExtension.class)
class DecisionAuditRepositoryTest {

    @Mock
    private AerospikeClient client;

    private DecisionAuditRepository repository;

    @BeforeEach
    void setUp() {
        repository = new DecisionAuditRepository(client, "test", new WritePolicy(), new Policy());
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (long decidedAt = 1000L; decidedAt <= 3000L; decidedAt += 1000L) {
                callback.scanCallback(new Key("test", AerospikeConfig.SET_DECISIONS, "DEC-" + decidedAt),
                        record("USER-001", decidedAt));
            }
            callback.scanCallback(new Key("test", AerospikeConfig.SET_DECISIONS, "DEC-other"),
                    record("USER-002", 5000L));
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq(AerospikeConfig.SET_DECISIONS),
                any(ScanCallback.class));
    }

    private static Record record(String userId, long decidedAt) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("decisionId", "DEC-" + decidedAt);
        bins.put("userId", userId);
        bins.put("sessionId", "S-" + decidedAt);
        bins.put("decision", "allow");
        bins.put("fusedRisk", 0.12);
        bins.put("phase", "full_auth");
        bins.put("policyLevel", "level_2");
        bins.put("ruleFired", "RISK_ALLOW");
        bins.put("breakdown", "{}");
        bins.put("degraded", "[]");
        bins.put("explanation", "rule=RISK_ALLOW");
        bins.put("decidedAt", decidedAt);
        bins.put("latencyMs", 4L);
        return new Record(bins, 1, 0);
    }

    @Test
    void findByUserId_pagesNewestFirstWithCursor() {
        PagedResponse<DecisionRecord> page = repository.findByUserId("USER-001", 2, null);

        assertThat(page.data()).extracting(DecisionRecord::getDecidedAt).containsExactly(3000L, 2000L);
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextCursor()).isEqualTo("2000");
    }

    @Test
    void findByUserId_cursorSkipsNewerRecords() {
        PagedResponse<DecisionRecord> page = repository.findByUserId("USER-001", 5, 2000L);

        assertThat(page.data()).extracting(DecisionRecord::getDecidedAt).containsExactly(1000L);
        assertThat(page.hasMore()).isFalse();
        assertThat(page.nextCursor()).isNull();
    }

    @Test
    void findByUserId_nonPositiveLimit_returnsSingleRecordPage() {
        PagedResponse<DecisionRecord> page = repository.findByUserId("USER-001", 0, null);

        assertThat(page.data()).hasSize(1);
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextCursor()).isEqualTo("3000");
    }
}
