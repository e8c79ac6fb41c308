package com.bank.behaviorauth.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.behaviorauth.config.AerospikeConfig;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.LearningPhaseState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LearningPhaseRepositoryTest {

    @Mock
    private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private final Policy readPolicy = new Policy();
    private LearningPhaseRepository repository;

    @BeforeEach
    void setUp() {
        repository = new LearningPhaseRepository(client, "test", writePolicy, readPolicy);
    }

    @Test
    void save_writesAllBinsUnderUserKey() {
        LearningPhaseState state = LearningPhaseState.builder()
                .userId("USER-001")
                .phase(LearningPhase.GRADUAL_RISK)
                .sessionCount(7)
                .lastSessionId("S-7")
                .lastTransitionAt(1000L)
                .createdAt(500L)
                .build();

        repository.save(state);

        ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
        ArgumentCaptor<Bin> binCaptor = ArgumentCaptor.forClass(Bin.class);
        verify(client).put(eq(writePolicy), keyCaptor.capture(), binCaptor.capture(),
                binCaptor.capture(), binCaptor.capture(), binCaptor.capture(),
                binCaptor.capture(), binCaptor.capture());

        assertThat(keyCaptor.getValue().namespace).isEqualTo("test");
        assertThat(keyCaptor.getValue().setName).isEqualTo(AerospikeConfig.SET_PHASE_STATES);
        Map<String, Object> bins = new HashMap<>();
        for (Bin bin : binCaptor.getAllValues()) {
            bins.put(bin.name, bin.value.getObject());
        }
        assertThat(bins).containsEntry("phase", "gradual_risk")
                .containsEntry("sessionCount", 7L)
                .containsEntry("lastSession", "S-7");
    }

    @Test
    void findByUserId_mapsStoredRecord() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("userId", "USER-001");
        bins.put("phase", "full_auth");
        bins.put("sessionCount", 22L);
        bins.put("lastSession", "S-22");
        bins.put("transitionAt", 2000L);
        bins.put("createdAt", 100L);
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        Optional<LearningPhaseState> result = repository.findByUserId("USER-001");

        assertThat(result).isPresent();
        assertThat(result.get().getPhase()).isEqualTo(LearningPhase.FULL_AUTH);
        assertThat(result.get().getSessionCount()).isEqualTo(22);
        assertThat(result.get().getLastSessionId()).isEqualTo("S-22");
        assertThat(result.get().getLastTransitionAt()).isEqualTo(2000L);
    }

    @Test
    void findByUserId_missingRecord_returnsEmpty() {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(null);

        assertThat(repository.findByUserId("UNKNOWN")).isEmpty();
    }
}
