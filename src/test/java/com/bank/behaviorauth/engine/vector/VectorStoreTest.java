package com.bank.behaviorauth.engine.vector;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.exception.DimensionMismatchException;
import com.bank.behaviorauth.model.BehavioralVector;
import com.bank.behaviorauth.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorStoreTest {

    private VectorStore store;
    private EngineSettings settings;

    @BeforeEach
    void setUp() {
        store = new VectorStore();
        settings = TestDataFactory.defaultSettings();
    }

    private void insert(String userId, float[] values, String sessionId, long timestamp) {
        store.insert(userId, new BehavioralVector(values, timestamp, sessionId), settings);
    }

    @Test
    void insert_beyondCap_evictsOldest() {
        float[] base = TestDataFactory.randomVector(1);
        for (int i = 0; i < 105; i++) {
            insert("USER-001", TestDataFactory.near(base, 0.05, i), "S-" + i, 1000L + i);
        }

        assertThat(store.size("USER-001")).isEqualTo(100);

        VectorSearchResult result = store.query("USER-001", base, 100, settings);
        assertThat(result.matches()).extracting(VectorMatch::sessionId)
                .doesNotContain("S-0", "S-4")
                .contains("S-5", "S-104");
    }

    @Test
    void insert_wrongDimension_throwsAndStoresNothing() {
        assertThatThrownBy(() -> insert("USER-001", new float[89], "S-1", 1000L))
                .isInstanceOf(DimensionMismatchException.class);

        assertThat(store.size("USER-001")).isZero();
    }

    @Test
    void query_wrongDimension_throws() {
        assertThatThrownBy(() -> store.query("USER-001", new float[91], 5, settings))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("90");
    }

    @Test
    void query_unknownUser_reportsInsufficientData() {
        VectorSearchResult result = store.query("USER-404", TestDataFactory.randomVector(1), 5, settings);

        assertThat(result.insufficientData()).isTrue();
        assertThat(result.storedVectors()).isZero();
        assertThat(result.matches()).isEmpty();
    }

    @Test
    void query_belowMinimumVectors_reportsInsufficientData() {
        float[] base = TestDataFactory.randomVector(1);
        for (int i = 0; i < 4; i++) {
            insert("USER-001", TestDataFactory.near(base, 0.05, i), "S-" + i, 1000L + i);
        }

        VectorSearchResult result = store.query("USER-001", base, 5, settings);

        assertThat(result.insufficientData()).isTrue();
        assertThat(result.storedVectors()).isEqualTo(4);
    }

    @Test
    void query_ranksBySimilarityDescending() {
        float[] base = TestDataFactory.randomVector(1);
        insert("USER-001", TestDataFactory.randomVector(50), "S-other-1", 1000L);
        insert("USER-001", TestDataFactory.near(base, 0.4, 2), "S-loose", 1001L);
        insert("USER-001", TestDataFactory.near(base, 0.01, 3), "S-close", 1002L);
        insert("USER-001", TestDataFactory.randomVector(51), "S-other-2", 1003L);
        insert("USER-001", TestDataFactory.randomVector(52), "S-other-3", 1004L);

        VectorSearchResult result = store.query("USER-001", base, 3, settings);

        assertThat(result.matches()).hasSize(3);
        assertThat(result.matches().get(0).sessionId()).isEqualTo("S-close");
        assertThat(result.matches().get(1).sessionId()).isEqualTo("S-loose");
        assertThat(result.matches().get(0).score()).isGreaterThan(result.matches().get(1).score());
    }

    @Test
    void query_tiedScores_returnMostRecentFirst() {
        float[] same = TestDataFactory.randomVector(7);
        for (int i = 1; i <= 5; i++) {
            insert("USER-001", same, "S-" + i, 1000L + i);
        }

        VectorSearchResult result = store.query("USER-001", same, 5, settings);

        assertThat(result.matches()).extracting(VectorMatch::sessionId)
                .containsExactly("S-5", "S-4", "S-3", "S-2", "S-1");
    }

    @Test
    void query_isScaleInvariant() {
        float[] base = TestDataFactory.randomVector(3);
        float[] scaled = new float[base.length];
        for (int i = 0; i < base.length; i++) {
            scaled[i] = base[i] * 10f;
        }
        for (int i = 0; i < 5; i++) {
            insert("USER-001", scaled, "S-" + i, 1000L + i);
        }

        VectorSearchResult result = store.query("USER-001", base, 1, settings);

        assertThat(result.bestScore()).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void usersAreIsolated() {
        float[] base = TestDataFactory.randomVector(1);
        for (int i = 0; i < 5; i++) {
            insert("USER-001", base, "S-" + i, 1000L + i);
        }

        assertThat(store.size("USER-002")).isZero();
        assertThat(store.query("USER-002", base, 5, settings).insufficientData()).isTrue();
    }

    @Test
    void clear_removesUserVectors() {
        insert("USER-001", TestDataFactory.randomVector(1), "S-1", 1000L);
        store.clear("USER-001");

        assertThat(store.size("USER-001")).isZero();
    }
}
