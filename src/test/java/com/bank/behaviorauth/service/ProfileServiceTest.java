package com.bank.behaviorauth.service;

import com.bank.behaviorauth.config.AuthEngineProperties;
import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.config.EngineSettingsHolder;
import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.engine.drift.DriftDetector;
import com.bank.behaviorauth.engine.phase.PhaseManager;
import com.bank.behaviorauth.engine.policy.FailureTracker;
import com.bank.behaviorauth.engine.vector.VectorStore;
import com.bank.behaviorauth.model.BehavioralVector;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.ProfileStatus;
import com.bank.behaviorauth.repository.LearningPhaseRepository;
import com.bank.behaviorauth.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {

    @Mock
    private LearningPhaseRepository phaseRepository;

    private VectorStore vectorStore;
    private DriftDetector driftDetector;
    private PhaseManager phaseManager;
    private FailureTracker failureTracker;
    private ProfileService profileService;
    private EngineSettings settings;

    @BeforeEach
    void setUp() {
        vectorStore = new VectorStore();
        driftDetector = new DriftDetector();
        phaseManager = new PhaseManager(phaseRepository, new MetricsConfig(new SimpleMeterRegistry()));
        failureTracker = new FailureTracker();
        settings = TestDataFactory.defaultSettings();
        profileService = new ProfileService(phaseManager, vectorStore, driftDetector, failureTracker,
                new UserLockRegistry(), new EngineSettingsHolder(new AuthEngineProperties()));
    }

    private void learn(String userId, int sessions) {
        float[] base = TestDataFactory.randomVector(5);
        for (int i = 1; i <= sessions; i++) {
            float[] v = TestDataFactory.near(base, 0.05, i);
            vectorStore.insert(userId, new BehavioralVector(v, 1000L + i, "S-" + i), settings);
            driftDetector.observe(userId, v, settings);
            phaseManager.recordAnalysis(userId, "S-" + i, settings);
        }
    }

    @Test
    void getStatus_unknownUser_isNewInColdStart() {
        ProfileStatus status = profileService.getStatus("USER-404");

        assertThat(status.isNewUser()).isTrue();
        assertThat(status.getPhase()).isEqualTo(LearningPhase.COLD_START);
        assertThat(status.getSessionsToNextPhase()).isEqualTo(1);
        assertThat(status.getStoredVectors()).isZero();
        assertThat(status.isDriftBaselineEstablished()).isFalse();
    }

    @Test
    void getStatus_reportsLearnedState() {
        learn("USER-001", 7);
        failureTracker.recordFailure("USER-001", System.currentTimeMillis());

        ProfileStatus status = profileService.getStatus("USER-001");

        assertThat(status.isNewUser()).isFalse();
        assertThat(status.getPhase()).isEqualTo(LearningPhase.GRADUAL_RISK);
        assertThat(status.getSessionCount()).isEqualTo(7);
        assertThat(status.getSessionsToNextPhase()).isEqualTo(8);
        assertThat(status.getStoredVectors()).isEqualTo(7);
        assertThat(status.isDriftBaselineEstablished()).isTrue();
        assertThat(status.getRecentFailures()).isEqualTo(1);
    }

    @Test
    void resetProfile_dropsEverythingLearned() {
        learn("USER-001", 7);
        failureTracker.recordFailure("USER-001", System.currentTimeMillis());

        profileService.resetProfile("USER-001");

        ProfileStatus status = profileService.getStatus("USER-001");
        assertThat(status.isNewUser()).isTrue();
        assertThat(status.getStoredVectors()).isZero();
        assertThat(status.isDriftBaselineEstablished()).isFalse();
        assertThat(status.getRecentFailures()).isZero();
    }

    @Test
    void getStatistics_countsUsersPerPhase() {
        learn("USER-A", 2);
        learn("USER-B", 6);
        learn("USER-C", 15);

        assertThat(profileService.getStatistics().getPhaseDistribution())
                .containsEntry("learning", 1L)
                .containsEntry("gradual_risk", 1L)
                .containsEntry("full_auth", 1L);
        assertThat(profileService.getStatistics().getUsersInLearning()).isEqualTo(1);
    }
}
