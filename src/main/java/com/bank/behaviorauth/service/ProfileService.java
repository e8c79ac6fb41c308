package com.bank.behaviorauth.service;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.config.EngineSettingsHolder;
import com.bank.behaviorauth.engine.drift.DriftDetector;
import com.bank.behaviorauth.engine.drift.DriftStatus;
import com.bank.behaviorauth.engine.phase.PhaseManager;
import com.bank.behaviorauth.engine.policy.FailureTracker;
import com.bank.behaviorauth.engine.vector.VectorStore;
import com.bank.behaviorauth.model.LearningPhaseState;
import com.bank.behaviorauth.model.LearningStatistics;
import com.bank.behaviorauth.model.ProfileStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read and reset a user's behavioral profile: phase, stored vectors, drift
 * baseline and failure history.
 */
@Service
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final PhaseManager phaseManager;
    private final VectorStore vectorStore;
    private final DriftDetector driftDetector;
    private final FailureTracker failureTracker;
    private final UserLockRegistry lockRegistry;
    private final EngineSettingsHolder settingsHolder;

    public ProfileService(PhaseManager phaseManager, VectorStore vectorStore, DriftDetector driftDetector,
                          FailureTracker failureTracker, UserLockRegistry lockRegistry,
                          EngineSettingsHolder settingsHolder) {
        this.phaseManager = phaseManager;
        this.vectorStore = vectorStore;
        this.driftDetector = driftDetector;
        this.failureTracker = failureTracker;
        this.lockRegistry = lockRegistry;
        this.settingsHolder = settingsHolder;
    }

    /**
     * Learning status of a user. Unknown users get a fully-populated new-user status.
     */
    public ProfileStatus getStatus(String userId) {
        EngineSettings settings = settingsHolder.current();
        LearningPhaseState state = phaseManager.stateFor(userId);
        DriftStatus drift = driftDetector.baselineOf(userId);

        return ProfileStatus.builder()
                .userId(userId)
                .newUser(state.isNewUser())
                .phase(state.getPhase())
                .sessionCount(state.getSessionCount())
                .sessionsToNextPhase(PhaseManager.sessionsToNextPhase(state, settings))
                .storedVectors(vectorStore.size(userId))
                .driftBaselineEstablished(drift.baselineEstablished())
                .driftBaselineUpdatedAt(drift.baselineUpdatedAt())
                .recentFailures(failureTracker.countRecent(userId, System.currentTimeMillis()))
                .lastTransitionAt(state.getLastTransitionAt())
                .build();
    }

    /**
     * Forget everything learned about a user. The only way back to cold_start.
     */
    public void resetProfile(String userId) {
        lockRegistry.withLock(userId, () -> {
            vectorStore.clear(userId);
            driftDetector.clear(userId);
            failureTracker.clear(userId);
            phaseManager.reset(userId);
            return null;
        });
        log.info("Profile reset for user {}", userId);
    }

    public LearningStatistics getStatistics() {
        return phaseManager.statistics();
    }
}
