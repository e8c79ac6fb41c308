package com.bank.behaviorauth.engine.phase;

import com.aerospike.client.AerospikeException;
import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.LearningPhaseState;
import com.bank.behaviorauth.model.LearningStatistics;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.repository.LearningPhaseRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-user progressive-trust state machine:
 * cold_start -> learning -> gradual_risk -> full_auth.
 *
 * The in-memory map is authoritative; every change is written through to
 * Aerospike so phases survive a restart. Phases only move forward, except
 * through an explicit {@link #reset}.
 */
@Component
public class PhaseManager {

    private static final Logger log = LoggerFactory.getLogger(PhaseManager.class);

    private final ConcurrentMap<String, LearningPhaseState> states = new ConcurrentHashMap<>();
    private final LearningPhaseRepository repository;
    private final MetricsConfig metricsConfig;

    public PhaseManager(LearningPhaseRepository repository, MetricsConfig metricsConfig) {
        this.repository = repository;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void restoreAll() {
        try {
            List<LearningPhaseState> persisted = repository.findAll();
            persisted.forEach(s -> states.putIfAbsent(s.getUserId(), s));
            log.info("Restored learning phase state for {} user(s)", persisted.size());
        } catch (AerospikeException e) {
            log.warn("Could not restore learning phase state, starting empty: {}", e.getMessage());
        }
    }

    /**
     * Existing state of a user, from memory or restored from storage.
     */
    public Optional<LearningPhaseState> lookup(String userId) {
        LearningPhaseState live = states.get(userId);
        if (live != null) return Optional.of(live);

        Optional<LearningPhaseState> restored;
        try {
            restored = repository.findByUserId(userId);
        } catch (AerospikeException e) {
            log.warn("Phase state lookup failed for user {}, treating as new: {}", userId, e.getMessage());
            return Optional.empty();
        }
        return restored.map(s -> states.merge(userId, s, (current, loaded) -> current));
    }

    /**
     * The user's state, or the new-user state if none exists.
     */
    public LearningPhaseState stateFor(String userId) {
        return lookup(userId).orElseGet(() -> LearningPhaseState.newUser(userId, System.currentTimeMillis()));
    }

    /**
     * Count an analyzed session and advance the phase if the count crosses a threshold.
     * A session already counted is ignored.
     */
    public LearningPhaseState recordAnalysis(String userId, String sessionId, EngineSettings settings) {
        lookup(userId);
        long now = System.currentTimeMillis();
        LearningPhaseState[] before = new LearningPhaseState[1];

        LearningPhaseState after = states.compute(userId, (id, existing) -> {
            LearningPhaseState current = existing != null ? existing : LearningPhaseState.newUser(id, now);
            before[0] = current;
            if (sessionId != null && sessionId.equals(current.getLastSessionId())) {
                return current;
            }
            long count = current.getSessionCount() + 1;
            LearningPhase next = LearningPhase.max(current.getPhase(), phaseFor(count, settings));
            return current.toBuilder()
                    .sessionCount(count)
                    .lastSessionId(sessionId)
                    .phase(next)
                    .lastTransitionAt(next != current.getPhase() ? now : current.getLastTransitionAt())
                    .build();
        });

        if (after == before[0]) {
            log.debug("Session {} already counted for user {}", sessionId, userId);
            return after;
        }

        if (after.getPhase() != before[0].getPhase()) {
            log.info("User {} moved from {} to {} after {} session(s)", userId,
                    before[0].getPhase().getCode(), after.getPhase().getCode(), after.getSessionCount());
            metricsConfig.recordPhaseTransition(before[0].getPhase().getCode(), after.getPhase().getCode());
        }
        persist(after);
        return after;
    }

    public static LearningPhase phaseFor(long sessionCount, EngineSettings settings) {
        if (sessionCount <= 0) return LearningPhase.COLD_START;
        if (sessionCount < settings.getLearningSessionThreshold()) return LearningPhase.LEARNING;
        if (sessionCount < settings.getGradualSessionThreshold()) return LearningPhase.GRADUAL_RISK;
        return LearningPhase.FULL_AUTH;
    }

    /**
     * Sessions still needed before the next phase; 0 once in full_auth.
     */
    public static long sessionsToNextPhase(LearningPhaseState state, EngineSettings settings) {
        long count = state.getSessionCount();
        switch (state.getPhase()) {
            case COLD_START:
                return 1;
            case LEARNING:
                return Math.max(0, settings.getLearningSessionThreshold() - count);
            case GRADUAL_RISK:
                return Math.max(0, settings.getGradualSessionThreshold() - count);
            default:
                return 0;
        }
    }

    /**
     * Policy level enforced in a phase; empty while risk is not enforced.
     */
    public Optional<PolicyLevel> policyLevelFor(LearningPhase phase, EngineSettings settings) {
        if (!phase.isRiskEnforced()) return Optional.empty();
        return Optional.ofNullable(settings.getPhasePolicyLevels().get(phase));
    }

    public void reset(String userId) {
        LearningPhaseState removed = states.remove(userId);
        try {
            repository.delete(userId);
        } catch (AerospikeException e) {
            log.error("Failed to delete persisted phase state for user {}", userId, e);
        }
        log.info("Learning phase reset for user {} (was {})", userId,
                removed == null ? "unknown" : removed.getPhase().getCode());
    }

    public LearningStatistics statistics() {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (LearningPhase phase : LearningPhase.values()) {
            distribution.put(phase.getCode(), 0L);
        }
        long total = 0;
        for (LearningPhaseState state : states.values()) {
            distribution.merge(state.getPhase().getCode(), 1L, Long::sum);
            total++;
        }
        long inLearning = distribution.get(LearningPhase.COLD_START.getCode())
                + distribution.get(LearningPhase.LEARNING.getCode());

        return LearningStatistics.builder()
                .totalUsers(total)
                .usersInLearning(inLearning)
                .phaseDistribution(distribution)
                .build();
    }

    private void persist(LearningPhaseState state) {
        try {
            repository.save(state);
        } catch (AerospikeException e) {
            log.error("Failed to persist phase state for user {}", state.getUserId(), e);
        }
    }
}
