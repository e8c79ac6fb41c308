package com.bank.behaviorauth.service;

import com.aerospike.client.AerospikeException;
import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.config.EngineSettingsHolder;
import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.engine.drift.DriftDetector;
import com.bank.behaviorauth.engine.fusion.EnsembleFusion;
import com.bank.behaviorauth.engine.phase.PhaseManager;
import com.bank.behaviorauth.engine.policy.FailureTracker;
import com.bank.behaviorauth.engine.policy.PolicyInput;
import com.bank.behaviorauth.engine.policy.PolicyOrchestrator;
import com.bank.behaviorauth.engine.policy.PolicyOutcome;
import com.bank.behaviorauth.engine.scoring.ComponentHealthRegistry;
import com.bank.behaviorauth.engine.scoring.ExternalScorerGateway;
import com.bank.behaviorauth.engine.scoring.ScoringFeatures;
import com.bank.behaviorauth.engine.similarity.SimilarityMatcher;
import com.bank.behaviorauth.engine.vector.VectorStore;
import com.bank.behaviorauth.exception.DimensionMismatchException;
import com.bank.behaviorauth.exception.ValidationException;
import com.bank.behaviorauth.model.AuthDecision;
import com.bank.behaviorauth.model.BehavioralVector;
import com.bank.behaviorauth.model.ChallengeOutcome;
import com.bank.behaviorauth.model.DecisionRecord;
import com.bank.behaviorauth.model.DecisionRequest;
import com.bank.behaviorauth.model.FusedRisk;
import com.bank.behaviorauth.model.HealthComponent;
import com.bank.behaviorauth.model.LearningPhaseState;
import com.bank.behaviorauth.model.PolicyRule;
import com.bank.behaviorauth.model.SessionGraph;
import com.bank.behaviorauth.model.SignalContribution;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;
import com.bank.behaviorauth.repository.DecisionAuditRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Main orchestrator for authentication decisions.
 *
 * Flow:
 * 1. Validate the request and take an admission slot
 * 2. Serialize on the user's lock
 * 3. Score similarity, drift, context and graph concurrently against the
 *    user's state before this session
 * 4. Fuse the signals and decide through the phase gate and policy
 * 5. Feed accepted, non-empty sessions back into vectors, drift and phase
 * 6. Record failures, persist the audit record, emit metrics and notify on block
 */
@Service
public class AuthenticationDecisionService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationDecisionService.class);

    private final EngineSettingsHolder settingsHolder;
    private final SessionAdmissionControl admissionControl;
    private final UserLockRegistry lockRegistry;
    private final VectorStore vectorStore;
    private final SimilarityMatcher similarityMatcher;
    private final DriftDetector driftDetector;
    private final ExternalScorerGateway scorerGateway;
    private final EnsembleFusion fusion;
    private final PhaseManager phaseManager;
    private final PolicyOrchestrator policyOrchestrator;
    private final FailureTracker failureTracker;
    private final ComponentHealthRegistry health;
    private final DecisionAuditRepository auditRepository;
    private final LockoutNotificationService notificationService;
    private final MetricsConfig metricsConfig;

    public AuthenticationDecisionService(EngineSettingsHolder settingsHolder,
                                         SessionAdmissionControl admissionControl,
                                         UserLockRegistry lockRegistry,
                                         VectorStore vectorStore,
                                         SimilarityMatcher similarityMatcher,
                                         DriftDetector driftDetector,
                                         ExternalScorerGateway scorerGateway,
                                         EnsembleFusion fusion,
                                         PhaseManager phaseManager,
                                         PolicyOrchestrator policyOrchestrator,
                                         FailureTracker failureTracker,
                                         ComponentHealthRegistry health,
                                         DecisionAuditRepository auditRepository,
                                         LockoutNotificationService notificationService,
                                         MetricsConfig metricsConfig) {
        this.settingsHolder = settingsHolder;
        this.admissionControl = admissionControl;
        this.lockRegistry = lockRegistry;
        this.vectorStore = vectorStore;
        this.similarityMatcher = similarityMatcher;
        this.driftDetector = driftDetector;
        this.scorerGateway = scorerGateway;
        this.fusion = fusion;
        this.phaseManager = phaseManager;
        this.policyOrchestrator = policyOrchestrator;
        this.failureTracker = failureTracker;
        this.health = health;
        this.auditRepository = auditRepository;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Decide one session. Scoring failures never fail the request; they
     * degrade the affected signal instead.
     *
     * @throws ValidationException if the request is malformed (no state is touched)
     * @throws com.bank.behaviorauth.exception.CapacityExceededException if the admission limit is reached
     */
    @Observed(name = "auth.decide", contextualName = "authentication-decision")
    public DecisionRecord decide(DecisionRequest request) {
        long startNanos = System.nanoTime();
        EngineSettings settings = settingsHolder.current();
        try {
            validate(request, settings);
        } catch (ValidationException e) {
            metricsConfig.recordValidationRejected(e.getField());
            throw e;
        }

        admissionControl.acquire(settings.getMaxConcurrentSessions());
        try {
            return lockRegistry.withLock(request.getUserId(), () -> decideLocked(request, settings, startNanos));
        } finally {
            admissionControl.release();
        }
    }

    /**
     * Count a failed step-up challenge toward the user's lockout.
     *
     * @return failures recorded in the last hour
     */
    public int recordChallengeOutcome(ChallengeOutcome outcome) {
        requireText(outcome.getUserId(), "userId");
        requireText(outcome.getSessionId(), "sessionId");

        long now = System.currentTimeMillis();
        if (!outcome.isPassed()) {
            failureTracker.recordFailure(outcome.getUserId(), now);
            metricsConfig.recordFailure("challenge");
            log.info("Challenge failed for user={}, session={}", outcome.getUserId(), outcome.getSessionId());
        }
        return failureTracker.countRecent(outcome.getUserId(), now);
    }

    private DecisionRecord decideLocked(DecisionRequest request, EngineSettings settings, long startNanos) {
        String userId = request.getUserId();
        long now = System.currentTimeMillis();
        LearningPhaseState phaseState = phaseManager.stateFor(userId);

        Map<SignalSource, SignalScore> signals = collectSignals(request, settings);
        FusedRisk fused = fusion.fuse(signals, settings);

        PolicyInput input = PolicyInput.builder()
                .userId(userId)
                .phase(phaseState.getPhase())
                .policyLevel(phaseManager.policyLevelFor(phaseState.getPhase(), settings).orElse(null))
                .fusedRisk(fused)
                .drift(signals.get(SignalSource.DRIFT))
                .recentFailures(failureTracker.countRecent(userId, now))
                .deviceIntegrityOk(request.isDeviceIntegrityOk())
                .transactionAmount(request.getTransactionAmount())
                .build();
        PolicyOutcome outcome = policyOrchestrator.decide(input, settings);

        // Scoring above used the state before this session; only now is it updated
        if (!request.isEmptySession() && outcome.getDecision() != AuthDecision.BLOCK) {
            applyFeedback(request, settings, now);
        }

        if (outcome.getDecision() == AuthDecision.BLOCK && outcome.getRule() != PolicyRule.LOCKOUT) {
            failureTracker.recordFailure(userId, now);
            metricsConfig.recordFailure("block");
        }

        long latencyMs = (System.nanoTime() - startNanos) / 1_000_000L;
        DecisionRecord record = DecisionRecord.builder()
                .decisionId(UUID.randomUUID().toString())
                .userId(userId)
                .sessionId(request.getSessionId())
                .decision(outcome.getDecision())
                .fusedRisk(fused.getScore())
                .phase(phaseState.getPhase())
                .policyLevel(outcome.getPolicyLevel())
                .ruleFired(outcome.getRule())
                .breakdown(toBreakdown(fused))
                .degradedSources(fused.degradedSources().stream().map(SignalSource::getCode).collect(Collectors.toList()))
                .explanation(outcome.getExplanation())
                .decidedAt(now)
                .latencyMs(latencyMs)
                .build();

        persist(record);
        metricsConfig.recordDecision(record.getDecision().getCode(), record.getPhase().getCode(),
                record.getRuleFired().name(), record.getFusedRisk(), latencyMs);
        notificationService.notifyIfBlocked(record);

        if (record.getDecision() == AuthDecision.BLOCK) {
            log.warn("Session blocked for user={}, session={}: risk={}, rule={}",
                    userId, record.getSessionId(), String.format("%.3f", record.getFusedRisk()), record.getRuleFired());
        } else {
            log.debug("Decision for user={}, session={}: {} (risk={}, rule={}, {}ms)", userId, record.getSessionId(),
                    record.getDecision(), String.format("%.3f", record.getFusedRisk()), record.getRuleFired(), latencyMs);
        }
        return record;
    }

    private Map<SignalSource, SignalScore> collectSignals(DecisionRequest request, EngineSettings settings) {
        String userId = request.getUserId();
        long timeoutMs = settings.getScorerTimeoutMs();
        Map<SignalSource, CompletableFuture<SignalScore>> futures = new EnumMap<>(SignalSource.class);

        if (request.isEmptySession()) {
            futures.put(SignalSource.SIMILARITY, CompletableFuture.completedFuture(
                    SignalScore.degraded(SignalSource.SIMILARITY, "no behavioral telemetry")));
            futures.put(SignalSource.DRIFT, CompletableFuture.completedFuture(
                    SignalScore.degraded(SignalSource.DRIFT, "no behavioral telemetry")));
        } else {
            float[] vector = request.getBehavioralVector();
            futures.put(SignalSource.SIMILARITY, scorerGateway.submit(SignalSource.SIMILARITY, userId,
                    () -> similarityMatcher.score(userId, vector, settings), timeoutMs));
            futures.put(SignalSource.DRIFT, scorerGateway.submit(SignalSource.DRIFT, userId,
                    () -> driftDetector.score(userId, vector, settings), timeoutMs));
        }
        futures.putAll(scorerGateway.scoreExternal(ScoringFeatures.from(request, settings), timeoutMs));

        Map<SignalSource, SignalScore> signals = new EnumMap<>(SignalSource.class);
        for (SignalSource source : SignalSource.values()) {
            CompletableFuture<SignalScore> future = futures.get(source);
            signals.put(source, future != null
                    ? future.join()
                    : SignalScore.degraded(source, "no scorer registered"));
        }
        return signals;
    }

    private void applyFeedback(DecisionRequest request, EngineSettings settings, long now) {
        String userId = request.getUserId();
        float[] vector = request.getBehavioralVector();
        try {
            vectorStore.insert(userId, new BehavioralVector(vector, now, request.getSessionId()), settings);
            health.markHealthy(HealthComponent.VECTOR_STORE);
        } catch (RuntimeException e) {
            // The decision is already made; a failed insert only costs history
            health.markUnavailable(HealthComponent.VECTOR_STORE, e.getMessage());
            log.error("Vector insert failed for user {}", userId, e);
        }
        driftDetector.observe(userId, vector, settings);
        phaseManager.recordAnalysis(userId, request.getSessionId(), settings);
    }

    private void persist(DecisionRecord record) {
        try {
            auditRepository.save(record);
        } catch (AerospikeException e) {
            log.error("Failed to persist decision {} for user {}", record.getDecisionId(), record.getUserId(), e);
        }
    }

    private static Map<String, SignalContribution> toBreakdown(FusedRisk fused) {
        Map<String, SignalContribution> out = new LinkedHashMap<>();
        fused.getBreakdown().forEach((source, c) -> out.put(source.getCode(), c));
        return out;
    }

    void validate(DecisionRequest request, EngineSettings settings) {
        if (request == null) {
            throw new ValidationException("request", "request body is required");
        }
        requireText(request.getUserId(), "userId");
        requireText(request.getSessionId(), "sessionId");

        float[] vector = request.getBehavioralVector();
        if (vector != null && vector.length > 0) {
            if (vector.length != settings.getVectorDimension()) {
                throw new DimensionMismatchException(settings.getVectorDimension(), vector.length);
            }
            for (float v : vector) {
                if (!Float.isFinite(v)) {
                    throw new ValidationException("behavioralVector", "behavioralVector contains non-finite values");
                }
            }
        }

        Double amount = request.getTransactionAmount();
        if (amount != null && (amount.isNaN() || amount.isInfinite() || amount < 0)) {
            throw new ValidationException("transactionAmount", "transactionAmount must be a non-negative number");
        }

        Map<String, Double> context = request.getContextFeatures();
        if (context != null) {
            for (Map.Entry<String, Double> e : context.entrySet()) {
                if (e.getValue() == null || e.getValue().isNaN() || e.getValue().isInfinite()) {
                    throw new ValidationException("contextFeatures",
                            "contextFeatures." + e.getKey() + " must be a finite number");
                }
            }
        }

        validateGraph(request.getSessionGraph());
    }

    private static void validateGraph(SessionGraph graph) {
        if (graph == null) return;
        List<SessionGraph.Node> nodes = graph.getNodes();
        Set<String> ids = new HashSet<>();
        if (nodes != null) {
            for (SessionGraph.Node node : nodes) {
                if (node == null || node.getId() == null || node.getId().isBlank()) {
                    throw new ValidationException("sessionGraph.nodes", "every graph node needs an id");
                }
                if (!ids.add(node.getId())) {
                    throw new ValidationException("sessionGraph.nodes", "duplicate graph node id: " + node.getId());
                }
            }
        }
        if (graph.getEdges() != null) {
            for (SessionGraph.Edge edge : graph.getEdges()) {
                if (edge == null || !ids.contains(edge.getSource()) || !ids.contains(edge.getTarget())) {
                    throw new ValidationException("sessionGraph.edges", "graph edges must connect known nodes");
                }
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
    }
}
