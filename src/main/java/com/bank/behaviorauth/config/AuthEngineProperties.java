package com.bank.behaviorauth.config;

import com.bank.behaviorauth.engine.scoring.ContextRiskLevel;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.model.PolicyThresholds;
import com.bank.behaviorauth.model.SignalSource;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Raw engine configuration bound from application.yml. Read once at startup into
 * an immutable {@link EngineSettings}; runtime changes go through the settings holder.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "auth")
public class AuthEngineProperties {

    // Length of every behavioral vector
    private int vectorDimension = 90;

    private Vectors vectors = new Vectors();

    private Similarity similarity = new Similarity();

    private Drift drift = new Drift();

    private Phases phases = new Phases();

    // Trust-scale thresholds per level (1 - fused risk). block < challenge < allow.
    private Map<PolicyLevel, PolicyThresholds> policyLevels = defaultPolicyLevels();

    // Level applied in each risk-enforcing phase
    private Map<LearningPhase, PolicyLevel> phasePolicyLevels = defaultPhasePolicyLevels();

    // Similarity layer 0.4 (similarity + drift), model layer 0.6 (context + graph)
    private Map<SignalSource, Double> fusionWeights = defaultFusionWeights();

    private Limits limits = new Limits();

    private Scorers scorers = new Scorers();

    @Data
    public static class Vectors {
        private int maxPerUser = 100;
        private int minForSearch = 5;
        private int topK = 5;
    }

    @Data
    public static class Similarity {
        private double high = 0.85;
        private double medium = 0.70;
        private double low = 0.50;
    }

    @Data
    public static class Drift {
        private int windowSize = 20;
        private double threshold = 0.15;
        // Baseline only adapts while drift stays below this for a full window
        private double baselineAdaptationThreshold = 0.3;
        private double smoothingFactor = 0.1;
        private int baselineMinVectors = 5;
    }

    @Data
    public static class Phases {
        private int learningSessions = 5;
        private int gradualSessions = 15;
    }

    @Data
    public static class Limits {
        private int maxConcurrentSessions = 1000;
        private int maxFailuresPerHour = 5;
        private long scorerTimeoutMs = 30;
        private double highValueThreshold = 100000.0;
    }

    @Data
    public static class Scorers {
        // Model calls block on HTTP; similarity and drift are in-process and get their own pool
        private int executorThreads = 16;
        private int queueCapacity = 64;
        private int localThreads = 8;
        private int localQueueCapacity = 1000;
        private ModelEndpoint context = new ModelEndpoint();
        private ModelEndpoint graph = new ModelEndpoint();
        // Multiplier applied to the context model's confidence per request risk context
        private Map<ContextRiskLevel, Double> contextConfidenceByRisk = defaultContextConfidence();
    }

    @Data
    public static class ModelEndpoint {
        private boolean enabled = false;
        private String url;
    }

    private static Map<PolicyLevel, PolicyThresholds> defaultPolicyLevels() {
        Map<PolicyLevel, PolicyThresholds> levels = new EnumMap<>(PolicyLevel.class);
        levels.put(PolicyLevel.LEVEL_1, new PolicyThresholds(0.60, 0.40, 0.20));
        levels.put(PolicyLevel.LEVEL_2, new PolicyThresholds(0.75, 0.55, 0.35));
        levels.put(PolicyLevel.LEVEL_3, new PolicyThresholds(0.85, 0.65, 0.45));
        levels.put(PolicyLevel.LEVEL_4, new PolicyThresholds(0.92, 0.75, 0.55));
        return levels;
    }

    private static Map<LearningPhase, PolicyLevel> defaultPhasePolicyLevels() {
        Map<LearningPhase, PolicyLevel> table = new EnumMap<>(LearningPhase.class);
        table.put(LearningPhase.GRADUAL_RISK, PolicyLevel.LEVEL_1);
        table.put(LearningPhase.FULL_AUTH, PolicyLevel.LEVEL_2);
        return table;
    }

    private static Map<SignalSource, Double> defaultFusionWeights() {
        Map<SignalSource, Double> weights = new EnumMap<>(SignalSource.class);
        weights.put(SignalSource.SIMILARITY, 0.2);
        weights.put(SignalSource.DRIFT, 0.2);
        weights.put(SignalSource.CONTEXT, 0.3);
        weights.put(SignalSource.GRAPH, 0.3);
        return weights;
    }

    private static Map<ContextRiskLevel, Double> defaultContextConfidence() {
        Map<ContextRiskLevel, Double> factors = new EnumMap<>(ContextRiskLevel.class);
        factors.put(ContextRiskLevel.LOW, 1.0);
        factors.put(ContextRiskLevel.ELEVATED, 0.85);
        factors.put(ContextRiskLevel.HIGH, 0.7);
        return factors;
    }
}
