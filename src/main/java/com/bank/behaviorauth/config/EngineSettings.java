package com.bank.behaviorauth.config;

import com.bank.behaviorauth.exception.ConfigurationException;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.model.PolicyThresholds;
import com.bank.behaviorauth.model.SignalSource;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable, validated snapshot of the engine configuration. A decision reads
 * one snapshot at entry and uses it throughout, so a concurrent config update
 * only affects requests that start after it.
 */
@Value
@Builder(toBuilder = true)
public class EngineSettings {

    static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    int vectorDimension;
    int maxVectorsPerUser;
    int minVectorsForSearch;
    int searchTopK;

    double similarityHigh;
    double similarityMedium;
    double similarityLow;

    int driftWindowSize;
    double driftThreshold;
    double baselineAdaptationThreshold;
    double baselineSmoothingFactor;
    int baselineMinVectors;

    int learningSessionThreshold;
    int gradualSessionThreshold;

    Map<PolicyLevel, PolicyThresholds> policyLevels;
    Map<LearningPhase, PolicyLevel> phasePolicyLevels;
    Map<SignalSource, Double> fusionWeights;

    int maxConcurrentSessions;
    int maxFailuresPerHour;
    long scorerTimeoutMs;
    double highValueThreshold;

    public static EngineSettings from(AuthEngineProperties props) {
        return EngineSettings.builder()
                .vectorDimension(props.getVectorDimension())
                .maxVectorsPerUser(props.getVectors().getMaxPerUser())
                .minVectorsForSearch(props.getVectors().getMinForSearch())
                .searchTopK(props.getVectors().getTopK())
                .similarityHigh(props.getSimilarity().getHigh())
                .similarityMedium(props.getSimilarity().getMedium())
                .similarityLow(props.getSimilarity().getLow())
                .driftWindowSize(props.getDrift().getWindowSize())
                .driftThreshold(props.getDrift().getThreshold())
                .baselineAdaptationThreshold(props.getDrift().getBaselineAdaptationThreshold())
                .baselineSmoothingFactor(props.getDrift().getSmoothingFactor())
                .baselineMinVectors(props.getDrift().getBaselineMinVectors())
                .learningSessionThreshold(props.getPhases().getLearningSessions())
                .gradualSessionThreshold(props.getPhases().getGradualSessions())
                .policyLevels(props.getPolicyLevels())
                .phasePolicyLevels(props.getPhasePolicyLevels())
                .fusionWeights(props.getFusionWeights())
                .maxConcurrentSessions(props.getLimits().getMaxConcurrentSessions())
                .maxFailuresPerHour(props.getLimits().getMaxFailuresPerHour())
                .scorerTimeoutMs(props.getLimits().getScorerTimeoutMs())
                .highValueThreshold(props.getLimits().getHighValueThreshold())
                .build()
                .validate();
    }

    public PolicyThresholds thresholdsFor(PolicyLevel level) {
        return policyLevels.get(level);
    }

    public double weightOf(SignalSource source) {
        return fusionWeights.getOrDefault(source, 0.0);
    }

    /**
     * Check every invariant and return an immutable snapshot.
     *
     * @throws ConfigurationException on the first violated invariant
     */
    public EngineSettings validate() {
        if (vectorDimension <= 0) fail("vectorDimension", "vectorDimension must be > 0");
        if (maxVectorsPerUser <= 0) fail("vectors.maxPerUser", "vectors.maxPerUser must be > 0");
        if (minVectorsForSearch < 1) fail("vectors.minForSearch", "vectors.minForSearch must be >= 1");
        if (minVectorsForSearch > maxVectorsPerUser) {
            fail("vectors.minForSearch", "vectors.minForSearch must not exceed vectors.maxPerUser");
        }
        if (searchTopK < 1) fail("vectors.topK", "vectors.topK must be >= 1");

        if (!(similarityLow < similarityMedium && similarityMedium < similarityHigh)) {
            fail("similarity", "similarity tiers must satisfy low < medium < high");
        }
        if (similarityLow < 0 || similarityHigh > 1) fail("similarity", "similarity tiers must lie in [0,1]");

        if (driftWindowSize < 2) fail("drift.windowSize", "drift.windowSize must be >= 2");
        if (driftThreshold <= 0 || driftThreshold >= 1) fail("drift.threshold", "drift.threshold must be in (0,1)");
        if (baselineAdaptationThreshold <= 0 || baselineAdaptationThreshold > 1) {
            fail("drift.baselineAdaptationThreshold", "drift.baselineAdaptationThreshold must be in (0,1]");
        }
        if (baselineSmoothingFactor <= 0 || baselineSmoothingFactor > 1) {
            fail("drift.smoothingFactor", "drift.smoothingFactor must be in (0,1]");
        }
        if (baselineMinVectors < 1 || baselineMinVectors > driftWindowSize) {
            fail("drift.baselineMinVectors", "drift.baselineMinVectors must be in [1, windowSize]");
        }

        if (learningSessionThreshold < 1) fail("phases.learningSessions", "phases.learningSessions must be >= 1");
        if (gradualSessionThreshold <= learningSessionThreshold) {
            fail("phases.gradualSessions", "phases.gradualSessions must be greater than phases.learningSessions");
        }

        if (policyLevels == null) fail("policyLevels", "policyLevels must be configured");
        Map<PolicyLevel, PolicyThresholds> levels = new EnumMap<>(PolicyLevel.class);
        for (PolicyLevel level : PolicyLevel.values()) {
            PolicyThresholds t = policyLevels.get(level);
            String field = "policyLevels." + level.getCode();
            if (t == null) fail(field, field + " is missing");
            if (t.getBlockThreshold() < 0 || t.getAllowThreshold() > 1) {
                fail(field, field + " thresholds must lie in [0,1]");
            }
            if (!(t.getBlockThreshold() < t.getChallengeThreshold()
                    && t.getChallengeThreshold() < t.getAllowThreshold())) {
                fail(field, field + " must satisfy block < challenge < allow");
            }
            levels.put(level, t.copy());
        }

        if (phasePolicyLevels == null) fail("phasePolicyLevels", "phasePolicyLevels must be configured");
        Map<LearningPhase, PolicyLevel> phaseTable = new EnumMap<>(LearningPhase.class);
        for (LearningPhase phase : LearningPhase.values()) {
            PolicyLevel level = phasePolicyLevels.get(phase);
            if (phase.isRiskEnforced() && level == null) {
                fail("phasePolicyLevels", "phase " + phase.getCode() + " needs a policy level");
            }
            if (level != null) phaseTable.put(phase, level);
        }

        if (fusionWeights == null) fail("fusionWeights", "fusionWeights must be configured");
        Map<SignalSource, Double> weights = new EnumMap<>(SignalSource.class);
        double sum = 0.0;
        for (SignalSource source : SignalSource.values()) {
            double w = fusionWeights.getOrDefault(source, 0.0);
            if (w < 0) fail("fusionWeights." + source.getCode(), "fusion weights must be >= 0");
            weights.put(source, w);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            fail("fusionWeights", String.format("fusion weights must sum to 1.0 (got %.6f)", sum));
        }

        if (maxConcurrentSessions <= 0) fail("limits.maxConcurrentSessions", "limits.maxConcurrentSessions must be > 0");
        if (maxFailuresPerHour <= 0) fail("limits.maxFailuresPerHour", "limits.maxFailuresPerHour must be > 0");
        if (scorerTimeoutMs <= 0) fail("limits.scorerTimeoutMs", "limits.scorerTimeoutMs must be > 0");
        if (highValueThreshold <= 0) fail("limits.highValueThreshold", "limits.highValueThreshold must be > 0");

        return toBuilder()
                .policyLevels(Collections.unmodifiableMap(levels))
                .phasePolicyLevels(Collections.unmodifiableMap(phaseTable))
                .fusionWeights(Collections.unmodifiableMap(weights))
                .build();
    }

    private static void fail(String field, String message) {
        throw new ConfigurationException(field, message);
    }
}
