package com.bank.behaviorauth.controller;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.config.EngineSettingsHolder;
import com.bank.behaviorauth.exception.ConfigurationException;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.model.PolicyThresholds;
import com.bank.behaviorauth.model.SignalSource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;
import java.util.function.Function;
import java.util.function.UnaryOperator;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and hot-reload engine configuration (thresholds, policy levels, fusion weights, limits)")
public class ConfigController {

    private final EngineSettingsHolder settingsHolder;

    public ConfigController(EngineSettingsHolder settingsHolder) {
        this.settingsHolder = settingsHolder;
    }

    @Operation(summary = "Get the active engine configuration")
    @GetMapping
    public ResponseEntity<Map<String, Object>> getConfig() {
        EngineSettings s = settingsHolder.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vectorDimension", s.getVectorDimension());
        body.put("thresholds", thresholdsView(s));
        body.put("policyLevels", policyLevelsView(s));
        body.put("phasePolicyLevels", phaseLevelsView(s));
        body.put("fusionWeights", weightsView(s));
        body.put("limits", limitsView(s));
        return ResponseEntity.ok(body);
    }

    // ── Signal thresholds ──

    @Operation(summary = "Get similarity tiers, drift thresholds and the high-value threshold")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        return ResponseEntity.ok(thresholdsView(settingsHolder.current()));
    }

    @Operation(summary = "Update similarity tiers, drift thresholds and the high-value threshold",
            description = "Validated before it takes effect; applies to requests that start afterwards. Resets on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        EngineSettings s = settingsHolder.current();
        double high = toDouble(body, "similarityHigh", s.getSimilarityHigh());
        double medium = toDouble(body, "similarityMedium", s.getSimilarityMedium());
        double low = toDouble(body, "similarityLow", s.getSimilarityLow());
        double drift = toDouble(body, "driftThreshold", s.getDriftThreshold());
        double adaptation = toDouble(body, "baselineAdaptationThreshold", s.getBaselineAdaptationThreshold());
        double smoothing = toDouble(body, "baselineSmoothingFactor", s.getBaselineSmoothingFactor());
        double highValue = toDouble(body, "highValueThreshold", s.getHighValueThreshold());

        return apply(b -> b.similarityHigh(high).similarityMedium(medium).similarityLow(low)
                        .driftThreshold(drift).baselineAdaptationThreshold(adaptation)
                        .baselineSmoothingFactor(smoothing).highValueThreshold(highValue),
                this::thresholdsView);
    }

    // ── Policy levels ──

    @Operation(summary = "Get per-level decision thresholds",
            description = "Thresholds are on the trust scale (1 - fused risk): block < challenge < allow.")
    @GetMapping("/policy-levels")
    public ResponseEntity<Map<String, Object>> getPolicyLevels() {
        return ResponseEntity.ok(policyLevelsView(settingsHolder.current()));
    }

    @Operation(summary = "Update the thresholds of one policy level")
    @PutMapping("/policy-levels/{level}")
    public ResponseEntity<?> updatePolicyLevel(
            @Parameter(description = "Policy level", example = "level_2")
            @PathVariable String level,
            @RequestBody Map<String, Object> body) {
        PolicyLevel target;
        try {
            target = PolicyLevel.fromCode(level);
        } catch (IllegalArgumentException e) {
            return badRequest("Unknown policy level: " + level, "level");
        }

        EngineSettings s = settingsHolder.current();
        PolicyThresholds current = s.thresholdsFor(target);
        PolicyThresholds updated = new PolicyThresholds(
                toDouble(body, "allowThreshold", current.getAllowThreshold()),
                toDouble(body, "challengeThreshold", current.getChallengeThreshold()),
                toDouble(body, "blockThreshold", current.getBlockThreshold()));

        Map<PolicyLevel, PolicyThresholds> levels = new EnumMap<>(s.getPolicyLevels());
        levels.put(target, updated);
        return apply(b -> b.policyLevels(levels), this::policyLevelsView);
    }

    @Operation(summary = "Get the policy level enforced in each phase")
    @GetMapping("/phase-policy-levels")
    public ResponseEntity<Map<String, Object>> getPhasePolicyLevels() {
        return ResponseEntity.ok(phaseLevelsView(settingsHolder.current()));
    }

    @Operation(summary = "Update the policy level enforced in each phase",
            description = "Body maps phase codes to level codes, e.g. {\"full_auth\": \"level_3\"}.")
    @PutMapping("/phase-policy-levels")
    public ResponseEntity<?> updatePhasePolicyLevels(@RequestBody Map<String, Object> body) {
        Map<LearningPhase, PolicyLevel> table = new EnumMap<>(settingsHolder.current().getPhasePolicyLevels());
        for (Map.Entry<String, Object> e : body.entrySet()) {
            try {
                LearningPhase phase = LearningPhase.fromCode(e.getKey());
                if (!phase.isRiskEnforced()) {
                    return badRequest("Phase " + phase.getCode() + " does not enforce risk", e.getKey());
                }
                table.put(phase, PolicyLevel.fromCode(String.valueOf(e.getValue())));
            } catch (IllegalArgumentException ex) {
                return badRequest(ex.getMessage(), e.getKey());
            }
        }
        return apply(b -> b.phasePolicyLevels(table), this::phaseLevelsView);
    }

    // ── Fusion weights ──

    @Operation(summary = "Get fusion weights")
    @GetMapping("/fusion-weights")
    public ResponseEntity<Map<String, Object>> getFusionWeights() {
        return ResponseEntity.ok(weightsView(settingsHolder.current()));
    }

    @Operation(summary = "Update fusion weights",
            description = "Weights of similarity, drift, context and graph must be >= 0 and sum to 1.0.")
    @PutMapping("/fusion-weights")
    public ResponseEntity<?> updateFusionWeights(@RequestBody Map<String, Object> body) {
        EngineSettings s = settingsHolder.current();
        Map<SignalSource, Double> weights = new EnumMap<>(SignalSource.class);
        for (SignalSource source : SignalSource.values()) {
            weights.put(source, toDouble(body, source.getCode(), s.weightOf(source)));
        }
        return apply(b -> b.fusionWeights(weights), this::weightsView);
    }

    // ── Limits ──

    @Operation(summary = "Get operational limits")
    @GetMapping("/limits")
    public ResponseEntity<Map<String, Object>> getLimits() {
        return ResponseEntity.ok(limitsView(settingsHolder.current()));
    }

    @Operation(summary = "Update operational limits")
    @PutMapping("/limits")
    public ResponseEntity<?> updateLimits(@RequestBody Map<String, Object> body) {
        EngineSettings s = settingsHolder.current();
        int maxSessions = toInt(body, "maxConcurrentSessions", s.getMaxConcurrentSessions());
        int maxFailures = toInt(body, "maxFailuresPerHour", s.getMaxFailuresPerHour());
        long timeout = toLong(body, "scorerTimeoutMs", s.getScorerTimeoutMs());
        int maxVectors = toInt(body, "maxVectorsPerUser", s.getMaxVectorsPerUser());
        int minVectors = toInt(body, "minVectorsForSearch", s.getMinVectorsForSearch());

        return apply(b -> b.maxConcurrentSessions(maxSessions).maxFailuresPerHour(maxFailures)
                        .scorerTimeoutMs(timeout).maxVectorsPerUser(maxVectors).minVectorsForSearch(minVectors),
                this::limitsView);
    }

    // ── Helpers ──

    private ResponseEntity<?> apply(UnaryOperator<EngineSettings.EngineSettingsBuilder> change,
                                    Function<EngineSettings, Map<String, Object>> view) {
        try {
            return ResponseEntity.ok(view.apply(settingsHolder.update(change)));
        } catch (ConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    private Map<String, Object> thresholdsView(EngineSettings s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("similarityHigh", s.getSimilarityHigh());
        m.put("similarityMedium", s.getSimilarityMedium());
        m.put("similarityLow", s.getSimilarityLow());
        m.put("driftThreshold", s.getDriftThreshold());
        m.put("baselineAdaptationThreshold", s.getBaselineAdaptationThreshold());
        m.put("baselineSmoothingFactor", s.getBaselineSmoothingFactor());
        m.put("highValueThreshold", s.getHighValueThreshold());
        return m;
    }

    private Map<String, Object> policyLevelsView(EngineSettings s) {
        Map<String, Object> m = new LinkedHashMap<>();
        s.getPolicyLevels().forEach((level, t) -> m.put(level.getCode(), t));
        return m;
    }

    private Map<String, Object> phaseLevelsView(EngineSettings s) {
        Map<String, Object> m = new LinkedHashMap<>();
        s.getPhasePolicyLevels().forEach((phase, level) -> m.put(phase.getCode(), level.getCode()));
        return m;
    }

    private Map<String, Object> weightsView(EngineSettings s) {
        Map<String, Object> m = new LinkedHashMap<>();
        s.getFusionWeights().forEach((source, w) -> m.put(source.getCode(), w));
        return m;
    }

    private Map<String, Object> limitsView(EngineSettings s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("maxConcurrentSessions", s.getMaxConcurrentSessions());
        m.put("maxFailuresPerHour", s.getMaxFailuresPerHour());
        m.put("scorerTimeoutMs", s.getScorerTimeoutMs());
        m.put("maxVectorsPerUser", s.getMaxVectorsPerUser());
        m.put("minVectorsForSearch", s.getMinVectorsForSearch());
        return m;
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
