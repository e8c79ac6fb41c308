package com.bank.behaviorauth.engine.policy;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.model.AuthDecision;
import com.bank.behaviorauth.model.FusedRisk;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.model.PolicyRule;
import com.bank.behaviorauth.model.PolicyThresholds;
import com.bank.behaviorauth.model.SignalContribution;
import com.bank.behaviorauth.model.SignalSource;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns fused risk into allow / challenge / block. Rules are applied in
 * priority order and the first one that applies wins:
 *
 * <ol>
 *   <li>lockout after too many recent failures</li>
 *   <li>cold_start / learning: allow, or challenge on a failed device integrity check</li>
 *   <li>no trusted signal: challenge</li>
 *   <li>level thresholds on the trust scale (risk cutoff = 1 - threshold)</li>
 *   <li>an allow is escalated to challenge for high-value transactions,
 *       failed device integrity or sustained drift</li>
 * </ol>
 */
@Component
public class PolicyOrchestrator {

    @Observed(name = "policy.decide", contextualName = "policy-decide")
    public PolicyOutcome decide(PolicyInput input, EngineSettings settings) {
        FusedRisk fused = input.getFusedRisk();
        double risk = fused.getScore();

        if (input.getRecentFailures() >= settings.getMaxFailuresPerHour()) {
            return outcome(AuthDecision.BLOCK, PolicyRule.LOCKOUT, input.getPolicyLevel(),
                    String.format("rule=LOCKOUT failures=%d in last hour (max %d)",
                            input.getRecentFailures(), settings.getMaxFailuresPerHour()), fused);
        }

        if (!input.getPhase().isRiskEnforced()) {
            if (!input.isDeviceIntegrityOk()) {
                return outcome(AuthDecision.CHALLENGE, PolicyRule.DEVICE_INTEGRITY, null,
                        String.format("rule=DEVICE_INTEGRITY phase=%s device integrity check failed",
                                input.getPhase().getCode()), fused);
            }
            return outcome(AuthDecision.ALLOW, PolicyRule.LEARNING_PHASE, null,
                    String.format("rule=LEARNING_PHASE phase=%s risk=%.3f not enforced",
                            input.getPhase().getCode(), risk), fused);
        }

        PolicyLevel level = input.getPolicyLevel();
        if (fused.getTrustedSignals() == 0) {
            return outcome(AuthDecision.CHALLENGE, PolicyRule.ALL_SIGNALS_DEGRADED, level,
                    String.format("rule=ALL_SIGNALS_DEGRADED level=%s no trusted signal, neutral risk=%.3f",
                            code(level), risk), fused);
        }

        PolicyThresholds t = settings.thresholdsFor(level);
        String band = String.format("level=%s risk=%.3f (allow<=%.3f, challenge>=%.3f, block>=%.3f)",
                code(level), risk, t.allowRiskCutoff(), t.challengeRiskCutoff(), t.blockRiskCutoff());

        if (risk >= t.blockRiskCutoff()) {
            return outcome(AuthDecision.BLOCK, PolicyRule.RISK_BLOCK, level, "rule=RISK_BLOCK " + band, fused);
        }
        if (risk >= t.challengeRiskCutoff()) {
            return outcome(AuthDecision.CHALLENGE, PolicyRule.RISK_CHALLENGE, level, "rule=RISK_CHALLENGE " + band, fused);
        }
        if (risk > t.allowRiskCutoff()) {
            return outcome(AuthDecision.CHALLENGE, PolicyRule.UNCERTAIN_BAND, level, "rule=UNCERTAIN_BAND " + band, fused);
        }

        Double amount = input.getTransactionAmount();
        if (amount != null && amount >= settings.getHighValueThreshold()) {
            return outcome(AuthDecision.CHALLENGE, PolicyRule.HIGH_VALUE_ESCALATION, level,
                    String.format("rule=HIGH_VALUE_ESCALATION amount=%.2f >= %.2f; %s",
                            amount, settings.getHighValueThreshold(), band), fused);
        }
        if (!input.isDeviceIntegrityOk()) {
            return outcome(AuthDecision.CHALLENGE, PolicyRule.DEVICE_INTEGRITY, level,
                    "rule=DEVICE_INTEGRITY device integrity check failed; " + band, fused);
        }
        if (input.getDrift() != null && !input.getDrift().isDegraded()
                && input.getDrift().getValue() >= settings.getBaselineAdaptationThreshold()) {
            return outcome(AuthDecision.CHALLENGE, PolicyRule.DRIFT_ESCALATION, level,
                    String.format("rule=DRIFT_ESCALATION drift=%.3f >= %.3f; %s", input.getDrift().getValue(),
                            settings.getBaselineAdaptationThreshold(), band), fused);
        }

        return outcome(AuthDecision.ALLOW, PolicyRule.RISK_ALLOW, level, "rule=RISK_ALLOW " + band, fused);
    }

    private static PolicyOutcome outcome(AuthDecision decision, PolicyRule rule, PolicyLevel level,
                                         String reason, FusedRisk fused) {
        return PolicyOutcome.builder()
                .decision(decision)
                .rule(rule)
                .policyLevel(level)
                .explanation(reason + "; signals: " + describe(fused))
                .build();
    }

    private static String describe(FusedRisk fused) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<SignalSource, SignalContribution> e : fused.getBreakdown().entrySet()) {
            SignalContribution c = e.getValue();
            if (sb.length() > 0) sb.append(", ");
            sb.append(e.getKey().getCode());
            if (c.isDegraded()) {
                sb.append("=degraded");
            } else {
                sb.append(String.format("=%.3f", c.getValue()));
            }
            sb.append(String.format(" (w=%.2f, +%.3f)", c.getWeight(), c.getContribution()));
        }
        return sb.toString();
    }

    private static String code(PolicyLevel level) {
        return level == null ? "none" : level.getCode();
    }
}
