package com.bank.behaviorauth.engine.policy;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.model.*;
import com.bank.behaviorauth.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyOrchestratorTest {

    private PolicyOrchestrator orchestrator;
    private EngineSettings settings;

    @BeforeEach
    void setUp() {
        orchestrator = new PolicyOrchestrator();
        settings = TestDataFactory.defaultSettings();
    }

    private PolicyInput.PolicyInputBuilder fullAuth(double risk) {
        return PolicyInput.builder()
                .userId("USER-001")
                .phase(LearningPhase.FULL_AUTH)
                .policyLevel(PolicyLevel.LEVEL_2)
                .fusedRisk(TestDataFactory.createFusedRisk(risk))
                .drift(SignalScore.of(SignalSource.DRIFT, 0.05, 1.0, "drift=0.050"))
                .recentFailures(0)
                .deviceIntegrityOk(true);
    }

    // --- level thresholds (level_2: allow<=0.25, challenge>=0.45, block>=0.65) ---

    @Test
    void decide_lowRiskAtLevel2_allows() {
        PolicyOutcome outcome = orchestrator.decide(fullAuth(0.20).build(), settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.ALLOW);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.RISK_ALLOW);
        assertThat(outcome.getPolicyLevel()).isEqualTo(PolicyLevel.LEVEL_2);
    }

    @Test
    void decide_riskAboveChallengeCutoff_challenges() {
        PolicyOutcome outcome = orchestrator.decide(fullAuth(0.60).build(), settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.RISK_CHALLENGE);
    }

    @Test
    void decide_riskAboveBlockCutoff_blocks() {
        PolicyOutcome outcome = orchestrator.decide(fullAuth(0.90).build(), settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.BLOCK);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.RISK_BLOCK);
    }

    @Test
    void decide_riskBetweenAllowAndChallenge_challengesAsUncertain() {
        PolicyOutcome outcome = orchestrator.decide(fullAuth(0.35).build(), settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.UNCERTAIN_BAND);
    }

    @Test
    void decide_gradualRiskUsesLenientLevel() {
        PolicyInput input = fullAuth(0.30)
                .phase(LearningPhase.GRADUAL_RISK)
                .policyLevel(PolicyLevel.LEVEL_1)
                .build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        // 0.30 is uncertain at level_2 but allowed at level_1 (allow<=0.40)
        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.ALLOW);
        assertThat(outcome.getPolicyLevel()).isEqualTo(PolicyLevel.LEVEL_1);
    }

    @Test
    void decide_strictestLevelChallengesWhatLevel2Allows() {
        PolicyInput input = fullAuth(0.20).policyLevel(PolicyLevel.LEVEL_4).build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.UNCERTAIN_BAND);
    }

    // --- priority overrides ---

    @Test
    void decide_tooManyRecentFailures_blocksEvenWithZeroRisk() {
        PolicyInput input = fullAuth(0.0).recentFailures(5).build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.BLOCK);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.LOCKOUT);
        assertThat(outcome.getExplanation()).contains("failures=5");
    }

    @Test
    void decide_lockoutAppliesDuringLearning() {
        PolicyInput input = fullAuth(0.0)
                .phase(LearningPhase.LEARNING)
                .policyLevel(null)
                .recentFailures(6)
                .build();

        assertThat(orchestrator.decide(input, settings).getRule()).isEqualTo(PolicyRule.LOCKOUT);
    }

    @Test
    void decide_learningPhaseWithHighRisk_allows() {
        PolicyInput input = fullAuth(0.95).phase(LearningPhase.LEARNING).policyLevel(null).build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.ALLOW);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.LEARNING_PHASE);
        assertThat(outcome.getPolicyLevel()).isNull();
    }

    @Test
    void decide_coldStartWithFailedIntegrity_challenges() {
        PolicyInput input = fullAuth(0.1)
                .phase(LearningPhase.COLD_START)
                .policyLevel(null)
                .deviceIntegrityOk(false)
                .build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.DEVICE_INTEGRITY);
    }

    @Test
    void decide_noTrustedSignal_challenges() {
        Map<SignalSource, SignalContribution> breakdown = new EnumMap<>(SignalSource.class);
        for (SignalSource source : SignalSource.values()) {
            breakdown.put(source, SignalContribution.builder()
                    .value(0.5).confidence(0.0).weight(0.0).contribution(0.0)
                    .degraded(true).detail("unavailable").build());
        }
        PolicyInput input = fullAuth(0.5).fusedRisk(FusedRisk.neutral(breakdown)).build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.ALL_SIGNALS_DEGRADED);
        assertThat(outcome.getExplanation()).contains("similarity=degraded");
    }

    // --- allow escalations ---

    @Test
    void decide_highValueTransaction_escalatesAllowToChallenge() {
        PolicyInput input = fullAuth(0.10).transactionAmount(250_000.0).build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.HIGH_VALUE_ESCALATION);
    }

    @Test
    void decide_smallTransaction_isNotEscalated() {
        PolicyInput input = fullAuth(0.10).transactionAmount(500.0).build();

        assertThat(orchestrator.decide(input, settings).getDecision()).isEqualTo(AuthDecision.ALLOW);
    }

    @Test
    void decide_failedIntegrityInFullAuth_escalatesAllow() {
        PolicyInput input = fullAuth(0.10).deviceIntegrityOk(false).build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.DEVICE_INTEGRITY);
    }

    @Test
    void decide_sustainedDrift_escalatesAllow() {
        PolicyInput input = fullAuth(0.10)
                .drift(SignalScore.of(SignalSource.DRIFT, 0.42, 1.0, "drift=0.420"))
                .build();

        PolicyOutcome outcome = orchestrator.decide(input, settings);

        assertThat(outcome.getDecision()).isEqualTo(AuthDecision.CHALLENGE);
        assertThat(outcome.getRule()).isEqualTo(PolicyRule.DRIFT_ESCALATION);
    }

    @Test
    void decide_degradedDrift_doesNotEscalate() {
        PolicyInput input = fullAuth(0.10)
                .drift(SignalScore.degraded(SignalSource.DRIFT, "no drift baseline yet"))
                .build();

        assertThat(orchestrator.decide(input, settings).getRule()).isEqualTo(PolicyRule.RISK_ALLOW);
    }

    @Test
    void decide_escalationNeverDowngradesBlock() {
        PolicyInput input = fullAuth(0.90).transactionAmount(250_000.0).build();

        assertThat(orchestrator.decide(input, settings).getDecision()).isEqualTo(AuthDecision.BLOCK);
    }

    @Test
    void decide_explanationReferencesRuleAndBreakdown() {
        PolicyOutcome outcome = orchestrator.decide(fullAuth(0.60).build(), settings);

        assertThat(outcome.getExplanation())
                .startsWith("rule=RISK_CHALLENGE level=level_2")
                .contains("signals: similarity=")
                .contains("graph=");
    }
}
