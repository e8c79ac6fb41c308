package com.bank.behaviorauth.service;

import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.config.NotificationConfig;
import com.bank.behaviorauth.model.AuthDecision;
import com.bank.behaviorauth.model.DecisionRecord;
import com.bank.behaviorauth.model.PolicyRule;
import com.bank.behaviorauth.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LockoutNotificationServiceTest {

    private NotificationConfig config;
    private LockoutNotificationService service;

    @BeforeEach
    void setUp() {
        config = new NotificationConfig();
        config.setEnabled(true);
        service = new LockoutNotificationService(config, new MetricsConfig(new SimpleMeterRegistry()));
    }

    @Test
    void shouldNotify_disabled_neverSends() {
        config.setEnabled(false);

        assertThat(service.shouldNotify(
                TestDataFactory.createDecisionRecord("USER-001", AuthDecision.BLOCK, PolicyRule.LOCKOUT, 0.1))).isFalse();
    }

    @Test
    void shouldNotify_nonBlockDecision_isSkipped() {
        assertThat(service.shouldNotify(
                TestDataFactory.createDecisionRecord("USER-001", AuthDecision.CHALLENGE, PolicyRule.RISK_CHALLENGE, 0.5)))
                .isFalse();
    }

    @Test
    void shouldNotify_anyBlock_whenNotLockoutOnly() {
        assertThat(service.shouldNotify(
                TestDataFactory.createDecisionRecord("USER-001", AuthDecision.BLOCK, PolicyRule.RISK_BLOCK, 0.8)))
                .isTrue();
    }

    @Test
    void shouldNotify_lockoutOnly_skipsRiskBlocks() {
        config.setLockoutOnly(true);

        assertThat(service.shouldNotify(
                TestDataFactory.createDecisionRecord("USER-001", AuthDecision.BLOCK, PolicyRule.RISK_BLOCK, 0.8)))
                .isFalse();
        assertThat(service.shouldNotify(
                TestDataFactory.createDecisionRecord("USER-001", AuthDecision.BLOCK, PolicyRule.LOCKOUT, 0.1)))
                .isTrue();
    }

    @Test
    void buildMessageBody_containsDecisionDetails() {
        DecisionRecord record = TestDataFactory.createDecisionRecord("USER-042", AuthDecision.BLOCK, PolicyRule.RISK_BLOCK, 0.81);

        String body = service.buildMessageBody(record);

        assertThat(body)
                .contains("Session BLOCKED")
                .contains("User: USER-042")
                .contains("Rule: RISK_BLOCK")
                .contains("Risk: 0.81")
                .contains("Phase: full_auth");
    }
}
