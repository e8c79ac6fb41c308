package com.bank.behaviorauth.service;

import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.config.NotificationConfig;
import com.bank.behaviorauth.model.AuthDecision;
import com.bank.behaviorauth.model.DecisionRecord;
import com.bank.behaviorauth.model.PolicyRule;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Alerts the security desk by SMS or WhatsApp when a session is blocked.
 */
@Service
public class LockoutNotificationService {

    private static final Logger log = LoggerFactory.getLogger(LockoutNotificationService.class);

    private final NotificationConfig config;
    private final MetricsConfig metricsConfig;

    public LockoutNotificationService(NotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Lockout notifications enabled. Channel: {}, lockoutOnly: {}",
                    config.getChannel(), config.isLockoutOnly());
        } else {
            log.info("Lockout notifications are DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-block-notification")
    public void notifyIfBlocked(DecisionRecord record) {
        if (!shouldNotify(record)) {
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(record)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Block notification sent for user={}, decision={}, sid={}",
                    record.getUserId(), record.getDecisionId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send block notification for user={}: {}", record.getUserId(), e.getMessage(), e);
        }
    }

    boolean shouldNotify(DecisionRecord record) {
        if (!config.isEnabled() || record.getDecision() != AuthDecision.BLOCK) {
            return false;
        }
        return !config.isLockoutOnly() || record.getRuleFired() == PolicyRule.LOCKOUT;
    }

    String buildMessageBody(DecisionRecord record) {
        return String.format(
                "[AUTH ALERT] Session BLOCKED\n" +
                "User: %s\n" +
                "Session: %s\n" +
                "Rule: %s\n" +
                "Risk: %.2f\n" +
                "Phase: %s",
                record.getUserId(),
                record.getSessionId(),
                record.getRuleFired(),
                record.getFusedRisk(),
                record.getPhase().getCode()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
