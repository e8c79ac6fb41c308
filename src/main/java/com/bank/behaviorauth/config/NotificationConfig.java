package com.bank.behaviorauth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification.twilio")
public class NotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    // Security operations desk
    private String toNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"
    // When true only lockouts are sent; otherwise every block decision
    private boolean lockoutOnly = false;
}
