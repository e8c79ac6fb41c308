package com.bank.behaviorauth.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI behavioralAuthOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Behavioral Authentication API")
                        .version("1.0.0")
                        .description(
                                "Continuous behavioral authentication for mobile banking sessions.\n\n" +
                                "**Decision Pipeline:**\n" +
                                "1. Receive session telemetry via `POST /auth/decide`\n" +
                                "2. Score four signals concurrently against the user's stored state:\n" +
                                "   - `similarity` — best match against the user's stored behavioral vectors\n" +
                                "   - `drift` — deviation of recent sessions from the rolling baseline\n" +
                                "   - `context` — external context-encoder model\n" +
                                "   - `graph` — external session-graph anomaly model\n" +
                                "3. Fuse into one risk score in [0,1] (unavailable signals are re-weighted away)\n" +
                                "4. Gate by learning phase: **cold_start**, **learning** (always allow), " +
                                "**gradual_risk** (lenient level), **full_auth** (full level)\n" +
                                "5. Decide **allow / challenge / block** with lockout and high-value overrides\n\n" +
                                "Every decision carries a per-signal breakdown and the rule that fired.")
                        .contact(new Contact().name("Behavioral Authentication Team")));
    }
}
