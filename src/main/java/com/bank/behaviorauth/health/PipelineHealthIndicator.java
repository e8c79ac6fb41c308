package com.bank.behaviorauth.health;

import com.bank.behaviorauth.engine.scoring.ComponentHealthRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of the component flags. Only the in-process components can
 * take the service DOWN; external scorer outages degrade signals and show up
 * as details.
 */
@Component("decisionPipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private final ComponentHealthRegistry health;

    public PipelineHealthIndicator(ComponentHealthRegistry health) {
        this.health = health;
    }

    @Override
    public Health health() {
        Health.Builder builder = health.isLocalPipelineHealthy() ? Health.up() : Health.down();
        return builder.withDetails(health.snapshot()).build();
    }
}
