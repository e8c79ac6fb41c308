package com.bank.behaviorauth.health;

import com.bank.behaviorauth.engine.scoring.ComponentHealthRegistry;
import com.bank.behaviorauth.model.HealthComponent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineHealthIndicatorTest {

    private ComponentHealthRegistry registry;
    private PipelineHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        registry = new ComponentHealthRegistry();
        indicator = new PipelineHealthIndicator(registry);
    }

    @Test
    void health_allComponentsUp_isUp() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("context_scorer", true).hasSize(5);
    }

    @Test
    void health_externalScorerDown_staysUpWithDetail() {
        registry.markUnavailable(HealthComponent.CONTEXT_SCORER, "timeout");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("context_scorer", false);
    }

    @Test
    void health_vectorStoreDown_isDown() {
        registry.markUnavailable(HealthComponent.VECTOR_STORE, "insert failed");

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);

        registry.markHealthy(HealthComponent.VECTOR_STORE);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }
}
