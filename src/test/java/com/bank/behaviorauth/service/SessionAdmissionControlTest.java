package com.bank.behaviorauth.service;

import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.exception.CapacityExceededException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionAdmissionControlTest {

    private SimpleMeterRegistry registry;
    private SessionAdmissionControl admission;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        admission = new SessionAdmissionControl(new MetricsConfig(registry));
    }

    @Test
    void acquire_underLimit_takesSlot() {
        admission.acquire(2);
        admission.acquire(2);

        assertThat(admission.inFlight()).isEqualTo(2);
        assertThat(registry.get("auth.sessions.in_flight").gauge().value()).isEqualTo(2.0);
    }

    @Test
    void acquire_atLimit_throwsAndCounts() {
        admission.acquire(1);

        assertThatThrownBy(() -> admission.acquire(1))
                .isInstanceOf(CapacityExceededException.class)
                .extracting("limit").isEqualTo(1);
        assertThat(admission.inFlight()).isEqualTo(1);
        assertThat(registry.counter("auth.admission.rejected.count").count()).isEqualTo(1.0);
    }

    @Test
    void release_freesSlot() {
        admission.acquire(1);
        admission.release();

        admission.acquire(1);
        assertThat(admission.inFlight()).isEqualTo(1);
    }
}
