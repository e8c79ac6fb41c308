package com.bank.behaviorauth.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger inFlightSessions;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.inFlightSessions = registry.gauge("auth.sessions.in_flight", new AtomicInteger(0));
    }

    public void recordDecision(String decision, String phase, String rule, double fusedRisk, long latencyMs) {
        Counter.builder("auth.decision.count")
                .tag("decision", decision)
                .tag("phase", phase)
                .tag("rule", rule)
                .register(registry)
                .increment();

        DistributionSummary.builder("auth.decision.fused_risk")
                .tag("decision", decision)
                .register(registry)
                .record(fusedRisk);

        Timer.builder("auth.decision.latency")
                .tag("phase", phase)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void recordDegradedSignal(String source, String reason) {
        Counter.builder("auth.signal.degraded.count")
                .tag("source", source)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCapacityRejected() {
        Counter.builder("auth.admission.rejected.count")
                .register(registry)
                .increment();
    }

    public void recordValidationRejected(String field) {
        Counter.builder("auth.validation.rejected.count")
                .tag("field", field)
                .register(registry)
                .increment();
    }

    public void recordPhaseTransition(String from, String to) {
        Counter.builder("auth.phase.transition.count")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordFailure(String kind) {
        Counter.builder("auth.failure.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateInFlightSessions(int count) {
        inFlightSessions.set(count);
    }
}
