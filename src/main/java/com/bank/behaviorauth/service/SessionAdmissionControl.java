package com.bank.behaviorauth.service;

import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.exception.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caps the number of decisions in flight. Requests over the limit fail fast
 * instead of queueing.
 */
@Component
public class SessionAdmissionControl {

    private static final Logger log = LoggerFactory.getLogger(SessionAdmissionControl.class);

    private final AtomicInteger inFlight = new AtomicInteger();
    private final MetricsConfig metricsConfig;

    public SessionAdmissionControl(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    /**
     * Take a slot, or throw if {@code limit} slots are already taken.
     * Every successful call must be paired with {@link #release()}.
     */
    public void acquire(int limit) {
        while (true) {
            int current = inFlight.get();
            if (current >= limit) {
                metricsConfig.recordCapacityRejected();
                log.warn("Admission rejected: {} sessions in flight (limit {})", current, limit);
                throw new CapacityExceededException(limit);
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                metricsConfig.updateInFlightSessions(current + 1);
                return;
            }
        }
    }

    public void release() {
        metricsConfig.updateInFlightSessions(inFlight.decrementAndGet());
    }

    public int inFlight() {
        return inFlight.get();
    }
}
