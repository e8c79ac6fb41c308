package com.bank.behaviorauth.engine.scoring;

import com.bank.behaviorauth.model.HealthComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Availability flag per pipeline component, updated by the most recent call.
 */
@Component
public class ComponentHealthRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentHealthRegistry.class);

    private final Map<HealthComponent, AtomicBoolean> flags = new EnumMap<>(HealthComponent.class);

    public ComponentHealthRegistry() {
        for (HealthComponent component : HealthComponent.values()) {
            flags.put(component, new AtomicBoolean(true));
        }
    }

    public void markHealthy(HealthComponent component) {
        if (flags.get(component).compareAndSet(false, true)) {
            log.info("Component {} recovered", component.getCode());
        }
    }

    public void markUnavailable(HealthComponent component, String reason) {
        if (flags.get(component).compareAndSet(true, false)) {
            log.warn("Component {} unavailable: {}", component.getCode(), reason);
        }
    }

    public boolean isHealthy(HealthComponent component) {
        return flags.get(component).get();
    }

    /**
     * Components the engine runs in-process; the external scorers are not among them.
     */
    public boolean isLocalPipelineHealthy() {
        return isHealthy(HealthComponent.VECTOR_STORE)
                && isHealthy(HealthComponent.SIMILARITY)
                && isHealthy(HealthComponent.DRIFT);
    }

    public Map<String, Boolean> snapshot() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (HealthComponent component : HealthComponent.values()) {
            out.put(component.getCode(), flags.get(component).get());
        }
        return out;
    }
}
