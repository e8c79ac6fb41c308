package com.bank.behaviorauth.config;

import com.bank.behaviorauth.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the active {@link EngineSettings}. Startup validation failures abort the
 * application context; runtime updates are validated first and swapped atomically.
 */
@Component
public class EngineSettingsHolder {

    private static final Logger log = LoggerFactory.getLogger(EngineSettingsHolder.class);

    private final AtomicReference<EngineSettings> current;

    public EngineSettingsHolder(AuthEngineProperties properties) {
        EngineSettings initial = EngineSettings.from(properties);
        this.current = new AtomicReference<>(initial);
        log.info("Engine settings loaded: dimension={}, weights={}, phaseLevels={}, timeout={}ms",
                initial.getVectorDimension(), initial.getFusionWeights(),
                initial.getPhasePolicyLevels(), initial.getScorerTimeoutMs());
    }

    public EngineSettings current() {
        return current.get();
    }

    /**
     * Apply a change to a copy of the active settings.
     *
     * @throws ConfigurationException if the result is invalid; the active settings are kept
     */
    public synchronized EngineSettings update(UnaryOperator<EngineSettings.EngineSettingsBuilder> change) {
        EngineSettings candidate = change.apply(current.get().toBuilder()).build().validate();
        current.set(candidate);
        log.info("Engine settings updated");
        return candidate;
    }
}
