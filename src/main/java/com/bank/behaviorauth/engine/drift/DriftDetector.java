package com.bank.behaviorauth.engine.drift;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.engine.vector.VectorMath;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks gradual change in a user's behavior: the centroid of the recent window
 * against a slowly-adapting baseline centroid.
 *
 * {@link #score} is read-only and runs against the state before the current
 * session; {@link #observe} is the feedback step and runs only for sessions
 * that were accepted into the user's history.
 */
@Component
public class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    private final ConcurrentMap<String, DriftState> states = new ConcurrentHashMap<>();

    @Observed(name = "signal.drift", contextualName = "drift-score")
    public SignalScore score(String userId, float[] vector, EngineSettings settings) {
        DriftState state = states.get(userId);
        float[] baseline = state == null ? null : state.baseline();
        if (baseline == null) {
            return SignalScore.degraded(SignalSource.DRIFT, "no drift baseline yet");
        }

        List<float[]> window = state.windowWith(VectorMath.normalize(vector), settings.getDriftWindowSize());
        double drift = SignalScore.clamp(DriftState.drift(window, baseline, settings.getVectorDimension()));
        boolean alert = drift > settings.getDriftThreshold();
        double confidence = Math.min(1.0, (double) window.size() / settings.getDriftWindowSize());

        if (alert) {
            log.debug("Drift alert for user {}: drift={} threshold={}", userId,
                    String.format("%.3f", drift), settings.getDriftThreshold());
        }

        return SignalScore.of(SignalSource.DRIFT, drift, confidence,
                        String.format("drift=%.3f over window of %d%s", drift, window.size(), alert ? " (alert)" : ""))
                .toBuilder()
                .alert(alert)
                .build();
    }

    /**
     * Feed an accepted session into the window. Establishes the baseline once the
     * window holds enough vectors, and adapts it once per full window of stable
     * observations.
     *
     * @return the window drift after this observation, or -1 if no baseline exists yet
     */
    public double observe(String userId, float[] vector, EngineSettings settings) {
        DriftState state = states.computeIfAbsent(userId, id -> new DriftState());
        long now = System.currentTimeMillis();
        int dimension = settings.getVectorDimension();

        synchronized (state) {
            state.append(VectorMath.normalize(vector), settings.getDriftWindowSize());
            List<float[]> window = state.window();
            float[] baseline = state.baseline();

            if (baseline == null) {
                if (window.size() >= settings.getBaselineMinVectors()) {
                    state.setBaseline(VectorMath.centroid(window, dimension), now);
                    log.info("Drift baseline established for user {} from {} vectors", userId, window.size());
                }
                return -1.0;
            }

            double drift = DriftState.drift(window, baseline, dimension);
            if (drift >= settings.getBaselineAdaptationThreshold()) {
                state.resetStableRun();
                log.warn("Sustained drift for user {}: drift={}, baseline held", userId, String.format("%.3f", drift));
                return drift;
            }

            if (state.markStable() >= settings.getDriftWindowSize()) {
                float[] target = VectorMath.centroid(window, dimension);
                state.adapt(VectorMath.blend(baseline, target, settings.getBaselineSmoothingFactor()), now);
                log.debug("Drift baseline adapted for user {} (drift={})", userId, String.format("%.3f", drift));
            }
            return drift;
        }
    }

    public DriftStatus baselineOf(String userId) {
        DriftState state = states.get(userId);
        return state == null ? DriftStatus.none() : state.status();
    }

    public void clear(String userId) {
        if (states.remove(userId) != null) {
            log.info("Cleared drift state for user {}", userId);
        }
    }
}
