package com.bank.behaviorauth.engine.fusion;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.model.FusedRisk;
import com.bank.behaviorauth.model.SignalContribution;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Weighted fusion of the four signals into one risk score in [0,1].
 *
 * Each signal is mapped to a risk distance (1 - value for similarity, value
 * for the anomaly-style signals). Every signal keeps
 * {@code weight x confidence} of its configured weight, so a degraded signal
 * (confidence 0) drops out and a less certain one counts for less. The
 * weights are then renormalized to sum to 1. With nothing trusted the score
 * is the neutral 0.5.
 */
@Component
public class EnsembleFusion {

    public FusedRisk fuse(Map<SignalSource, SignalScore> signals, EngineSettings settings) {
        Map<SignalSource, Double> raw = new EnumMap<>(SignalSource.class);
        double total = 0.0;
        for (SignalSource source : SignalSource.values()) {
            SignalScore signal = signalOrDegraded(signals, source);
            double w = settings.weightOf(source) * signal.getConfidence();
            raw.put(source, w);
            total += w;
        }

        Map<SignalSource, SignalContribution> breakdown = new EnumMap<>(SignalSource.class);
        if (total <= 0.0) {
            for (SignalSource source : SignalSource.values()) {
                breakdown.put(source, contribution(signalOrDegraded(signals, source), 0.0));
            }
            return FusedRisk.neutral(breakdown);
        }

        double score = 0.0;
        int trusted = 0;
        for (SignalSource source : SignalSource.values()) {
            SignalScore signal = signalOrDegraded(signals, source);
            double weight = raw.get(source) / total;
            SignalContribution c = contribution(signal, weight);
            breakdown.put(source, c);
            score += c.getContribution();
            if (weight > 0.0) trusted++;
        }

        return FusedRisk.builder()
                .score(SignalScore.clamp(score))
                .breakdown(Collections.unmodifiableMap(breakdown))
                .trustedSignals(trusted)
                .build();
    }

    private static SignalContribution contribution(SignalScore signal, double weight) {
        return SignalContribution.builder()
                .value(signal.getValue())
                .confidence(signal.getConfidence())
                .weight(weight)
                .contribution(weight * signal.getSource().toRiskDistance(signal.getValue()))
                .degraded(signal.isDegraded())
                .detail(signal.getDetail())
                .build();
    }

    private static SignalScore signalOrDegraded(Map<SignalSource, SignalScore> signals, SignalSource source) {
        SignalScore signal = signals.get(source);
        return signal != null ? signal : SignalScore.degraded(source, "signal not produced");
    }
}
