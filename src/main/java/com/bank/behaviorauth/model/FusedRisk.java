package com.bank.behaviorauth.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
@Builder
public class FusedRisk {

    double score;

    // Ordered by SignalSource declaration
    Map<SignalSource, SignalContribution> breakdown;

    // Signals that carried non-zero weight
    int trustedSignals;

    public static FusedRisk neutral(Map<SignalSource, SignalContribution> breakdown) {
        return FusedRisk.builder()
                .score(SignalScore.NEUTRAL_VALUE)
                .breakdown(Collections.unmodifiableMap(new EnumMap<>(breakdown)))
                .trustedSignals(0)
                .build();
    }

    public double totalWeight() {
        return breakdown.values().stream().mapToDouble(SignalContribution::getWeight).sum();
    }

    public List<SignalSource> degradedSources() {
        return breakdown.entrySet().stream()
                .filter(e -> e.getValue().isDegraded())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public boolean isDegraded(SignalSource source) {
        SignalContribution c = breakdown.get(source);
        return c != null && c.isDegraded();
    }
}
