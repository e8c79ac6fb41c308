package com.bank.behaviorauth.engine.drift;

public record DriftStatus(boolean baselineEstablished, long baselineUpdatedAt,
                          int windowFill, int stableObservations, int adaptations) {

    public static DriftStatus none() {
        return new DriftStatus(false, 0L, 0, 0, 0);
    }
}
