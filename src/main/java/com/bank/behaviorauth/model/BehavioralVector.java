package com.bank.behaviorauth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One session's feature-extracted behavioral telemetry (touch dynamics, motion,
 * UI timing). Immutable: the values array is copied on the way in and out.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BehavioralVector {

    private final float[] values;
    private final long timestamp;
    private final String sessionId;

    public BehavioralVector(float[] values, long timestamp, String sessionId) {
        this.values = values.clone();
        this.timestamp = timestamp;
        this.sessionId = sessionId;
    }

    public float[] getValues() {
        return values.clone();
    }

    public int dimension() {
        return values.length;
    }

    /**
     * Read a single component without copying the array.
     */
    public float get(int i) {
        return values[i];
    }

    public boolean isZero() {
        for (float v : values) {
            if (v != 0.0f) return false;
        }
        return true;
    }
}
