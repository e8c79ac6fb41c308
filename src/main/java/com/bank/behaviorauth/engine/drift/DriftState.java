package com.bank.behaviorauth.engine.drift;

import com.bank.behaviorauth.engine.vector.VectorMath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rolling window and baseline centroid of one user. Guarded by its own monitor.
 */
class DriftState {

    private final Deque<float[]> window = new ArrayDeque<>();
    private float[] baseline;
    private long baselineUpdatedAt;
    private int stableObservations;
    private int adaptations;

    synchronized List<float[]> windowWith(float[] candidate, int windowSize) {
        List<float[]> out = new ArrayList<>(windowSize);
        int skip = Math.max(0, window.size() + 1 - windowSize);
        int i = 0;
        for (float[] v : window) {
            if (i++ >= skip) out.add(v);
        }
        out.add(candidate);
        return out;
    }

    synchronized float[] baseline() {
        return baseline;
    }

    synchronized void append(float[] vector, int windowSize) {
        window.addLast(vector);
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    synchronized List<float[]> window() {
        return new ArrayList<>(window);
    }

    synchronized void setBaseline(float[] centroid, long now) {
        this.baseline = centroid;
        this.baselineUpdatedAt = now;
    }

    /**
     * Move to an adapted baseline and start counting a new stable window.
     */
    synchronized void adapt(float[] blended, long now) {
        setBaseline(blended, now);
        stableObservations = 0;
        adaptations++;
    }

    synchronized int markStable() {
        return ++stableObservations;
    }

    synchronized void resetStableRun() {
        stableObservations = 0;
    }

    synchronized DriftStatus status() {
        return new DriftStatus(baseline != null, baselineUpdatedAt, window.size(), stableObservations, adaptations);
    }

    static double drift(List<float[]> window, float[] baseline, int dimension) {
        // Centroids of unit vectors have norm <= 1, so the distance is at most 2
        return VectorMath.euclidean(VectorMath.centroid(window, dimension), baseline) / 2.0;
    }
}
