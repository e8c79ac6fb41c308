package com.bank.behaviorauth.engine.vector;

/**
 * Small dense-vector helpers. All inputs are assumed to share one dimension.
 */
public final class VectorMath {

    private VectorMath() {}

    /**
     * L2-normalize into a new array. A zero vector is returned as a zero copy.
     */
    public static float[] normalize(float[] v) {
        double norm = Math.sqrt(dot(v, v));
        float[] out = new float[v.length];
        if (norm == 0.0) return out;
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }

    public static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    public static double euclidean(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    public static float[] centroid(Iterable<float[]> vectors, int dimension) {
        double[] acc = new double[dimension];
        int n = 0;
        for (float[] v : vectors) {
            for (int i = 0; i < dimension; i++) {
                acc[i] += v[i];
            }
            n++;
        }
        float[] out = new float[dimension];
        if (n == 0) return out;
        for (int i = 0; i < dimension; i++) {
            out[i] = (float) (acc[i] / n);
        }
        return out;
    }

    /**
     * Exponential move of {@code from} toward {@code to}: from + alpha * (to - from).
     */
    public static float[] blend(float[] from, float[] to, double alpha) {
        float[] out = new float[from.length];
        for (int i = 0; i < from.length; i++) {
            out[i] = (float) (from[i] + alpha * (to[i] - from[i]));
        }
        return out;
    }
}
