package com.bank.behaviorauth.engine.vector;

import java.util.List;

/**
 * Result of a top-k search. {@code insufficientData} means the user has fewer
 * stored vectors than the search minimum; it is a signal, not an error.
 */
public record VectorSearchResult(List<VectorMatch> matches, boolean insufficientData, int storedVectors) {

    public static VectorSearchResult insufficientData(int storedVectors) {
        return new VectorSearchResult(List.of(), true, storedVectors);
    }

    public static VectorSearchResult of(List<VectorMatch> matches, int storedVectors) {
        return new VectorSearchResult(List.copyOf(matches), false, storedVectors);
    }

    public double bestScore() {
        return matches.isEmpty() ? 0.0 : matches.get(0).score();
    }
}
