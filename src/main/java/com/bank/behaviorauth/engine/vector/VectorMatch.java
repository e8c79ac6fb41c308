package com.bank.behaviorauth.engine.vector;

/**
 * One stored vector returned by a search, with its inner-product score.
 */
public record VectorMatch(String sessionId, long timestamp, double score) {}
