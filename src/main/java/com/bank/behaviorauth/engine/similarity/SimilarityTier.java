package com.bank.behaviorauth.engine.similarity;

import com.bank.behaviorauth.config.EngineSettings;

public enum SimilarityTier {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    public static SimilarityTier of(double similarity, EngineSettings settings) {
        if (similarity >= settings.getSimilarityHigh()) return HIGH;
        if (similarity >= settings.getSimilarityMedium()) return MEDIUM;
        if (similarity >= settings.getSimilarityLow()) return LOW;
        return NONE;
    }
}
