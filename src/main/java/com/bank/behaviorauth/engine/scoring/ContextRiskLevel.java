package com.bank.behaviorauth.engine.scoring;

/**
 * Coarse risk context of a request, sent to the context encoder and used to
 * scale the confidence it reports.
 */
public enum ContextRiskLevel {
    LOW,
    ELEVATED,
    HIGH;

    public static ContextRiskLevel assess(boolean deviceIntegrityOk, Double transactionAmount,
                                          double highValueThreshold) {
        if (!deviceIntegrityOk) return HIGH;
        if (transactionAmount == null) return LOW;
        if (transactionAmount >= highValueThreshold) return HIGH;
        if (transactionAmount >= highValueThreshold / 2) return ELEVATED;
        return LOW;
    }
}
