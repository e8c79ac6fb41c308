package com.bank.behaviorauth.model;

/**
 * Which decision rule produced the final outcome, recorded on every decision.
 */
public enum PolicyRule {
    LOCKOUT,
    DEVICE_INTEGRITY,
    LEARNING_PHASE,
    ALL_SIGNALS_DEGRADED,
    RISK_BLOCK,
    RISK_CHALLENGE,
    RISK_ALLOW,
    UNCERTAIN_BAND,
    HIGH_VALUE_ESCALATION,
    DRIFT_ESCALATION
}
