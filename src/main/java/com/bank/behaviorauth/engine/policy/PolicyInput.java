package com.bank.behaviorauth.engine.policy;

import com.bank.behaviorauth.model.FusedRisk;
import com.bank.behaviorauth.model.LearningPhase;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.model.SignalScore;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the policy needs to decide one request.
 */
@Value
@Builder
public class PolicyInput {

    String userId;
    LearningPhase phase;
    // Null while the phase does not enforce risk
    PolicyLevel policyLevel;
    FusedRisk fusedRisk;
    SignalScore drift;
    int recentFailures;
    boolean deviceIntegrityOk;
    Double transactionAmount;
}
