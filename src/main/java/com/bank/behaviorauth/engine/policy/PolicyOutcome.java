package com.bank.behaviorauth.engine.policy;

import com.bank.behaviorauth.model.AuthDecision;
import com.bank.behaviorauth.model.PolicyLevel;
import com.bank.behaviorauth.model.PolicyRule;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PolicyOutcome {
    AuthDecision decision;
    PolicyRule rule;
    PolicyLevel policyLevel;
    String explanation;
}
