package com.bank.behaviorauth.engine.scoring;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.model.DecisionRequest;
import com.bank.behaviorauth.model.SessionGraph;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What the model scorers see of a request.
 */
@Value
@Builder
public class ScoringFeatures {

    String userId;
    String sessionId;
    float[] behavioralVector;
    SessionGraph sessionGraph;
    Map<String, Double> contextFeatures;
    Double transactionAmount;
    boolean deviceIntegrityOk;
    ContextRiskLevel riskLevel;

    public static ScoringFeatures from(DecisionRequest request, EngineSettings settings) {
        return ScoringFeatures.builder()
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .behavioralVector(request.getBehavioralVector())
                .sessionGraph(request.getSessionGraph())
                .contextFeatures(request.getContextFeatures() == null ? Map.of() : Map.copyOf(request.getContextFeatures()))
                .transactionAmount(request.getTransactionAmount())
                .deviceIntegrityOk(request.isDeviceIntegrityOk())
                .riskLevel(ContextRiskLevel.assess(request.isDeviceIntegrityOk(),
                        request.getTransactionAmount(), settings.getHighValueThreshold()))
                .build();
    }
}
