package com.bank.behaviorauth.engine.scoring;

import com.bank.behaviorauth.config.AuthEngineProperties;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Context anomaly from the external context-encoder model. The request's
 * {@link ContextRiskLevel} is sent along and scales the reported confidence.
 */
@Component
public class ContextEncoderScorer extends AbstractHttpModelScorer {

    private final Map<ContextRiskLevel, Double> confidenceByRisk;

    public ContextEncoderScorer(@Qualifier("modelRestTemplate") RestTemplate restTemplate,
                                AuthEngineProperties properties) {
        super(restTemplate, properties.getScorers().getContext());
        this.confidenceByRisk = properties.getScorers().getContextConfidenceByRisk();
    }

    @Override
    public SignalSource source() {
        return SignalSource.CONTEXT;
    }

    @Override
    protected Map<String, Object> buildPayload(ScoringFeatures features) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("userId", features.getUserId());
        payload.put("sessionId", features.getSessionId());
        payload.put("behavioralVector", features.getBehavioralVector());
        payload.put("contextFeatures", features.getContextFeatures());
        payload.put("transactionAmount", features.getTransactionAmount());
        payload.put("riskLevel", features.getRiskLevel().name());
        return payload;
    }

    @Override
    protected SignalScore toSignal(ScoringFeatures features, double score, double confidence, String modelVersion) {
        double factor = confidenceByRisk.getOrDefault(features.getRiskLevel(), 1.0);
        return SignalScore.of(source(), score, confidence * factor,
                String.format("context=%.3f risk=%s confidence x%.2f", score, features.getRiskLevel(), factor));
    }
}
