package com.bank.behaviorauth.engine.scoring;

import com.bank.behaviorauth.config.AuthEngineProperties;
import com.bank.behaviorauth.exception.ScorerUnavailableException;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Session-graph anomaly from the external graph model.
 */
@Component
public class GraphAnomalyScorer extends AbstractHttpModelScorer {

    public GraphAnomalyScorer(@Qualifier("modelRestTemplate") RestTemplate restTemplate,
                              AuthEngineProperties properties) {
        super(restTemplate, properties.getScorers().getGraph());
    }

    @Override
    public SignalSource source() {
        return SignalSource.GRAPH;
    }

    @Override
    public SignalScore score(ScoringFeatures features) throws ScorerUnavailableException {
        // Nothing to score; the model itself is fine
        if (features.getSessionGraph() == null || features.getSessionGraph().isEmpty()) {
            return SignalScore.degraded(source(), "no session graph supplied");
        }
        return super.score(features);
    }

    @Override
    protected Map<String, Object> buildPayload(ScoringFeatures features) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("userId", features.getUserId());
        payload.put("sessionId", features.getSessionId());
        payload.put("nodes", features.getSessionGraph().getNodes());
        payload.put("edges", features.getSessionGraph().getEdges());
        return payload;
    }
}
