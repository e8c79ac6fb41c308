package com.bank.behaviorauth.engine.scoring;

import com.bank.behaviorauth.config.AuthEngineProperties;
import com.bank.behaviorauth.exception.ScorerUnavailableException;
import com.bank.behaviorauth.model.SignalScore;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Common HTTP plumbing for model scorers: POST a JSON payload, read back
 * {@code {score, confidence}} and reject anything outside [0,1].
 */
public abstract class AbstractHttpModelScorer implements ExternalScorer {

    private final RestTemplate restTemplate;
    private final AuthEngineProperties.ModelEndpoint endpoint;

    protected AbstractHttpModelScorer(RestTemplate restTemplate, AuthEngineProperties.ModelEndpoint endpoint) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    @Override
    public SignalScore score(ScoringFeatures features) throws ScorerUnavailableException {
        if (!endpoint.isEnabled() || endpoint.getUrl() == null || endpoint.getUrl().isBlank()) {
            throw new ScorerUnavailableException(source().getCode() + " model endpoint is not enabled");
        }

        ModelScoreResponse response;
        try {
            response = restTemplate.postForObject(endpoint.getUrl(), buildPayload(features), ModelScoreResponse.class);
        } catch (RestClientException e) {
            throw new ScorerUnavailableException(source().getCode() + " model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getScore() == null) {
            throw new ScorerUnavailableException(source().getCode() + " model returned no score");
        }
        double score = response.getScore();
        double confidence = response.getConfidence() == null ? 1.0 : response.getConfidence();
        if (!inUnitRange(score) || !inUnitRange(confidence)) {
            throw new ScorerUnavailableException(String.format("%s model answered out of range: score=%s confidence=%s",
                    source().getCode(), score, confidence));
        }

        return toSignal(features, score, confidence, response.getModelVersion());
    }

    protected abstract Map<String, Object> buildPayload(ScoringFeatures features);

    protected SignalScore toSignal(ScoringFeatures features, double score, double confidence, String modelVersion) {
        return SignalScore.of(source(), score, confidence,
                String.format("model=%s score=%.3f", modelVersion == null ? "n/a" : modelVersion, score));
    }

    private static boolean inUnitRange(double v) {
        return !Double.isNaN(v) && v >= 0.0 && v <= 1.0;
    }
}
