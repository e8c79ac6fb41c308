package com.bank.behaviorauth.engine.scoring;

import com.bank.behaviorauth.exception.ScorerUnavailableException;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;

/**
 * Strategy interface for the model-backed signals. Each implementation is
 * auto-registered by the {@link ExternalScorerGateway} under its source.
 */
public interface ExternalScorer {

    /**
     * @return the signal this scorer produces
     */
    SignalSource source();

    /**
     * Score one request.
     *
     * @param features request features and derived risk context
     * @return a signal with value and confidence in [0,1]
     * @throws ScorerUnavailableException if the model is disabled, failing or out of contract
     */
    SignalScore score(ScoringFeatures features) throws ScorerUnavailableException;
}
