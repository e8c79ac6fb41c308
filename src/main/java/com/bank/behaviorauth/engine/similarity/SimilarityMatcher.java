package com.bank.behaviorauth.engine.similarity;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.engine.vector.VectorSearchResult;
import com.bank.behaviorauth.engine.vector.VectorStore;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores how closely a session matches the user's own history: the best
 * inner product among the top-k stored vectors.
 */
@Component
public class SimilarityMatcher {

    private static final Logger log = LoggerFactory.getLogger(SimilarityMatcher.class);

    private final VectorStore vectorStore;

    public SimilarityMatcher(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Observed(name = "signal.similarity", contextualName = "similarity-score")
    public SignalScore score(String userId, float[] vector, EngineSettings settings) {
        VectorSearchResult result = vectorStore.query(userId, vector, settings.getSearchTopK(), settings);

        if (result.insufficientData()) {
            log.debug("Similarity degraded for user {}: {} stored vector(s), need {}",
                    userId, result.storedVectors(), settings.getMinVectorsForSearch());
            return SignalScore.degraded(SignalSource.SIMILARITY, String.format(
                    "insufficient data: %d of %d vectors", result.storedVectors(), settings.getMinVectorsForSearch()));
        }

        double similarity = SignalScore.clamp(result.bestScore());
        SimilarityTier tier = SimilarityTier.of(similarity, settings);
        // Fewer matches than k means a thinner history to compare against
        double confidence = (double) result.matches().size() / settings.getSearchTopK();

        return SignalScore.of(SignalSource.SIMILARITY, similarity, confidence,
                String.format("tier=%s best=%.3f over %d matches", tier, similarity, result.matches().size()));
    }
}
