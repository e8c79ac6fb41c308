package com.bank.behaviorauth.engine.vector;

import com.bank.behaviorauth.config.EngineSettings;
import com.bank.behaviorauth.exception.DimensionMismatchException;
import com.bank.behaviorauth.model.BehavioralVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;

/**
 * Per-user store of L2-normalized behavioral vectors with capped retention
 * and exact top-k inner-product search.
 *
 * Writes to one user are exclusive; reads of one user run concurrently.
 * Different users never contend.
 */
@Component
public class VectorStore {

    private static final Logger log = LoggerFactory.getLogger(VectorStore.class);

    private final ConcurrentMap<String, UserVectorSet> sets = new ConcurrentHashMap<>();

    /**
     * Normalize and append a vector, evicting the oldest ones over the per-user cap.
     *
     * @throws DimensionMismatchException if the vector length differs from the configured dimension
     */
    public void insert(String userId, BehavioralVector vector, EngineSettings settings) {
        checkDimension(vector.dimension(), settings);
        BehavioralVector normalized = new BehavioralVector(
                VectorMath.normalize(vector.getValues()), vector.getTimestamp(), vector.getSessionId());

        UserVectorSet set = sets.computeIfAbsent(userId, id -> new UserVectorSet());
        Lock write = set.lock().writeLock();
        write.lock();
        try {
            int evicted = set.append(normalized, settings.getMaxVectorsPerUser());
            if (evicted > 0) {
                log.debug("Evicted {} vector(s) for user {} (cap={})",
                        evicted, userId, settings.getMaxVectorsPerUser());
            }
        } finally {
            write.unlock();
        }
    }

    /**
     * Up to {@code k} stored vectors ranked by inner product with the normalized query,
     * descending, most recent first on ties.
     *
     * @throws DimensionMismatchException if the query length differs from the configured dimension
     */
    public VectorSearchResult query(String userId, float[] vector, int k, EngineSettings settings) {
        checkDimension(vector.length, settings);
        UserVectorSet set = sets.get(userId);
        if (set == null) {
            return VectorSearchResult.insufficientData(0);
        }

        List<BehavioralVector> candidates;
        Lock read = set.lock().readLock();
        read.lock();
        try {
            candidates = set.newestFirst();
        } finally {
            read.unlock();
        }

        if (candidates.size() < settings.getMinVectorsForSearch()) {
            return VectorSearchResult.insufficientData(candidates.size());
        }

        float[] query = VectorMath.normalize(vector);
        List<VectorMatch> matches = new ArrayList<>(candidates.size());
        for (BehavioralVector stored : candidates) {
            matches.add(new VectorMatch(stored.getSessionId(), stored.getTimestamp(),
                    VectorMath.dot(query, stored.getValues())));
        }
        matches.sort(Comparator.comparingDouble(VectorMatch::score).reversed());

        return VectorSearchResult.of(matches.subList(0, Math.min(k, matches.size())), candidates.size());
    }

    public int size(String userId) {
        UserVectorSet set = sets.get(userId);
        if (set == null) return 0;
        Lock read = set.lock().readLock();
        read.lock();
        try {
            return set.size();
        } finally {
            read.unlock();
        }
    }

    public void clear(String userId) {
        if (sets.remove(userId) != null) {
            log.info("Cleared stored vectors for user {}", userId);
        }
    }

    private static void checkDimension(int actual, EngineSettings settings) {
        if (actual != settings.getVectorDimension()) {
            throw new DimensionMismatchException(settings.getVectorDimension(), actual);
        }
    }
}
