package com.bank.behaviorauth.engine.vector;

import com.bank.behaviorauth.model.BehavioralVector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Normalized vectors of one user, oldest first. Not thread-safe by itself;
 * callers hold {@link #lock()}.
 */
class UserVectorSet {

    private final Deque<BehavioralVector> vectors = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    ReadWriteLock lock() {
        return lock;
    }

    /**
     * Append and evict from the head until at most {@code cap} remain.
     *
     * @return number of evicted vectors
     */
    int append(BehavioralVector vector, int cap) {
        vectors.addLast(vector);
        int evicted = 0;
        while (vectors.size() > cap) {
            vectors.removeFirst();
            evicted++;
        }
        return evicted;
    }

    int size() {
        return vectors.size();
    }

    /**
     * Newest first, so a stable sort by score keeps the most recent vector ahead on ties.
     */
    List<BehavioralVector> newestFirst() {
        List<BehavioralVector> out = new ArrayList<>(vectors.size());
        Iterator<BehavioralVector> it = vectors.descendingIterator();
        while (it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }
}
