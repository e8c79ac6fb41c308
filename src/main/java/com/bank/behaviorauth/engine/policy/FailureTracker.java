package com.bank.behaviorauth.engine.policy;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rolling one-hour count of authentication failures per user. Users whose
 * failures have all aged out are dropped from the map.
 */
@Component
public class FailureTracker {

    static final long WINDOW_MILLIS = 60L * 60L * 1000L;

    private final ConcurrentMap<String, Deque<Long>> failures = new ConcurrentHashMap<>();

    public void recordFailure(String userId, long nowMillis) {
        failures.compute(userId, (id, existing) -> {
            Deque<Long> times = existing == null ? new ArrayDeque<>() : existing;
            times.addLast(nowMillis);
            prune(times, nowMillis);
            return times.isEmpty() ? null : times;
        });
    }

    public int countRecent(String userId, long nowMillis) {
        AtomicInteger count = new AtomicInteger();
        failures.computeIfPresent(userId, (id, times) -> {
            prune(times, nowMillis);
            count.set(times.size());
            return times.isEmpty() ? null : times;
        });
        return count.get();
    }

    public void clear(String userId) {
        failures.remove(userId);
    }

    int trackedUsers() {
        return failures.size();
    }

    private static void prune(Deque<Long> times, long nowMillis) {
        while (!times.isEmpty() && times.peekFirst() <= nowMillis - WINDOW_MILLIS) {
            times.removeFirst();
        }
    }
}
