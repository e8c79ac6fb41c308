package com.bank.behaviorauth.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per user. Decisions and resets of the same user run one at a time;
 * different users proceed in parallel. An entry lives only while some thread
 * holds or waits for it.
 */
@Component
public class UserLockRegistry {

    private final ConcurrentMap<String, UserLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String userId, Supplier<T> action) {
        UserLock entry = locks.compute(userId, (id, existing) -> {
            UserLock l = existing == null ? new UserLock() : existing;
            l.users++;
            return l;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(userId, (id, l) -> --l.users == 0 ? null : l);
        }
    }

    int trackedUsers() {
        return locks.size();
    }

    // users is only touched inside compute, under the map's per-key lock
    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
