package com.bank.behaviorauth.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserLockRegistryTest {

    private final UserLockRegistry registry = new UserLockRegistry();
    private final ExecutorService pool = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void withLock_sameUser_neverOverlaps() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        List<CompletableFuture<Integer>> futures = new ArrayList<>();

        for (int i = 0; i < 40; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> registry.withLock("USER-001", () -> {
                int now = inside.incrementAndGet();
                maxInside.accumulateAndGet(now, Math::max);
                sleep(2);
                inside.decrementAndGet();
                return now;
            }), pool));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(registry.trackedUsers()).isZero();
    }

    @Test
    void withLock_otherUser_proceedsWhileFirstIsHeld() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> registry.withLock("USER-001", () -> {
            holding.countDown();
            await(release);
            return null;
        }), pool);
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();

        String other = CompletableFuture.supplyAsync(() -> registry.withLock("USER-002", () -> "done"), pool)
                .get(2, TimeUnit.SECONDS);
        CompletableFuture<String> sameUser = CompletableFuture.supplyAsync(
                () -> registry.withLock("USER-001", () -> "second"), pool);
        Thread.sleep(100);

        assertThat(other).isEqualTo("done");
        assertThat(sameUser).isNotDone();

        release.countDown();
        holder.get(2, TimeUnit.SECONDS);
        assertThat(sameUser.get(2, TimeUnit.SECONDS)).isEqualTo("second");
        assertThat(registry.trackedUsers()).isZero();
    }

    @Test
    void withLock_actionThrows_releasesEntry() {
        assertThatThrownBy(() -> registry.withLock("USER-001", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.trackedUsers()).isZero();
        assertThat(registry.withLock("USER-001", () -> "again")).isEqualTo("again");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
