package com.example.videoupload_backend.service;

import com.example.videoupload_backend.config.UploadProperties;
import com.example.videoupload_backend.exception.UploadInProgressConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VideoLockManagerTest {

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void sameVideoIsNeverEnteredTwiceAtOnce() throws Exception {
        VideoLockManager locks = new VideoLockManager(props(Duration.ofSeconds(5)));
        executor = Executors.newFixedThreadPool(6);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(12);

        for (int i = 0; i < 12; i++) {
            executor.submit(() -> {
                locks.runLocked(42L, () -> {
                    int current = inside.incrementAndGet();
                    maxInside.updateAndGet(v -> Math.max(v, current));
                    sleep(5);
                    inside.decrementAndGet();
                });
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, maxInside.get());
        assertThat(locks.activeLocks()).isZero();
    }

    @Test
    void differentVideosDoNotWaitOnEachOther() throws Exception {
        VideoLockManager locks = new VideoLockManager(props(Duration.ofSeconds(5)));
        executor = Executors.newFixedThreadPool(2);
        CountDownLatch bothInside = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> first = executor.submit(() -> locks.runLocked(1L, () -> holdUntil(bothInside, release)));
        Future<?> second = executor.submit(() -> locks.runLocked(2L, () -> holdUntil(bothInside, release)));

        assertTrue(bothInside.await(2, TimeUnit.SECONDS));
        release.countDown();
        first.get(2, TimeUnit.SECONDS);
        second.get(2, TimeUnit.SECONDS);
        assertThat(locks.activeLocks()).isZero();
    }

    @Test
    void waitingLongerThanTheTimeoutIsAConflict() throws Exception {
        VideoLockManager locks = new VideoLockManager(props(Duration.ofMillis(50)));
        executor = Executors.newSingleThreadExecutor();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> locks.runLocked(7L, () -> holdUntil(held, release)));
        assertTrue(held.await(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> locks.runLocked(7L, () -> { }))
                .isInstanceOf(UploadInProgressConflictException.class);

        release.countDown();
        holder.get(2, TimeUnit.SECONDS);
        assertThat(locks.activeLocks()).isZero();
    }

    @Test
    void lockIsReleasedWhenTheActionThrows() {
        VideoLockManager locks = new VideoLockManager(props(Duration.ofSeconds(1)));

        assertThatThrownBy(() -> locks.runLocked(3L, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.withLock(3L, () -> "again")).isEqualTo("again");
        assertThat(locks.activeLocks()).isZero();
    }

    private static UploadProperties props(Duration timeout) {
        UploadProperties props = new UploadProperties();
        props.setLockTimeout(timeout);
        return props;
    }

    private static void holdUntil(CountDownLatch entered, CountDownLatch release) {
        entered.countDown();
        try {
            release.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
