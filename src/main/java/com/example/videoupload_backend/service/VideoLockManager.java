package com.example.videoupload_backend.service;

import com.example.videoupload_backend.config.UploadProperties;
import com.example.videoupload_backend.exception.UploadInProgressConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-video mutual exclusion. Callers for different videos never wait on each other;
 * lock entries are reference counted and dropped as soon as nobody holds or waits for them.
 */
@Component
public class VideoLockManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoLockManager.class);

    private final ConcurrentHashMap<Long, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public VideoLockManager(UploadProperties properties) {
        this.timeout = properties.getLockTimeout();
    }

    public <T> T withLock(Long videoId, Supplier<T> action) {
        LockEntry entry = retain(videoId);
        try {
            if (!entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Lock timeout videoId={} after {}", videoId, timeout);
                throw new UploadInProgressConflictException(videoId,
                        "Another operation is still running for video " + videoId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(videoId);
            throw new UploadInProgressConflictException(videoId, "Interrupted while waiting for video " + videoId, e);
        } catch (RuntimeException e) {
            release(videoId);
            throw e;
        }

        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(videoId);
        }
    }

    public void runLocked(Long videoId, Runnable action) {
        withLock(videoId, () -> {
            action.run();
            return null;
        });
    }

    int activeLocks() {
        return locks.size();
    }

    private LockEntry retain(Long videoId) {
        return locks.compute(videoId, (id, entry) -> {
            LockEntry e = entry == null ? new LockEntry() : entry;
            e.refs++;
            return e;
        });
    }

    private void release(Long videoId) {
        locks.computeIfPresent(videoId, (id, entry) -> --entry.refs == 0 ? null : entry);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int refs;
    }
}
