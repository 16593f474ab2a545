package com.example.videoupload_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Limits and behaviour of the chunked upload lifecycle.
 */
@ConfigurationProperties(prefix = "upload")
public class UploadProperties {

    private DataSize maxChunkSize = DataSize.ofMegabytes(1);

    // finalize requests above this are rejected before the chunk directory is scanned
    private int maxTotalChunks = 10_000;

    /**
     * Upper bound for waiting on another operation that holds the same video.
     */
    private Duration lockTimeout = Duration.ofSeconds(30);

    private Promotion promotion = new Promotion();

    public DataSize getMaxChunkSize() {
        return maxChunkSize;
    }

    public void setMaxChunkSize(DataSize maxChunkSize) {
        this.maxChunkSize = maxChunkSize;
    }

    public int getMaxTotalChunks() {
        return maxTotalChunks;
    }

    public void setMaxTotalChunks(int maxTotalChunks) {
        this.maxTotalChunks = maxTotalChunks;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public Promotion getPromotion() {
        return promotion;
    }

    public void setPromotion(Promotion promotion) {
        this.promotion = promotion;
    }

    public static class Promotion {
        // off by default: an external processor triggers promotion once it is done
        private boolean autoPromote = false;

        public boolean isAutoPromote() {
            return autoPromote;
        }

        public void setAutoPromote(boolean autoPromote) {
            this.autoPromote = autoPromote;
        }
    }
}
