package com.example.videoupload_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizes the pool that runs promotions handed off after finalize.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int executorThreads = 2;
    private int executorQueueCapacity = 50;

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }
}
