package com.example.videoupload_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the thread pool used by {@link com.example.videoupload_backend.service.PromotionWorker} to
 * relocate finalized uploads without blocking the finalize caller.
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {

    @Bean(name = "promotionTaskExecutor")
    public ThreadPoolTaskExecutor promotionTaskExecutor(WorkerExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("promotion-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
