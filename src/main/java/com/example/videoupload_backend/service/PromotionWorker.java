package com.example.videoupload_backend.service;

import com.example.videoupload_backend.config.UploadProperties;
import com.example.videoupload_backend.exception.UploadException;
import com.example.videoupload_backend.service.event.UploadFinalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * In-process stand-in for the external collaborator that promotes finalized uploads.
 * Only acts when {@code upload.promotion.auto-promote} is enabled.
 */
@Component
public class PromotionWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PromotionWorker.class);

    private final UploadLifecycleService lifecycleService;
    private final UploadProperties properties;

    public PromotionWorker(UploadLifecycleService lifecycleService, UploadProperties properties) {
        this.lifecycleService = lifecycleService;
        this.properties = properties;
    }

    @Async("promotionTaskExecutor")
    @EventListener
    public void onUploadFinalized(UploadFinalizedEvent event) {
        if (!properties.getPromotion().isAutoPromote()) {
            LOGGER.debug("Auto-promotion disabled, leaving videoId={} to the external processor", event.videoId());
            return;
        }
        try {
            var result = lifecycleService.promoteToExternalStorage(event.videoId());
            LOGGER.info("Auto-promotion finished videoId={} moved={} failed={}",
                    event.videoId(), result.moved().size(), result.failed().size());
        } catch (UploadException e) {
            // nobody waits on this thread; the record keeps its committed state
            LOGGER.warn("Auto-promotion failed videoId={} code={} msg={}", event.videoId(), e.getCode(), e.getMessage());
        }
    }
}
