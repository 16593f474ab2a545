package com.example.videoupload_backend.service;

import com.example.videoupload_backend.service.Interfaces.UploadNotificationSink;
import com.example.videoupload_backend.service.event.PromotionRequestedEvent;
import com.example.videoupload_backend.service.event.UploadFinalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Publishes lifecycle hand-offs as Spring application events. A broker bridge can listen
 * to these events without the lifecycle knowing about it.
 */
@Component
public class ApplicationEventNotificationSink implements UploadNotificationSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApplicationEventNotificationSink.class);

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ApplicationEventNotificationSink(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public void notifyUploadFinalized(Long videoId) {
        LOGGER.info("NOTIFY upload finalized videoId={}", videoId);
        publisher.publishEvent(new UploadFinalizedEvent(videoId, Instant.now(clock)));
    }

    @Override
    public void notifyPromotionRequested(Long videoId) {
        LOGGER.info("NOTIFY promotion requested videoId={}", videoId);
        publisher.publishEvent(new PromotionRequestedEvent(videoId, Instant.now(clock)));
    }
}
