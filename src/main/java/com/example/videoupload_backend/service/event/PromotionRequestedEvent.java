package com.example.videoupload_backend.service.event;

import java.time.Instant;

public record PromotionRequestedEvent(Long videoId, Instant occurredAt) {}
