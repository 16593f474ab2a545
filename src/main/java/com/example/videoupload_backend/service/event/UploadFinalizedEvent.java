package com.example.videoupload_backend.service.event;

import java.time.Instant;

public record UploadFinalizedEvent(Long videoId, Instant occurredAt) {}
