package com.example.videoupload_backend.dto.web;

import java.time.Instant;

public record UploadStatusResponse(Long videoId, String status, String videoPath, Instant updatedAt) {}
