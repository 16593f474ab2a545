package com.example.videoupload_backend.util;

public enum MediaStatus {
    UPLOAD_STARTED,
    UPLOAD_IN_PROGRESS,
    PROCESSING_STARTED,
    PROCESSING_FINISHED
}
