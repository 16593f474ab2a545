package com.example.videoupload_backend.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    VIDEO_NOT_FOUND(HttpStatus.NOT_FOUND),
    UPLOAD_NOT_STARTED(HttpStatus.NOT_FOUND),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT),
    UPLOAD_IN_PROGRESS(HttpStatus.CONFLICT),
    INVALID_UPLOAD_REQUEST(HttpStatus.BAD_REQUEST),
    CHUNK_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE),
    INCOMPLETE_CHUNK_SET(HttpStatus.BAD_REQUEST),
    STORAGE_IO_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
