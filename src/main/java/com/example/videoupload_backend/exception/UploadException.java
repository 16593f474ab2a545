package com.example.videoupload_backend.exception;

/**
 * Base type for every failure the upload lifecycle reports to its callers.
 * Nothing in the core retries; the caller decides what to do with the {@link ErrorCode}.
 */
public abstract class UploadException extends RuntimeException {
    private final ErrorCode code;

    protected UploadException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected UploadException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
