package com.example.videoupload_backend.exception;

public class UploadInProgressConflictException extends UploadException {
    private final Long videoId;

    public UploadInProgressConflictException(Long videoId, String message) {
        super(ErrorCode.UPLOAD_IN_PROGRESS, message);
        this.videoId = videoId;
    }

    public UploadInProgressConflictException(Long videoId, String message, Throwable cause) {
        super(ErrorCode.UPLOAD_IN_PROGRESS, message, cause);
        this.videoId = videoId;
    }

    public Long getVideoId() {
        return videoId;
    }
}
