package com.example.videoupload_backend.exception;

public class UploadNotStartedException extends UploadException {
    private final Long videoId;

    public UploadNotStartedException(Long videoId) {
        super(ErrorCode.UPLOAD_NOT_STARTED, "Upload not started for video " + videoId);
        this.videoId = videoId;
    }

    public Long getVideoId() {
        return videoId;
    }
}
