package com.example.videoupload_backend.exception;

public class VideoNotFoundException extends UploadException {
    private final Long videoId;

    public VideoNotFoundException(Long videoId) {
        super(ErrorCode.VIDEO_NOT_FOUND, "Video not found: " + videoId);
        this.videoId = videoId;
    }

    public Long getVideoId() {
        return videoId;
    }
}
