package com.example.videoupload_backend.exception;

import com.example.videoupload_backend.util.MediaStatus;

public class InvalidStatusTransitionException extends UploadException {
    private final Long videoId;
    private final MediaStatus current;
    private final MediaStatus target;

    public InvalidStatusTransitionException(Long videoId, MediaStatus current, MediaStatus target) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                "Video " + videoId + " cannot move from " + current + " to " + target);
        this.videoId = videoId;
        this.current = current;
        this.target = target;
    }

    public Long getVideoId() {
        return videoId;
    }

    public MediaStatus getCurrent() {
        return current;
    }

    public MediaStatus getTarget() {
        return target;
    }
}
