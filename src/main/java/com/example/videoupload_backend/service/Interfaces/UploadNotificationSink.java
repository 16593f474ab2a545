package com.example.videoupload_backend.service.Interfaces;

/**
 * Downstream hand-off, called only after the matching status transition has been committed.
 * Delivery and retry are the sink's business.
 */
public interface UploadNotificationSink {

    void notifyUploadFinalized(Long videoId);

    void notifyPromotionRequested(Long videoId);
}
