package com.example.videoupload_backend.service;

import com.example.videoupload_backend.config.UploadProperties;
import com.example.videoupload_backend.dto.web.UploadStatusResponse;
import com.example.videoupload_backend.exception.ChunkTooLargeException;
import com.example.videoupload_backend.exception.IncompleteChunkSetException;
import com.example.videoupload_backend.exception.InvalidStatusTransitionException;
import com.example.videoupload_backend.exception.UploadInProgressConflictException;
import com.example.videoupload_backend.exception.UploadValidationException;
import com.example.videoupload_backend.model.VideoMedia;
import com.example.videoupload_backend.service.Interfaces.ChunkStorage;
import com.example.videoupload_backend.service.Interfaces.ChunkStorage.RelocationResult;
import com.example.videoupload_backend.service.Interfaces.UploadNotificationSink;
import com.example.videoupload_backend.util.MediaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;

/**
 * Drives the chunked upload of a video through its media states:
 * <pre>
 * (none)              --submitChunk-->      UPLOAD_IN_PROGRESS
 * UPLOAD_IN_PROGRESS  --finalizeUpload-->   PROCESSING_STARTED
 * PROCESSING_STARTED  --promote/register--> PROCESSING_FINISHED
 * PROCESSING_FINISHED --submitChunk-->      UPLOAD_IN_PROGRESS (re-upload)
 * </pre>
 * Every operation takes the video's lock, then runs its read-modify-write in one transaction,
 * and releases the lock only after commit. Notifications go out after the commit.
 */
@Service
public class UploadLifecycleService {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadLifecycleService.class);
    static final int MAX_REPORTED_MISSING = 100;

    private final VideoService videoService;
    private final VideoMediaStore mediaStore;
    private final ChunkStorage chunkStorage;
    private final VideoLockManager videoLocks;
    private final UploadNotificationSink notificationSink;
    private final UploadProperties properties;
    private final TransactionTemplate transactions;

    public UploadLifecycleService(VideoService videoService,
                                  VideoMediaStore mediaStore,
                                  ChunkStorage chunkStorage,
                                  VideoLockManager videoLocks,
                                  UploadNotificationSink notificationSink,
                                  UploadProperties properties,
                                  PlatformTransactionManager transactionManager) {
        this.videoService = videoService;
        this.mediaStore = mediaStore;
        this.chunkStorage = chunkStorage;
        this.videoLocks = videoLocks;
        this.notificationSink = notificationSink;
        this.properties = properties;
        this.transactions = new TransactionTemplate(transactionManager);
    }

    /**
     * Stores one chunk of a video upload, starting (or restarting) the upload when needed.
     *
     * @param videoId    video receiving the chunk.
     * @param chunkIndex zero-based index; chunks may arrive in any order.
     * @param chunk      chunk bytes, at most {@code upload.max-chunk-size}.
     * @throws ChunkTooLargeException             before any I/O when the chunk exceeds the limit.
     * @throws UploadInProgressConflictException  when a finalized upload is still being processed.
     */
    public void submitChunk(Long videoId, int chunkIndex, byte[] chunk) {
        validateChunk(chunkIndex, chunk);
        videoLocks.runLocked(videoId, () -> {
            // the record is created in its own transaction before the chunk transaction opens,
            // so one submission never holds two pooled connections at once
            mediaStore.findOrCreate(videoService.findVideo(videoId));
            transactions.executeWithoutResult(tx -> storeChunkForVideo(videoId, chunkIndex, chunk));
        });
    }

    private void storeChunkForVideo(Long videoId, int chunkIndex, byte[] chunk) {
        VideoMedia media = mediaStore.get(videoId);

        switch (media.getStatus()) {
            case PROCESSING_STARTED -> {
                LOGGER.warn("UPLOAD rejected videoId={} chunk={} status={}", videoId, chunkIndex, media.getStatus());
                throw new UploadInProgressConflictException(videoId, "An upload is already in progress.");
            }
            case UPLOAD_IN_PROGRESS -> {
                chunkStorage.storeChunk(Path.of(media.getVideoPath()), chunkIndex, chunk);
                return;
            }
            case PROCESSING_FINISHED -> {
                Path chunkDirectory = chunkStorage.resolveChunkDirectory(videoId);
                LOGGER.info("UPLOAD restart videoId={} previousPath={} path={}", videoId, media.getVideoPath(), chunkDirectory);
                // chunks of the previous upload must not complete the new one
                chunkStorage.clearChunks(chunkDirectory);
                media.resetForReupload(chunkDirectory.toString());
                videoService.unpublish(videoService.findVideo(videoId));
            }
            default -> media.setStatus(MediaStatus.UPLOAD_IN_PROGRESS);
        }

        mediaStore.save(media);
        LOGGER.info("UPLOAD start videoId={} path={}", videoId, media.getVideoPath());
        chunkStorage.storeChunk(Path.of(media.getVideoPath()), chunkIndex, chunk);
    }

    /**
     * Marks chunk ingestion complete once chunks {@code 0..totalChunks-1} are all stored.
     *
     * @param videoId     video whose upload is finalized.
     * @param totalChunks number of chunks the client sent.
     */
    public void finalizeUpload(Long videoId, int totalChunks) {
        if (totalChunks < 1) {
            throw new UploadValidationException("totalChunks must be at least 1");
        }
        if (totalChunks > properties.getMaxTotalChunks()) {
            throw new UploadValidationException("totalChunks must be at most " + properties.getMaxTotalChunks());
        }
        videoLocks.runLocked(videoId, () ->
                transactions.executeWithoutResult(tx -> startProcessing(videoId, totalChunks)));
        notifySafely(videoId, () -> notificationSink.notifyUploadFinalized(videoId));
    }

    private void startProcessing(Long videoId, int totalChunks) {
        VideoMedia media = mediaStore.get(videoId);
        if (!media.isAcceptingChunks()) {
            LOGGER.warn("FINALIZE rejected videoId={} status={}", videoId, media.getStatus());
            throw new InvalidStatusTransitionException(videoId, media.getStatus(), MediaStatus.PROCESSING_STARTED);
        }
        Path directory = Path.of(media.getVideoPath());
        if (!chunkStorage.allChunksPresent(directory, totalChunks)) {
            var missing = chunkStorage.findMissingChunks(directory, totalChunks, MAX_REPORTED_MISSING);
            LOGGER.warn("FINALIZE incomplete videoId={} totalChunks={} missing={}", videoId, totalChunks, missing.size());
            throw new IncompleteChunkSetException(videoId, totalChunks, missing);
        }
        media.setStatus(MediaStatus.PROCESSING_STARTED);
        mediaStore.save(media);
        LOGGER.info("FINALIZE done videoId={} totalChunks={} path={}", videoId, totalChunks, directory);
    }

    /**
     * Moves the finalized chunk set to long-term storage and closes the upload.
     * Files that cannot be moved are logged and left behind; the record still points at the new location.
     *
     * @param videoId video in {@link MediaStatus#PROCESSING_STARTED}.
     * @return what was moved, failed and skipped.
     */
    public RelocationResult promoteToExternalStorage(Long videoId) {
        RelocationResult result = videoLocks.withLock(videoId, () ->
                transactions.execute(tx -> relocateToExternal(videoId)));
        notifySafely(videoId, () -> notificationSink.notifyPromotionRequested(videoId));
        return result;
    }

    private RelocationResult relocateToExternal(Long videoId) {
        VideoMedia media = mediaStore.get(videoId);
        requireProcessingStarted(videoId, media);

        Path source = Path.of(media.getVideoPath());
        Path destination = chunkStorage.resolveExternalDirectory(videoId);
        RelocationResult result = chunkStorage.relocate(source, destination);
        if (result.hasFailures()) {
            LOGGER.warn("PROMOTE partial videoId={} failed={}", videoId, result.failed());
        }

        media.setVideoPath(destination.toString());
        media.setStatus(MediaStatus.PROCESSING_FINISHED);
        mediaStore.save(media);
        LOGGER.info("PROMOTE done videoId={} path={} moved={}", videoId, destination, result.moved().size());
        return result;
    }

    /**
     * Records the location of an asset a downstream processor produced itself.
     *
     * @param videoId   video in {@link MediaStatus#PROCESSING_STARTED}.
     * @param videoPath final asset location.
     */
    public void registerProcessedPath(Long videoId, String videoPath) {
        if (videoPath == null || videoPath.isBlank()) {
            throw new UploadValidationException("videoPath is required");
        }
        videoLocks.runLocked(videoId, () -> transactions.executeWithoutResult(tx -> {
            VideoMedia media = mediaStore.get(videoId);
            requireProcessingStarted(videoId, media);
            media.setVideoPath(videoPath.trim());
            media.setStatus(MediaStatus.PROCESSING_FINISHED);
            mediaStore.save(media);
            LOGGER.info("PROCESSED path registered videoId={} path={}", videoId, media.getVideoPath());
        }));
    }

    public UploadStatusResponse getUploadStatus(Long videoId) {
        return transactions.execute(tx -> {
            VideoMedia media = mediaStore.get(videoId);
            return new UploadStatusResponse(videoId, media.getStatus().name(), media.getVideoPath(), media.getUpdatedAt());
        });
    }

    private void requireProcessingStarted(Long videoId, VideoMedia media) {
        if (media.getStatus() != MediaStatus.PROCESSING_STARTED) {
            LOGGER.warn("PROMOTE rejected videoId={} status={}", videoId, media.getStatus());
            throw new InvalidStatusTransitionException(videoId, media.getStatus(), MediaStatus.PROCESSING_FINISHED);
        }
    }

    private void validateChunk(int chunkIndex, byte[] chunk) {
        if (chunkIndex < 0) {
            throw new UploadValidationException("chunkIndex must be >= 0");
        }
        if (chunk == null) {
            throw new UploadValidationException("chunk is required");
        }
        long max = properties.getMaxChunkSize().toBytes();
        if (chunk.length > max) {
            throw new ChunkTooLargeException(chunk.length, max);
        }
    }

    // the transition is already committed; a failing sink must not turn it into an error
    private void notifySafely(Long videoId, Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            LOGGER.error("Notification failed videoId={} err={}", videoId, e.toString(), e);
        }
    }
}
