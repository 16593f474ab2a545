package com.example.videoupload_backend.service;

import com.example.videoupload_backend.exception.UploadNotStartedException;
import com.example.videoupload_backend.model.Video;
import com.example.videoupload_backend.model.VideoMedia;
import com.example.videoupload_backend.repository.VideoMediaRepository;
import com.example.videoupload_backend.repository.VideoRepository;
import com.example.videoupload_backend.service.Interfaces.ChunkStorage;
import com.example.videoupload_backend.util.MediaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Durable home of {@link VideoMedia}, the single source of truth for upload status.
 */
@Service
public class VideoMediaStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoMediaStore.class);

    private final VideoMediaRepository mediaRepo;
    private final VideoRepository videoRepo;
    private final ChunkStorage chunkStorage;
    private final TransactionTemplate insertTx;

    public VideoMediaStore(VideoMediaRepository mediaRepo,
                           VideoRepository videoRepo,
                           ChunkStorage chunkStorage,
                           PlatformTransactionManager transactionManager) {
        this.mediaRepo = mediaRepo;
        this.videoRepo = videoRepo;
        this.chunkStorage = chunkStorage;
        this.insertTx = new TransactionTemplate(transactionManager);
        this.insertTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Returns the record of a video, creating it with {@link MediaStatus#UPLOAD_IN_PROGRESS} when absent.
     * <p>
     * The insert runs in its own transaction. When a concurrent creator wins the unique
     * {@code video_id} constraint the winner's row is read back, so callers always see one record.
     * Must be called outside a transaction: a caller's open transaction would hold a second connection.
     *
     * @param video video the record belongs to.
     * @return the existing or newly created record, detached.
     */
    public VideoMedia findOrCreate(Video video) {
        Long videoId = video.getId();
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("findOrCreate called inside a transaction videoId=" + videoId);
        }
        Optional<VideoMedia> existing = mediaRepo.findByVideoId(videoId);
        if (existing.isPresent()) {
            return existing.get();
        }

        String chunkDirectory = chunkStorage.resolveChunkDirectory(videoId).toString();
        try {
            insertTx.executeWithoutResult(status -> mediaRepo.saveAndFlush(
                    new VideoMedia(videoRepo.getReferenceById(videoId), MediaStatus.UPLOAD_IN_PROGRESS, chunkDirectory)));
            LOGGER.info("UPLOAD record created videoId={} path={}", videoId, chunkDirectory);
        } catch (DataIntegrityViolationException e) {
            LOGGER.info("UPLOAD record creation lost race videoId={}, reading winner", videoId);
        }
        return mediaRepo.findByVideoId(videoId)
                .orElseThrow(() -> new IllegalStateException("VideoMedia vanished after create videoId=" + videoId));
    }

    public VideoMedia get(Long videoId) {
        return mediaRepo.findByVideoId(videoId)
                .orElseThrow(() -> new UploadNotStartedException(videoId));
    }

    public VideoMedia save(VideoMedia media) {
        return mediaRepo.save(media);
    }
}
