package com.example.videoupload_backend.service;

import com.example.videoupload_backend.exception.VideoNotFoundException;
import com.example.videoupload_backend.model.Video;
import com.example.videoupload_backend.repository.VideoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lookup side of the video catalog. Videos are created by the admin workflow; the upload
 * lifecycle only reads them and clears the published flag on re-upload.
 */
@Service
public class VideoService {
    private static final Logger log = LoggerFactory.getLogger(VideoService.class);

    private final VideoRepository videoRepo;

    public VideoService(VideoRepository videoRepo) {
        this.videoRepo = videoRepo;
    }

    @Transactional(readOnly = true)
    public Video findVideo(Long videoId) {
        if (videoId == null) {
            throw new VideoNotFoundException(null);
        }
        return videoRepo.findById(videoId)
                .orElseThrow(() -> new VideoNotFoundException(videoId));
    }

    @Transactional
    public void unpublish(Video video) {
        if (!video.isPublished()) {
            return;
        }
        video.setPublished(false);
        videoRepo.save(video);
        log.info("Video unpublished for re-upload videoId={}", video.getId());
    }
}
