package com.example.videoupload_backend.model;

import com.example.videoupload_backend.util.MediaStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Upload/processing state of the binary asset behind one {@link Video}.
 * At most one row exists per video ({@code uq_video_media_video}).
 */
@Entity
@Table(
        name = "video_media",
        uniqueConstraints = @UniqueConstraint(name = "uq_video_media_video", columnNames = "video_id")
)
public class VideoMedia {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "video_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_video_media_video"))
    private Video video;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private MediaStatus status = MediaStatus.UPLOAD_STARTED;

    // chunk directory while uploading, final asset location once processed
    @Column(name = "video_path", nullable = false, length = 1024)
    private String videoPath;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public VideoMedia() {}

    public VideoMedia(Video video, MediaStatus status, String videoPath) {
        this.video = video;
        this.status = status;
        this.videoPath = videoPath;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Video getVideo() {
        return video;
    }

    public void setVideo(Video video) {
        this.video = video;
    }

    public MediaStatus getStatus() {
        return status;
    }

    public void setStatus(MediaStatus status) {
        this.status = status;
    }

    public String getVideoPath() {
        return videoPath;
    }

    public void setVideoPath(String videoPath) {
        this.videoPath = videoPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Points the record back at a fresh chunk directory so a new upload can replace a processed asset.
     *
     * @param chunkDirectory default chunk directory of the video.
     */
    public void resetForReupload(String chunkDirectory) {
        this.videoPath = chunkDirectory;
        this.status = MediaStatus.UPLOAD_IN_PROGRESS;
    }

    @Transient
    public boolean isAcceptingChunks() {
        return status == MediaStatus.UPLOAD_IN_PROGRESS;
    }
}
