package com.example.videoupload_backend.repository;

import com.example.videoupload_backend.model.VideoMedia;
import com.example.videoupload_backend.util.MediaStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface VideoMediaRepository extends JpaRepository<VideoMedia, Long> {

    @Query("""
           select m from VideoMedia m
           where m.video.id = :videoId
           """)
    Optional<VideoMedia> findByVideoId(@Param("videoId") Long videoId);

    @Query("""
           select count(m) from VideoMedia m
           where m.video.id = :videoId
           """)
    long countByVideoId(@Param("videoId") Long videoId);

    long countByStatus(MediaStatus status);
}
