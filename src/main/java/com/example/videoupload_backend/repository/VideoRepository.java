package com.example.videoupload_backend.repository;

import com.example.videoupload_backend.model.Video;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VideoRepository extends JpaRepository<Video, Long> {
}
