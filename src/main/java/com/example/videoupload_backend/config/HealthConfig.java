package com.example.videoupload_backend.config;

import com.example.videoupload_backend.repository.VideoMediaRepository;
import com.example.videoupload_backend.service.Interfaces.ChunkStorage;
import com.example.videoupload_backend.util.MediaStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator chunkStorageHealth(ChunkStorage chunkStorage) {
        return () -> {
            var chunkRoot = chunkStorage.chunkRoot();
            var externalRoot = chunkStorage.externalRoot();
            if (Files.isWritable(chunkRoot) && Files.isWritable(externalRoot)) {
                return Health.up()
                        .withDetail("chunkRoot", chunkRoot.toString())
                        .withDetail("externalRoot", externalRoot.toString())
                        .build();
            }
            return Health.down()
                    .withDetail("chunkRoot", chunkRoot.toString())
                    .withDetail("externalRoot", externalRoot.toString())
                    .withDetail("reason", "not writable")
                    .build();
        };
    }

    @Bean
    public HealthIndicator uploadPipelineHealth(VideoMediaRepository mediaRepository) {
        return () -> {
            try {
                return Health.up()
                        .withDetail("uploadsInProgress", mediaRepository.countByStatus(MediaStatus.UPLOAD_IN_PROGRESS))
                        .withDetail("awaitingPromotion", mediaRepository.countByStatus(MediaStatus.PROCESSING_STARTED))
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        };
    }
}
