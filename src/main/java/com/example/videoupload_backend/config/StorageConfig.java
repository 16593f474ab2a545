package com.example.videoupload_backend.config;

import com.example.videoupload_backend.service.Interfaces.ChunkStorage;
import com.example.videoupload_backend.service.LocalChunkStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public ChunkStorage chunkStorage(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var storage = new LocalChunkStorage(base, properties.getChunkPrefix(), properties.getExternalPrefix());
        LOGGER.info("Chunk storage wired: base={}, chunkPrefix={}, externalPrefix={}",
                base, properties.getChunkPrefix(), properties.getExternalPrefix());
        return storage;
    }
}
