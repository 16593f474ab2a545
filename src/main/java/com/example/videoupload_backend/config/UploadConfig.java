package com.example.videoupload_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Upload lifecycle settings and the clock used to stamp hand-off events.
 */
@Configuration
@EnableConfigurationProperties(UploadProperties.class)
public class UploadConfig {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
