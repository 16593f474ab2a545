package com.example.videoupload_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@EnableAsync
@SpringBootApplication
public class VideoUploadBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(VideoUploadBackendApplication.class, args);
	}

}
