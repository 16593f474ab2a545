package com.example.videoupload_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProcessedPathRequest(@NotBlank @Size(max = 1024) String videoPath) {}
