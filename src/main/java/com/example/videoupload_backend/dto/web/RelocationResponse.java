package com.example.videoupload_backend.dto.web;

import java.util.List;

public record RelocationResponse(Long videoId, List<String> moved, List<String> failed, List<String> skipped) {}
