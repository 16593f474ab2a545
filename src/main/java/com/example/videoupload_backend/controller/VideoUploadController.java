package com.example.videoupload_backend.controller;

import com.example.videoupload_backend.config.UploadProperties;
import com.example.videoupload_backend.dto.web.ProcessedPathRequest;
import com.example.videoupload_backend.dto.web.RelocationResponse;
import com.example.videoupload_backend.dto.web.UploadStatusResponse;
import com.example.videoupload_backend.exception.ChunkTooLargeException;
import com.example.videoupload_backend.exception.UploadValidationException;
import com.example.videoupload_backend.service.UploadLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/v1/videos/{videoId}/upload")
public class VideoUploadController {
    private static final int MAX_FILE_NAME_LENGTH = 255;

    private final UploadLifecycleService lifecycleService;
    private final UploadProperties uploadProperties;

    public VideoUploadController(UploadLifecycleService lifecycleService, UploadProperties uploadProperties) {
        this.lifecycleService = lifecycleService;
        this.uploadProperties = uploadProperties;
    }

    @Operation(summary = "Store one chunk of a video upload")
    @ApiResponse(responseCode = "204", description = "Chunk stored")
    @ApiResponse(responseCode = "404", description = "Video not found")
    @ApiResponse(responseCode = "409", description = "Finalized upload is still being processed")
    @ApiResponse(responseCode = "413", description = "Chunk exceeds the configured limit")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void uploadChunk(@PathVariable Long videoId,
                            @RequestParam("chunkIndex") int chunkIndex,
                            @RequestPart("chunk") MultipartFile chunk) throws IOException {
        long max = uploadProperties.getMaxChunkSize().toBytes();
        // reject before the part is read into memory
        if (chunk.getSize() > max) {
            throw new ChunkTooLargeException(chunk.getSize(), max);
        }
        lifecycleService.submitChunk(videoId, chunkIndex, chunk.getBytes());
    }

    @Operation(summary = "Finish a chunked upload and hand it off for processing")
    @ApiResponse(responseCode = "204", description = "Upload finalized")
    @ApiResponse(responseCode = "400", description = "Chunks missing or invalid form")
    @ApiResponse(responseCode = "404", description = "Upload not started")
    @ApiResponse(responseCode = "409", description = "Upload is not in progress")
    @PostMapping("/finish")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void finish(@PathVariable Long videoId,
                       @RequestParam("fileName") String fileName,
                       @RequestParam("totalChunks") int totalChunks) {
        if (fileName.isBlank() || fileName.length() > MAX_FILE_NAME_LENGTH) {
            throw new UploadValidationException("fileName must be 1.." + MAX_FILE_NAME_LENGTH + " characters");
        }
        lifecycleService.finalizeUpload(videoId, totalChunks);
    }

    @Operation(summary = "Move a processed chunk set to external storage")
    @ApiResponse(responseCode = "200", description = "Relocation attempted; failed files are listed")
    @ApiResponse(responseCode = "409", description = "Processing has not started")
    @PostMapping("/promote")
    public RelocationResponse promote(@PathVariable Long videoId) {
        var result = lifecycleService.promoteToExternalStorage(videoId);
        return new RelocationResponse(videoId, result.moved(), result.failed(), result.skipped());
    }

    @Operation(summary = "Register the location of an asset produced by the processor")
    @ApiResponse(responseCode = "204", description = "Path registered, upload finished")
    @ApiResponse(responseCode = "409", description = "Processing has not started")
    @PostMapping("/processed")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void processed(@PathVariable Long videoId, @Valid @RequestBody ProcessedPathRequest request) {
        lifecycleService.registerProcessedPath(videoId, request.videoPath());
    }

    @GetMapping
    public UploadStatusResponse status(@PathVariable Long videoId) {
        return lifecycleService.getUploadStatus(videoId);
    }
}
