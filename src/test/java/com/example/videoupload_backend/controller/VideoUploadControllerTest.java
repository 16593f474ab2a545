package com.example.videoupload_backend.controller;

import com.example.videoupload_backend.config.UploadConfig;
import com.example.videoupload_backend.dto.web.UploadStatusResponse;
import com.example.videoupload_backend.exception.ChunkTooLargeException;
import com.example.videoupload_backend.exception.IncompleteChunkSetException;
import com.example.videoupload_backend.exception.UploadInProgressConflictException;
import com.example.videoupload_backend.exception.UploadNotStartedException;
import com.example.videoupload_backend.exception.VideoNotFoundException;
import com.example.videoupload_backend.service.Interfaces.ChunkStorage.RelocationResult;
import com.example.videoupload_backend.service.UploadLifecycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = VideoUploadController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(UploadConfig.class)
class VideoUploadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UploadLifecycleService lifecycleService;

    @Test
    void chunkIsHandedToLifecycleAndAnswersNoContent() throws Exception {
        byte[] bytes = {1, 2, 3};

        mockMvc.perform(multipart("/v1/videos/42/upload")
                        .file(chunk(bytes))
                        .param("chunkIndex", "2"))
                .andExpect(status().isNoContent());

        verify(lifecycleService).submitChunk(42L, 2, bytes);
    }

    @Test
    void oversizedPartIsRejectedWithoutReachingTheLifecycle() throws Exception {
        mockMvc.perform(multipart("/v1/videos/42/upload")
                        .file(chunk(new byte[2 * 1024 * 1024]))
                        .param("chunkIndex", "0"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.code").value("CHUNK_TOO_LARGE"));

        verify(lifecycleService, never()).submitChunk(anyLong(), anyInt(), any());
    }

    @Test
    void chunkTooLargeFromLifecycleMapsTo413() throws Exception {
        doThrow(new ChunkTooLargeException(5, 4)).when(lifecycleService).submitChunk(eq(42L), eq(0), any());

        mockMvc.perform(multipart("/v1/videos/42/upload")
                        .file(chunk(new byte[]{1}))
                        .param("chunkIndex", "0"))
                .andExpect(status().isPayloadTooLarge());
    }

    @Test
    void chunkDuringProcessingIsAConflict() throws Exception {
        doThrow(new UploadInProgressConflictException(42L, "An upload is already in progress."))
                .when(lifecycleService).submitChunk(eq(42L), eq(0), any());

        mockMvc.perform(multipart("/v1/videos/42/upload")
                        .file(chunk(new byte[]{1}))
                        .param("chunkIndex", "0"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("UPLOAD_IN_PROGRESS"))
                .andExpect(jsonPath("$.message").value("An upload is already in progress."));
    }

    @Test
    void chunkForUnknownVideoIsNotFound() throws Exception {
        doThrow(new VideoNotFoundException(404L)).when(lifecycleService).submitChunk(eq(404L), eq(0), any());

        mockMvc.perform(multipart("/v1/videos/404/upload")
                        .file(chunk(new byte[]{1}))
                        .param("chunkIndex", "0"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("VIDEO_NOT_FOUND"));
    }

    @Test
    void missingChunkIndexIsABadRequest() throws Exception {
        mockMvc.perform(multipart("/v1/videos/42/upload").file(chunk(new byte[]{1})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_UPLOAD_REQUEST"));
    }

    @Test
    void finishWithMissingChunksListsThem() throws Exception {
        doThrow(new IncompleteChunkSetException(42L, 3, List.of(1)))
                .when(lifecycleService).finalizeUpload(42L, 3);

        mockMvc.perform(post("/v1/videos/42/upload/finish")
                        .param("fileName", "movie.mp4")
                        .param("totalChunks", "3"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INCOMPLETE_CHUNK_SET"))
                .andExpect(jsonPath("$.missingChunks[0]").value(1));
    }

    @Test
    void finishWithoutUploadIsNotFound() throws Exception {
        doThrow(new UploadNotStartedException(999L)).when(lifecycleService).finalizeUpload(999L, 3);

        mockMvc.perform(post("/v1/videos/999/upload/finish")
                        .param("fileName", "movie.mp4")
                        .param("totalChunks", "3"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UPLOAD_NOT_STARTED"));
    }

    @Test
    void finishRejectsBlankFileName() throws Exception {
        mockMvc.perform(post("/v1/videos/42/upload/finish")
                        .param("fileName", " ")
                        .param("totalChunks", "3"))
                .andExpect(status().isBadRequest());

        verify(lifecycleService, never()).finalizeUpload(anyLong(), anyInt());
    }

    @Test
    void finishSucceedsWithNoContent() throws Exception {
        mockMvc.perform(post("/v1/videos/42/upload/finish")
                        .param("fileName", "movie.mp4")
                        .param("totalChunks", "2"))
                .andExpect(status().isNoContent());

        verify(lifecycleService).finalizeUpload(42L, 2);
    }

    @Test
    void promoteReturnsRelocationOutcome() throws Exception {
        when(lifecycleService.promoteToExternalStorage(42L))
                .thenReturn(new RelocationResult(List.of("0.chunk"), List.of("1.chunk"), List.of()));

        mockMvc.perform(post("/v1/videos/42/upload/promote"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videoId").value(42))
                .andExpect(jsonPath("$.moved[0]").value("0.chunk"))
                .andExpect(jsonPath("$.failed[0]").value("1.chunk"));
    }

    @Test
    void processedPathIsValidated() throws Exception {
        mockMvc.perform(post("/v1/videos/42/upload/processed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"videoPath\":\"\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/v1/videos/42/upload/processed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"videoPath\":\"/cdn/42.mp4\"}"))
                .andExpect(status().isNoContent());

        verify(lifecycleService).registerProcessedPath(42L, "/cdn/42.mp4");
    }

    @Test
    void statusIsReturnedAsJson() throws Exception {
        when(lifecycleService.getUploadStatus(42L)).thenReturn(
                new UploadStatusResponse(42L, "UPLOAD_IN_PROGRESS", "/data/chunks/42", Instant.parse("2024-01-01T00:00:00Z")));

        mockMvc.perform(get("/v1/videos/42/upload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UPLOAD_IN_PROGRESS"))
                .andExpect(jsonPath("$.videoPath").value("/data/chunks/42"));
    }

    private static MockMultipartFile chunk(byte[] bytes) {
        return new MockMultipartFile("chunk", "chunk.bin", MediaType.APPLICATION_OCTET_STREAM_VALUE, bytes);
    }
}
