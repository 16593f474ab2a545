package com.example.videoupload_backend.controller;

import com.example.videoupload_backend.exception.ErrorCode;
import com.example.videoupload_backend.exception.IncompleteChunkSetException;
import com.example.videoupload_backend.exception.StorageException;
import com.example.videoupload_backend.exception.UploadException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps upload failures to JSON error bodies with a stable {@code code}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex, HttpServletRequest request) {
        LOGGER.error("Storage failure path={} msg={}", request.getRequestURI(), ex.getMessage(), ex);
        return build(ex.getCode(), "Storage failure", request);
    }

    @ExceptionHandler(IncompleteChunkSetException.class)
    public ResponseEntity<Map<String, Object>> handleIncomplete(IncompleteChunkSetException ex, HttpServletRequest request) {
        LOGGER.warn("Upload rejected path={} code={} msg={}", request.getRequestURI(), ex.getCode(), ex.getMessage());
        ResponseEntity<Map<String, Object>> response = build(ex.getCode(), ex.getMessage(), request);
        response.getBody().put("missingChunks", ex.getMissingIndices());
        return response;
    }

    @ExceptionHandler(UploadException.class)
    public ResponseEntity<Map<String, Object>> handleUpload(UploadException ex, HttpServletRequest request) {
        LOGGER.warn("Upload rejected path={} code={} msg={}", request.getRequestURI(), ex.getCode(), ex.getMessage());
        return build(ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUpload(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        LOGGER.warn("Multipart too large path={} msg={}", request.getRequestURI(), ex.getMessage());
        return build(ErrorCode.CHUNK_TOO_LARGE, "Chunk exceeds the multipart limit", request);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            MethodArgumentNotValidException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        LOGGER.warn("Invalid upload request path={} msg={}", request.getRequestURI(), ex.getMessage());
        return build(ErrorCode.INVALID_UPLOAD_REQUEST, ex.getMessage(), request);
    }

    private ResponseEntity<Map<String, Object>> build(ErrorCode code, String message, HttpServletRequest request) {
        HttpStatus status = code.getStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", code.name());
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return new ResponseEntity<>(body, status);
    }
}
