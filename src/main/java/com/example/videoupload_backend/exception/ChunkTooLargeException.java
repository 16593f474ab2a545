package com.example.videoupload_backend.exception;

public class ChunkTooLargeException extends UploadValidationException {
    private final long size;
    private final long maxSize;

    public ChunkTooLargeException(long size, long maxSize) {
        super(ErrorCode.CHUNK_TOO_LARGE, "Chunk of " + size + " bytes exceeds the limit of " + maxSize + " bytes");
        this.size = size;
        this.maxSize = maxSize;
    }

    public long getSize() {
        return size;
    }

    public long getMaxSize() {
        return maxSize;
    }
}
