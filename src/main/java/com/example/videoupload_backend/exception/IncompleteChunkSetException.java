package com.example.videoupload_backend.exception;

import java.util.List;

public class IncompleteChunkSetException extends UploadValidationException {
    private final Long videoId;
    private final List<Integer> missingIndices;

    public IncompleteChunkSetException(Long videoId, int totalChunks, List<Integer> missingIndices) {
        super(ErrorCode.INCOMPLETE_CHUNK_SET,
                "Chunks are invalid for video " + videoId + ": expected " + totalChunks
                        + ", missing " + describe(missingIndices));
        this.videoId = videoId;
        this.missingIndices = List.copyOf(missingIndices);
    }

    public Long getVideoId() {
        return videoId;
    }

    public List<Integer> getMissingIndices() {
        return missingIndices;
    }

    private static String describe(List<Integer> missing) {
        if (missing.size() <= 10) {
            return missing.toString();
        }
        return missing.subList(0, 10) + " and " + (missing.size() - 10) + " more";
    }
}
