package com.example.videoupload_backend.service.Interfaces;

import java.nio.file.Path;
import java.util.List;

public interface ChunkStorage {

    /** Default directory that receives the chunks of a video while it is uploading. */
    Path resolveChunkDirectory(Long videoId);

    /** Long-term location a finished chunk set is promoted to. */
    Path resolveExternalDirectory(Long videoId);

    /**
     * Writes one chunk as {@code <index>.chunk}, creating the directory when needed.
     * A chunk already stored at the same index is replaced as a whole.
     */
    void storeChunk(Path directory, int index, byte[] bytes);

    byte[] readChunk(Path directory, int index);

    /** True iff a chunk exists for every index in {@code [0, totalCount)}; false for a missing directory. */
    boolean allChunksPresent(Path directory, int totalCount);

    /** Missing indices in {@code [0, totalCount)}, ascending, at most {@code limit} of them. */
    List<Integer> findMissingChunks(Path directory, int totalCount, int limit);

    /** Deletes the chunk files (and leftover partial writes) of a directory; the directory stays. */
    void clearChunks(Path directory);

    /**
     * Moves every regular file from {@code sourceDir} into {@code destDir}. Best effort: a file
     * that cannot be moved is logged and skipped, the rest of the batch still runs.
     */
    RelocationResult relocate(Path sourceDir, Path destDir);

    Path chunkRoot();
    Path externalRoot();

    record RelocationResult(List<String> moved, List<String> failed, List<String> skipped) {
        public RelocationResult {
            moved = List.copyOf(moved);
            failed = List.copyOf(failed);
            skipped = List.copyOf(skipped);
        }

        public static RelocationResult empty() {
            return new RelocationResult(List.of(), List.of(), List.of());
        }

        public boolean hasFailures() {
            return !failed.isEmpty();
        }
    }
}
