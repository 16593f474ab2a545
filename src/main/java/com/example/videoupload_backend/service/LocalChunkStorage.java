package com.example.videoupload_backend.service;

import com.example.videoupload_backend.exception.StorageException;
import com.example.videoupload_backend.service.Interfaces.ChunkStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;


public class LocalChunkStorage implements ChunkStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalChunkStorage.class);
    static final String CHUNK_SUFFIX = ".chunk";

    private final Path baseDir;
    private final Path chunkDir;
    private final Path externalDir;

    public LocalChunkStorage(Path baseDir, String chunkPrefix, String externalPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.chunkDir = this.baseDir.resolve(chunkPrefix).normalize();
        this.externalDir = this.baseDir.resolve(externalPrefix).normalize();

        try {
            Files.createDirectories(chunkDir);
            Files.createDirectories(externalDir);
            LOGGER.info("LocalChunkStorage ready. base={}, chunks={}, external={}", this.baseDir, this.chunkDir, this.externalDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolveChunkDirectory(Long videoId) {
        return safeResolve(chunkDir, String.valueOf(videoId));
    }

    @Override
    public Path resolveExternalDirectory(Long videoId) {
        return safeResolve(externalDir, String.valueOf(videoId));
    }

    @Override
    public void storeChunk(Path directory, int index, byte[] bytes) {
        if (index < 0) {
            throw new IllegalArgumentException("chunk index must be >= 0: " + index);
        }
        Path target = chunkPath(directory, index);
        // write to a private sibling first so a concurrent resubmission never leaves a mixed file
        Path tmp = directory.resolve(index + CHUNK_SUFFIX + "." + UUID.randomUUID() + ".part");
        try {
            Files.createDirectories(directory);
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveReplacing(tmp, target);
            LOGGER.debug("Chunk stored path={} bytes={}", target, bytes.length);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Chunk write failed: " + target, e);
        }
    }

    @Override
    public byte[] readChunk(Path directory, int index) {
        Path chunk = chunkPath(directory, index);
        try {
            return Files.readAllBytes(chunk);
        } catch (IOException e) {
            throw new StorageException("Chunk read failed: " + chunk, e);
        }
    }

    @Override
    public boolean allChunksPresent(Path directory, int totalCount) {
        if (!Files.isDirectory(directory)) {
            return false;
        }
        // fewer files than expected means a gap, no need to check every index
        if (countChunkFiles(directory) < totalCount) {
            return false;
        }
        for (int i = 0; i < totalCount; i++) {
            if (!Files.exists(chunkPath(directory, i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<Integer> findMissingChunks(Path directory, int totalCount, int limit) {
        List<Integer> missing = new ArrayList<>();
        boolean dirExists = Files.isDirectory(directory);
        for (int i = 0; i < totalCount && missing.size() < limit; i++) {
            if (!dirExists || !Files.exists(chunkPath(directory, i))) {
                missing.add(i);
            }
        }
        return missing;
    }

    @Override
    public void clearChunks(Path directory) {
        if (!Files.isDirectory(directory)) {
            return;
        }
        int deleted = 0;
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String name = entry.getFileName().toString();
                if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)
                        && (name.endsWith(CHUNK_SUFFIX) || name.endsWith(".part"))) {
                    Files.delete(entry);
                    deleted++;
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot clear chunk directory " + directory, e);
        }
        LOGGER.info("Chunks cleared dir={} deleted={}", directory, deleted);
    }

    @Override
    public RelocationResult relocate(Path sourceDir, Path destDir) {
        if (!Files.isDirectory(sourceDir)) {
            LOGGER.warn("Relocation source missing source={} dest={}", sourceDir, destDir);
            return RelocationResult.empty();
        }
        try {
            Files.createDirectories(destDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create relocation target " + destDir, e);
        }

        List<String> moved = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        try (Stream<Path> entries = Files.list(sourceDir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String name = entry.getFileName().toString();
                if (!Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    LOGGER.warn("Relocation skipped {}: not a regular file", entry);
                    skipped.add(name);
                    continue;
                }
                try {
                    Files.move(entry, destDir.resolve(name), REPLACE_EXISTING);
                    moved.add(name);
                    LOGGER.debug("Relocated {} -> {}", entry, destDir);
                } catch (IOException | RuntimeException e) {
                    LOGGER.warn("Relocation failed file={} dest={} err={}", entry, destDir, e.toString());
                    failed.add(name);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list relocation source " + sourceDir, e);
        }

        LOGGER.info("Relocation done source={} dest={} moved={} failed={} skipped={}",
                sourceDir, destDir, moved.size(), failed.size(), skipped.size());
        return new RelocationResult(moved, failed, skipped);
    }

    @Override public Path chunkRoot() { return chunkDir; }
    @Override public Path externalRoot() { return externalDir; }

    private long countChunkFiles(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(p -> p.getFileName().toString().endsWith(CHUNK_SUFFIX)).count();
        } catch (IOException e) {
            throw new StorageException("Cannot list chunk directory " + directory, e);
        }
    }

    private Path chunkPath(Path directory, int index) {
        return directory.resolve(index + CHUNK_SUFFIX);
    }

    private Path safeResolve(Path root, String key) {
        if (key == null || key.isBlank() || "null".equals(key)) {
            throw new StorageException("storage key is blank");
        }
        Path p = root.resolve(key.replace('\\', '/').replaceAll("^/+", "")).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid storage key (path traversal?): " + key);
        }
        return p;
    }

    private void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("Could not remove partial chunk path={} err={}", p, e.toString());
        }
    }
}
