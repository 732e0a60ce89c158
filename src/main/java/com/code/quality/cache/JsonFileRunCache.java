package com.code.quality.cache;

import com.code.quality.error.CacheException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Run cache persisted as one {@code <key>.json} file per entry, so cached runs survive a restart.
 * Entries are written to a temporary file and moved into place, so a reader never sees a
 * half-written entry.
 */
public class JsonFileRunCache implements RunCache {
    private static final Logger log = LoggerFactory.getLogger(JsonFileRunCache.class);

    private static final Pattern KEY_PATTERN = Pattern.compile("[0-9a-f]{64}");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileRunCache(Path directory) {
        this.directory = directory;
        this.objectMapper = CacheJson.storageMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheException("Failed to create run cache directory: " + directory, e);
        }
        log.info("JsonFileRunCache initialized: directory={}", directory);
    }

    @Override
    public Optional<RunCacheEntry> get(String key) {
        Path entryPath = entryPath(key);
        if (!Files.exists(entryPath)) {
            return Optional.empty();
        }
        RunCacheEntry entry;
        try {
            entry = objectMapper.readValue(Files.readAllBytes(entryPath), RunCacheEntry.class);
        } catch (IOException | RuntimeException e) {
            throw new CacheException("Unreadable run cache entry " + key, e);
        }
        if (entry == null || !key.equals(entry.key())) {
            throw new CacheException("Run cache entry " + key + " does not match its key");
        }
        return Optional.of(entry);
    }

    @Override
    public void put(RunCacheEntry entry) {
        Path entryPath = entryPath(entry.key());
        Path tempPath = entryPath.resolveSibling(entryPath.getFileName() + ".tmp");
        try {
            Files.write(tempPath, objectMapper.writeValueAsBytes(entry));
            try {
                Files.move(tempPath, entryPath,
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempPath, entryPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tempPath);
            throw new CacheException("Failed to persist run cache entry " + entry.key(), e);
        }
    }

    @Override
    public void remove(String key) {
        deleteQuietly(entryPath(key));
    }

    /**
     * Removes entries cached before {@code cutoff}. Unreadable entries are removed as well.
     */
    @Override
    public int expireBefore(Instant cutoff) {
        int removed = 0;
        for (Path file : entryFiles()) {
            boolean expired;
            try {
                RunCacheEntry entry = objectMapper.readValue(Files.readAllBytes(file), RunCacheEntry.class);
                expired = entry == null || entry.cachedAt().isBefore(cutoff);
            } catch (IOException | RuntimeException e) {
                log.warn("Removing unreadable run cache entry {}: {}", file.getFileName(), e.getMessage());
                expired = true;
            }
            if (expired && deleteQuietly(file)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clear() {
        entryFiles().forEach(JsonFileRunCache::deleteQuietly);
    }

    @Override
    public long size() {
        return entryFiles().size();
    }

    private List<Path> entryFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new CacheException("Failed to list run cache directory " + directory, e);
        }
        return files;
    }

    private Path entryPath(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid run cache key: " + key);
        }
        return directory.resolve(key + SUFFIX);
    }

    private static boolean deleteQuietly(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
            return false;
        }
    }
}
