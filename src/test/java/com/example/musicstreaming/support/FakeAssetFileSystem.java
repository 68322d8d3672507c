package com.example.musicstreaming.support;

import com.example.musicstreaming.infrastructure.storage.AssetFileSystem;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory file system whose files can be scheduled to appear at a given clock time.
 */
public final class FakeAssetFileSystem implements AssetFileSystem {

    private final Clock clock;
    private final Map<Path, Long> visibleFromMs = new ConcurrentHashMap<>();
    private final Map<Path, String> contents = new ConcurrentHashMap<>();
    private final Map<Path, AtomicInteger> existsCalls = new ConcurrentHashMap<>();
    private final AtomicInteger readCalls = new AtomicInteger();

    public FakeAssetFileSystem(Clock clock) {
        this.clock = clock;
    }

    public void put(String path) {
        visibleFromMs.put(key(path), Long.MIN_VALUE);
    }

    public void put(String path, String content) {
        put(path);
        contents.put(key(path), content);
    }

    public void putAt(String path, long visibleFromEpochMs) {
        visibleFromMs.put(key(path), visibleFromEpochMs);
    }

    public void putAt(String path, String content, long visibleFromEpochMs) {
        putAt(path, visibleFromEpochMs);
        contents.put(key(path), content);
    }

    public void delete(String path) {
        visibleFromMs.remove(key(path));
        contents.remove(key(path));
    }

    @Override
    public boolean exists(Path path) {
        Path normalized = normalize(path);
        existsCalls.computeIfAbsent(normalized, ignored -> new AtomicInteger()).incrementAndGet();
        return isVisible(normalized);
    }

    @Override
    public String readString(Path path) throws IOException {
        readCalls.incrementAndGet();
        Path normalized = normalize(path);
        if (!isVisible(normalized)) {
            throw new NoSuchFileException(path.toString());
        }
        return contents.getOrDefault(normalized, "");
    }

    public int existsCallCount(String path) {
        AtomicInteger count = existsCalls.get(key(path));
        return count == null ? 0 : count.get();
    }

    public int readCallCount() {
        return readCalls.get();
    }

    private boolean isVisible(Path path) {
        Long visibleFrom = visibleFromMs.get(path);
        return visibleFrom != null && clock.millis() >= visibleFrom;
    }

    private static Path key(String path) {
        return normalize(Paths.get(path));
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
