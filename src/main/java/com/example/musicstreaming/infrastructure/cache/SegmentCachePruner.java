package com.example.musicstreaming.infrastructure.cache;

import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.infrastructure.dash.DashBuildEngine;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evicts built DASH assets, oldest first, once the cache grows past its size limit.
 * <p>
 * An asset is only evicted when it is older than the minimum age, no live session references it and no
 * build for it is running in this process.
 */
@Component
public class SegmentCachePruner {

    private static final Logger log = LoggerFactory.getLogger(SegmentCachePruner.class);

    private static final double BYTES_PER_GB = 1024D * 1024D * 1024D;
    static final String ASSET_DIRECTORY = "segmented-dash";

    private final AppStreamingProperties streamingProperties;
    private final SegmentCacheReferenceTracker referenceTracker;
    private final DashBuildEngine buildEngine;
    private final Clock clock;

    public SegmentCachePruner(AppStreamingProperties streamingProperties,
                              SegmentCacheReferenceTracker referenceTracker,
                              DashBuildEngine buildEngine,
                              Clock clock) {
        this.streamingProperties = streamingProperties;
        this.referenceTracker = referenceTracker;
        this.buildEngine = buildEngine;
        this.clock = clock;
    }

    public PruneResult prune() {
        Path assetRoot = Paths.get(streamingProperties.getCacheRoot()).toAbsolutePath().normalize()
                .resolve(ASSET_DIRECTORY);
        if (!Files.isDirectory(assetRoot)) {
            return new PruneResult(0, 0L, 0L);
        }

        List<CacheEntry> entries = listEntries(assetRoot);
        long totalBytes = entries.stream().mapToLong(entry -> entry.sizeBytes).sum();
        long maxBytes = (long) (streamingProperties.getCacheMaxGb() * BYTES_PER_GB);
        if (totalBytes <= maxBytes) {
            return new PruneResult(0, 0L, totalBytes);
        }

        long targetBytes = (long) (maxBytes * streamingProperties.getCachePruneTargetRatio());
        long oldestAllowedMs = clock.millis() - streamingProperties.getCachePruneMinAgeMs();
        List<CacheEntry> candidates = entries.stream()
                .sorted(Comparator.comparingLong(entry -> entry.lastModifiedMs))
                .collect(Collectors.toList());

        int removed = 0;
        long freedBytes = 0L;
        for (CacheEntry entry : candidates) {
            if (totalBytes - freedBytes <= targetBytes) {
                break;
            }
            if (entry.lastModifiedMs > oldestAllowedMs
                    || referenceTracker.hasActiveReferences(entry.cacheKey)
                    || buildEngine.hasInFlightBuild(entry.cacheKey)) {
                continue;
            }
            try {
                deleteRecursively(entry.directory);
                removed++;
                freedBytes += entry.sizeBytes;
            } catch (IOException | UncheckedIOException e) {
                log.warn("SEGMENT_CACHE_PRUNE_ENTRY_FAILED cacheKey={} error={}", entry.cacheKey, e.getMessage());
            }
        }
        log.info("SEGMENT_CACHE_PRUNED removed={} freedBytes={} totalBytes={} maxBytes={}",
                removed, freedBytes, totalBytes, maxBytes);
        return new PruneResult(removed, freedBytes, totalBytes - freedBytes);
    }

    private List<CacheEntry> listEntries(Path assetRoot) {
        List<CacheEntry> entries = new ArrayList<>();
        try (Stream<Path> directories = Files.list(assetRoot)) {
            for (Path directory : directories.filter(Files::isDirectory).collect(Collectors.toList())) {
                entries.add(describe(directory));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list segment cache " + assetRoot, e);
        }
        return entries;
    }

    private CacheEntry describe(Path directory) throws IOException {
        long sizeBytes = 0L;
        long lastModifiedMs = Files.getLastModifiedTime(directory).toMillis();
        try (Stream<Path> files = Files.walk(directory)) {
            for (Path file : files.filter(Files::isRegularFile).collect(Collectors.toList())) {
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                sizeBytes += attributes.size();
                lastModifiedMs = Math.max(lastModifiedMs, attributes.lastModifiedTime().toMillis());
            }
        }
        return new CacheEntry(directory.getFileName().toString(), directory, sizeBytes, lastModifiedMs);
    }

    private void deleteRecursively(Path directory) throws IOException {
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class CacheEntry {
        private final String cacheKey;
        private final Path directory;
        private final long sizeBytes;
        private final long lastModifiedMs;

        private CacheEntry(String cacheKey, Path directory, long sizeBytes, long lastModifiedMs) {
            this.cacheKey = cacheKey;
            this.directory = directory;
            this.sizeBytes = sizeBytes;
            this.lastModifiedMs = lastModifiedMs;
        }
    }

    public static final class PruneResult {
        private final int removedEntries;
        private final long freedBytes;
        private final long remainingBytes;

        PruneResult(int removedEntries, long freedBytes, long remainingBytes) {
            this.removedEntries = removedEntries;
            this.freedBytes = freedBytes;
            this.remainingBytes = remainingBytes;
        }

        public int getRemovedEntries() {
            return removedEntries;
        }

        public long getFreedBytes() {
            return freedBytes;
        }

        public long getRemainingBytes() {
            return remainingBytes;
        }

        @Override
        public String toString() {
            return "PruneResult{removedEntries=" + removedEntries + ", freedBytes=" + freedBytes
                    + ", remainingBytes=" + remainingBytes + "}";
        }
    }
}
