package com.example.musicstreaming.infrastructure.dash;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.StreamingQuality;
import com.example.musicstreaming.domain.model.BuildFailure;
import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.DashAssetRequest;
import com.example.musicstreaming.infrastructure.lock.DashBuildLock;
import com.example.musicstreaming.support.DeterministicExecutor;
import com.example.musicstreaming.support.MutableClock;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalDashBuildEngineTest {

    @TempDir
    Path cacheRoot;

    private MutableClock clock;
    private AppStreamingProperties streamingProperties;
    private RecordingGenerator generator;
    private FakeBuildLock buildLock;
    private DeterministicExecutor executor;
    private LocalDashBuildEngine engine;
    private LocalDashBuildEngine currentEngine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        streamingProperties = new AppStreamingProperties();
        streamingProperties.setCacheRoot(cacheRoot.toString());
        streamingProperties.setBuildFailureTtlMs(60_000);
        generator = new RecordingGenerator();
        buildLock = new FakeBuildLock();
        executor = new DeterministicExecutor();
        engine = newEngine(executor);
    }

    @Test
    void shouldDeriveCacheKeyFromSourceAndRendition() {
        DashAssetRequest base = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        String key = engine.buildCacheKey(base);

        assertEquals(24, key.length());
        assertTrue(key.matches("[0-9a-f]+"));
        assertEquals(key, engine.buildCacheKey(request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE)));
        assertNotEquals(key, engine.buildCacheKey(request(StreamingQuality.LOW, DashManifestProfile.STARTUP_SINGLE)));
        assertNotEquals(key, engine.buildCacheKey(request(StreamingQuality.HIGH, DashManifestProfile.STEADY_STATE_DUAL)));
        assertNotEquals(key, engine.buildCacheKey(new DashAssetRequest(7L, "/music/Album/Song.flac",
                Instant.parse("2026-02-01T00:00:00Z"), StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE)));

        streamingProperties.setCacheSchemaVersion("dash-v3");
        assertNotEquals(key, engine.buildCacheKey(base));
    }

    @Test
    void shouldPlaceAssetUnderSegmentedDashDirectory() {
        DashAsset asset = engine.resolveAsset(request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE));

        Path expectedDir = cacheRoot.toAbsolutePath().normalize().resolve("segmented-dash").resolve(asset.getCacheKey());
        assertEquals(expectedDir.toString(), asset.getOutputDir());
        assertEquals(expectedDir.resolve("manifest.mpd").toString(), asset.getManifestPath());
    }

    @Test
    void shouldShareOneBuildAcrossConcurrentEnsureCalls() {
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);

        DashAsset first = engine.ensureLocalDashSegments(request);
        engine.ensureLocalDashSegments(request);

        assertEquals(1, executor.pendingCount());
        assertTrue(engine.hasInFlightBuild(first.getCacheKey()));
        assertTrue(engine.getBuildInFlightStatus(first.getCacheKey()).isLocalInFlight());

        executor.runAll();

        assertEquals(1, generator.calls.size());
        assertFalse(engine.hasInFlightBuild(first.getCacheKey()));
        assertFalse(engine.getBuildInFlightStatus(first.getCacheKey()).isInFlight());
        assertTrue(Files.isRegularFile(Paths.get(first.getManifestPath())));
        assertEquals(0, buildLock.heldKeys.size());

        engine.ensureLocalDashSegments(request);
        assertEquals(0, executor.pendingCount());
    }

    @Test
    void shouldLeaveBuildToPodHoldingLock() {
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        String cacheKey = engine.buildCacheKey(request);
        buildLock.heldElsewhere.add(cacheKey);

        engine.ensureLocalDashSegments(request);

        assertEquals(0, executor.pendingCount());
        assertTrue(engine.getBuildInFlightStatus(cacheKey).isDistributedInFlight());
        assertFalse(engine.getBuildInFlightStatus(cacheKey).isLocalInFlight());
    }

    @Test
    void shouldDeferBuildThatLosesLockRace() {
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        String cacheKey = engine.buildCacheKey(request);
        engine.ensureLocalDashSegments(request);
        buildLock.heldElsewhere.add(cacheKey);

        executor.runAll();

        assertTrue(generator.calls.isEmpty());
        assertNull(engine.getBuildFailure(cacheKey));
    }

    @Test
    void shouldRememberFailedBuildUntilTtlPasses() {
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        generator.failure = new DashBuildException("ffmpeg exited with code 1");

        DashAsset asset = engine.ensureLocalDashSegments(request);
        executor.runAll();

        BuildFailure failure = engine.getBuildFailure(asset.getCacheKey());
        assertNotNull(failure);
        assertEquals("ffmpeg exited with code 1", failure.getMessage());
        assertEquals(0, buildLock.heldKeys.size());

        clock.plusMillis(59_999);
        assertNotNull(engine.getBuildFailure(asset.getCacheKey()));
        clock.plusMillis(1);
        assertNull(engine.getBuildFailure(asset.getCacheKey()));
    }

    @Test
    void shouldClearRecordedFailureAfterSuccessfulRebuild() {
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        generator.failure = new DashBuildException("source unreadable");
        DashAsset asset = engine.ensureLocalDashSegments(request);
        executor.runAll();

        generator.failure = null;
        engine.ensureLocalDashSegments(request);
        executor.runAll();

        assertNull(engine.getBuildFailure(asset.getCacheKey()));
    }

    @Test
    void shouldReplaceExistingAssetOnForceRegenerate() throws IOException {
        LocalDashBuildEngine directEngine = newEngine(Runnable::run);
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        DashAsset asset = directEngine.ensureLocalDashSegments(request);
        Path stale = Paths.get(asset.getOutputDir()).resolve("chunk-0-00099.m4s");
        Files.write(stale, new byte[] {1, 2, 3});

        directEngine.forceRegenerateDashSegments(request);

        assertFalse(Files.exists(stale));
        assertTrue(Files.isRegularFile(Paths.get(asset.getManifestPath())));
        assertEquals(2, generator.calls.size());
        assertEquals(Boolean.TRUE, generator.invalidDuringGenerate.get(1));
        assertFalse(directEngine.isCacheMarkedInvalid(asset.getCacheKey()));
    }

    @Test
    void shouldKeepCacheInvalidWhenForceRegenerateFails() {
        LocalDashBuildEngine directEngine = newEngine(Runnable::run);
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        generator.failure = new DashBuildException("ffmpeg exited with code 1");

        DashBuildException error = assertThrows(DashBuildException.class,
                () -> directEngine.forceRegenerateDashSegments(request));

        String cacheKey = directEngine.buildCacheKey(request);
        assertEquals("ffmpeg exited with code 1", error.getMessage());
        assertTrue(directEngine.isCacheMarkedInvalid(cacheKey));
        assertNotNull(directEngine.getBuildFailure(cacheKey));
    }

    @Test
    void shouldSkipForceRegenerateWhileBuildIsRunning() {
        DashAssetRequest request = request(StreamingQuality.HIGH, DashManifestProfile.STARTUP_SINGLE);
        DashAsset asset = engine.ensureLocalDashSegments(request);

        engine.forceRegenerateDashSegments(request);

        assertFalse(engine.isCacheMarkedInvalid(asset.getCacheKey()));
        assertEquals(1, executor.pendingCount());
    }

    private LocalDashBuildEngine newEngine(Executor buildExecutor) {
        currentEngine = new LocalDashBuildEngine(streamingProperties, generator, buildLock, buildExecutor, clock);
        return currentEngine;
    }

    private DashAssetRequest request(StreamingQuality quality, DashManifestProfile profile) {
        return new DashAssetRequest(7L, "/music/Album/Song.flac", Instant.parse("2026-01-15T10:30:00Z"),
                quality, profile);
    }

    private final class RecordingGenerator implements DashSegmentGenerator {

        private final List<String> calls = new ArrayList<>();
        private final List<Boolean> invalidDuringGenerate = new ArrayList<>();
        private DashBuildException failure;

        @Override
        public void generate(DashAssetRequest request, DashAsset asset) {
            calls.add(asset.getCacheKey());
            invalidDuringGenerate.add(currentEngine.isCacheMarkedInvalid(asset.getCacheKey()));
            if (failure != null) {
                throw failure;
            }
            try {
                Path outputDir = Paths.get(asset.getOutputDir());
                Files.createDirectories(outputDir);
                Files.write(Paths.get(asset.getManifestPath()), "<MPD/>".getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    private static final class FakeBuildLock implements DashBuildLock {

        private final List<String> heldElsewhere = new ArrayList<>();
        private final List<String> heldKeys = new ArrayList<>();

        @Override
        public String tryAcquire(String cacheKey) {
            if (heldElsewhere.contains(cacheKey)) {
                return null;
            }
            heldKeys.add(cacheKey);
            return "token-" + cacheKey;
        }

        @Override
        public void release(String cacheKey, String token) {
            if (("token-" + cacheKey).equals(token)) {
                heldKeys.remove(cacheKey);
            }
        }

        @Override
        public boolean isHeld(String cacheKey) {
            return heldElsewhere.contains(cacheKey);
        }
    }
}
