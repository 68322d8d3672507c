package com.example.musicstreaming.infrastructure.dash;

import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.common.util.HashUtil;
import com.example.musicstreaming.common.util.InFlightCoalescer;
import com.example.musicstreaming.domain.model.BuildFailure;
import com.example.musicstreaming.domain.model.BuildInFlightStatus;
import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.DashAssetRequest;
import com.example.musicstreaming.infrastructure.lock.DashBuildLock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Builds DASH assets into {@code <cacheRoot>/segmented-dash/<cacheKey>/} on the build executor.
 * <p>
 * At most one build per cache key runs in this process; across pods the {@link DashBuildLock} decides
 * who builds. Terminal failures are remembered for {@code buildFailureTtlMs} so readiness waits can fail
 * fast instead of polling into their deadline.
 */
@Component
public class LocalDashBuildEngine implements DashBuildEngine {

    private static final Logger log = LoggerFactory.getLogger(LocalDashBuildEngine.class);

    static final String ASSET_DIRECTORY = "segmented-dash";
    static final String MANIFEST_FILE_NAME = "manifest.mpd";
    private static final int CACHE_KEY_LENGTH = 24;

    private final AppStreamingProperties streamingProperties;
    private final DashSegmentGenerator segmentGenerator;
    private final DashBuildLock buildLock;
    private final Executor buildExecutor;
    private final Clock clock;

    private final ConcurrentMap<String, CompletableFuture<DashAsset>> inFlightBuilds = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BuildFailure> buildFailures = new ConcurrentHashMap<>();
    private final Set<String> invalidCacheKeys = ConcurrentHashMap.newKeySet();

    @Autowired
    public LocalDashBuildEngine(AppStreamingProperties streamingProperties,
                                DashSegmentGenerator segmentGenerator,
                                DashBuildLock buildLock,
                                @Qualifier("dashBuildExecutor") ExecutorService buildExecutor,
                                Clock clock) {
        this(streamingProperties, segmentGenerator, buildLock, (Executor) buildExecutor, clock);
    }

    LocalDashBuildEngine(AppStreamingProperties streamingProperties,
                         DashSegmentGenerator segmentGenerator,
                         DashBuildLock buildLock,
                         Executor buildExecutor,
                         Clock clock) {
        this.streamingProperties = streamingProperties;
        this.segmentGenerator = segmentGenerator;
        this.buildLock = buildLock;
        this.buildExecutor = buildExecutor;
        this.clock = clock;
    }

    @Override
    public DashAsset ensureLocalDashSegments(DashAssetRequest request) {
        DashAsset asset = resolveAsset(request);
        String cacheKey = asset.getCacheKey();
        if (inFlightBuilds.containsKey(cacheKey)) {
            return asset;
        }
        if (!invalidCacheKeys.contains(cacheKey) && Files.isRegularFile(Paths.get(asset.getManifestPath()))) {
            return asset;
        }
        if (buildLock.isHeld(cacheKey)) {
            log.debug("DASH_BUILD_REMOTE_IN_FLIGHT cacheKey={} trackId={}", cacheKey, request.getTrackId());
            return asset;
        }
        startBuild(request, asset, false);
        return asset;
    }

    @Override
    public boolean hasInFlightBuild(String cacheKey) {
        return inFlightBuilds.containsKey(cacheKey);
    }

    @Override
    public BuildInFlightStatus getBuildInFlightStatus(String cacheKey) {
        if (inFlightBuilds.containsKey(cacheKey)) {
            return BuildInFlightStatus.of(true, false);
        }
        return BuildInFlightStatus.of(false, buildLock.isHeld(cacheKey));
    }

    @Override
    public BuildFailure getBuildFailure(String cacheKey) {
        BuildFailure failure = buildFailures.get(cacheKey);
        if (failure == null) {
            return null;
        }
        if (clock.millis() - failure.getFailedAtEpochMs() >= streamingProperties.getBuildFailureTtlMs()) {
            buildFailures.remove(cacheKey, failure);
            return null;
        }
        return failure;
    }

    @Override
    public boolean isCacheMarkedInvalid(String cacheKey) {
        return invalidCacheKeys.contains(cacheKey);
    }

    @Override
    public void forceRegenerateDashSegments(DashAssetRequest request) {
        DashAsset asset = resolveAsset(request);
        String cacheKey = asset.getCacheKey();
        if (inFlightBuilds.containsKey(cacheKey)) {
            log.info("DASH_REGENERATE_SKIPPED cacheKey={} trackId={} reason=build_in_flight",
                    cacheKey, request.getTrackId());
            return;
        }
        invalidCacheKeys.add(cacheKey);
        buildFailures.remove(cacheKey);
        log.info("DASH_REGENERATE_START cacheKey={} trackId={}", cacheKey, request.getTrackId());
        try {
            startBuild(request, asset, true).join();
        } catch (CompletionException e) {
            Throwable cause = InFlightCoalescer.unwrap(e);
            if (cause instanceof DashBuildException) {
                throw (DashBuildException) cause;
            }
            throw new DashBuildException("DASH regeneration failed: " + cause.getMessage(), cause);
        }
    }

    public String buildCacheKey(DashAssetRequest request) {
        String sourceIdentity = request.getTrackId() + ":" + request.getSourcePath() + ":"
                + request.getSourceModified();
        String renditionIdentity = request.getQuality().getValue() + ":"
                + request.getManifestProfile().getValue() + ":" + streamingProperties.getCacheSchemaVersion();
        return HashUtil.sha256Hex(sourceIdentity + "|" + renditionIdentity).substring(0, CACHE_KEY_LENGTH);
    }

    public DashAsset resolveAsset(DashAssetRequest request) {
        String cacheKey = buildCacheKey(request);
        Path outputDir = assetRoot().resolve(cacheKey);
        return new DashAsset(
                cacheKey,
                outputDir.toString(),
                outputDir.resolve(MANIFEST_FILE_NAME).toString(),
                request.getQuality(),
                request.getManifestProfile());
    }

    Path assetRoot() {
        return Paths.get(streamingProperties.getCacheRoot()).toAbsolutePath().normalize().resolve(ASSET_DIRECTORY);
    }

    private CompletableFuture<DashAsset> startBuild(DashAssetRequest request, DashAsset asset, boolean purgeExisting) {
        return InFlightCoalescer.coalesce(inFlightBuilds, asset.getCacheKey(),
                () -> CompletableFuture.supplyAsync(() -> runBuild(request, asset, purgeExisting), buildExecutor));
    }

    private DashAsset runBuild(DashAssetRequest request, DashAsset asset, boolean purgeExisting) {
        String cacheKey = asset.getCacheKey();
        String lockToken = buildLock.tryAcquire(cacheKey);
        if (lockToken == null) {
            log.info("DASH_BUILD_DEFERRED cacheKey={} trackId={} reason=lock_held_elsewhere",
                    cacheKey, request.getTrackId());
            return asset;
        }
        long startedAt = clock.millis();
        try {
            if (purgeExisting) {
                deleteDirectory(Paths.get(asset.getOutputDir()));
            }
            segmentGenerator.generate(request, asset);
            buildFailures.remove(cacheKey);
            invalidCacheKeys.remove(cacheKey);
            log.info("DASH_BUILD_SUCCESS cacheKey={} trackId={} quality={} costMs={}",
                    cacheKey, request.getTrackId(), request.getQuality().getValue(), clock.millis() - startedAt);
            return asset;
        } catch (RuntimeException e) {
            buildFailures.put(cacheKey, new BuildFailure(e.getMessage(), clock.millis()));
            log.error("DASH_BUILD_FAILED cacheKey={} trackId={} quality={} error={}",
                    cacheKey, request.getTrackId(), request.getQuality().getValue(), e.getMessage(), e);
            throw e;
        } finally {
            buildLock.release(cacheKey, lockToken);
        }
    }

    private void deleteDirectory(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new DashBuildException("Cannot delete stale DASH asset " + path, e);
                }
            });
        } catch (IOException e) {
            throw new DashBuildException("Cannot list stale DASH assets in " + directory, e);
        }
    }
}
