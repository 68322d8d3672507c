package com.example.musicstreaming.application.service;

import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.common.exception.BusinessException;
import com.example.musicstreaming.common.exception.StreamingErrorCodes;
import com.example.musicstreaming.common.util.InFlightCoalescer;
import com.example.musicstreaming.common.util.Sleeper;
import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.model.BuildFailure;
import com.example.musicstreaming.domain.model.BuildInFlightStatus;
import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.StreamingSession;
import com.example.musicstreaming.domain.model.TrackSource;
import com.example.musicstreaming.infrastructure.dash.DashBuildEngine;
import com.example.musicstreaming.infrastructure.parser.DashManifestParser;
import com.example.musicstreaming.infrastructure.storage.AssetFileSystem;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Decides when a session's manifest and segments are safe to serve.
 * <p>
 * Every wait polls the shared cache volume until the asset is present or an absolute deadline passes.
 * Each poll first checks for a recorded build failure (fail fast), then for the asset itself. When the
 * asset is missing and no build is running anywhere, the wait re-requests the asset once per phase
 * (self-heal). While another pod holds the build lock the wait only polls.
 * <p>
 * Concurrent waits for the same manifest or segment share one poll loop. Manifest content is re-read by
 * every new wait; a positive segment check is remembered briefly. A segment already on disk is answered
 * on the calling thread without entering the wait pool.
 */
@Service
public class AssetReadinessService {

    private static final Logger log = LoggerFactory.getLogger(AssetReadinessService.class);

    static final String ASSET_MANIFEST = "manifest";
    static final String ASSET_STARTUP_WINDOW = "startup_window";
    static final String ASSET_SEGMENT = "segment";

    private static final Pattern SEGMENT_FILE_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+\\.(m4s|webm)$");
    private static final String[] SEGMENT_EXTENSIONS = {".m4s", ".webm"};
    private static final int MICROCACHE_PRUNE_THRESHOLD = 4096;

    private final AppStreamingProperties streamingProperties;
    private final DashBuildEngine buildEngine;
    private final ManifestAssetProvider manifestAssetProvider;
    private final TrackSourceLookup trackSourceLookup;
    private final AssetFileSystem fileSystem;
    private final Executor waitExecutor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<String, CompletableFuture<Void>> inFlightManifestWaits = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<Path>> inFlightSegmentWaits = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> segmentReadyUntil = new ConcurrentHashMap<>();

    @Autowired
    public AssetReadinessService(AppStreamingProperties streamingProperties,
                                 DashBuildEngine buildEngine,
                                 ManifestAssetProvider manifestAssetProvider,
                                 TrackSourceLookup trackSourceLookup,
                                 AssetFileSystem fileSystem,
                                 @Qualifier("assetWaitExecutor") ExecutorService waitExecutor,
                                 Clock clock,
                                 Sleeper sleeper,
                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(streamingProperties, buildEngine, manifestAssetProvider, trackSourceLookup, fileSystem,
                (Executor) waitExecutor, clock, sleeper, meterRegistryProvider.getIfAvailable());
    }

    AssetReadinessService(AppStreamingProperties streamingProperties,
                          DashBuildEngine buildEngine,
                          ManifestAssetProvider manifestAssetProvider,
                          TrackSourceLookup trackSourceLookup,
                          AssetFileSystem fileSystem,
                          Executor waitExecutor,
                          Clock clock,
                          Sleeper sleeper,
                          MeterRegistry meterRegistry) {
        this.streamingProperties = streamingProperties;
        this.buildEngine = buildEngine;
        this.manifestAssetProvider = manifestAssetProvider;
        this.trackSourceLookup = trackSourceLookup;
        this.fileSystem = fileSystem;
        this.waitExecutor = waitExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
    }

    public CompletableFuture<Void> waitForManifestReady(StreamingSession session) {
        return waitForManifestReady(session, clock.millis() + streamingProperties.getAssetReadyTimeoutMs());
    }

    /**
     * Completes once the manifest exists, parses, and every required representation has its startup
     * window on disk. Fails with {@code STREAMING_ASSET_BUILD_FAILED} or {@code STREAMING_ASSET_NOT_READY}.
     *
     * @param deadlineEpochMs absolute deadline of the manifest file phase
     */
    public CompletableFuture<Void> waitForManifestReady(StreamingSession session, long deadlineEpochMs) {
        String traceId = currentTraceId();
        return InFlightCoalescer.coalesce(inFlightManifestWaits, session.getSessionId(),
                () -> submitWait(session, ASSET_MANIFEST, traceId, () -> {
                    awaitManifest(session, deadlineEpochMs, traceId);
                    return null;
                }));
    }

    /**
     * Completes with the segment's path once the file exists.
     *
     * @throws BusinessException synchronously when the segment name is not acceptable
     */
    public CompletableFuture<Path> waitForSegmentReady(StreamingSession session, String segmentName) {
        Path segmentPath = resolveSegmentPath(session, segmentName);
        String key = session.getSessionId() + ":" + segmentName;
        if (isSegmentMicrocached(key)) {
            recordWait(ASSET_SEGMENT, "microcache_hit");
            return CompletableFuture.completedFuture(segmentPath);
        }
        String traceId = currentTraceId();
        BuildFailure failure = buildEngine.getBuildFailure(session.getCacheKey());
        if (failure != null) {
            BusinessException error = buildFailed(failure);
            recordWait(ASSET_SEGMENT, error.getCode());
            log.warn("STREAMING_SEGMENT_WAIT_FAILED sessionId={} cacheKey={} segment={} code={} traceId={}",
                    session.getSessionId(), session.getCacheKey(), segmentName, error.getCode(), traceId);
            return CompletableFuture.failedFuture(error);
        }
        if (fileSystem.exists(segmentPath)) {
            markSegmentReady(key);
            recordWait(ASSET_SEGMENT, "ready");
            return CompletableFuture.completedFuture(segmentPath);
        }
        return InFlightCoalescer.coalesce(inFlightSegmentWaits, key,
                () -> submitWait(session, ASSET_SEGMENT, traceId, () -> {
                    awaitSegment(session, segmentName, segmentPath, traceId);
                    markSegmentReady(key);
                    return segmentPath;
                }));
    }

    /**
     * Joins a segment file name onto the session's asset directory. Both {@code .m4s} and the legacy
     * {@code .webm} extension are accepted.
     */
    public Path resolveSegmentPath(StreamingSession session, String segmentName) {
        if (segmentName == null || !SEGMENT_FILE_PATTERN.matcher(segmentName).matches()) {
            throw new BusinessException(StreamingErrorCodes.INVALID_SEGMENT_NAME, "分片文件名不合法", "请刷新播放器后重试");
        }
        Path assetDir = Paths.get(session.getAssetDir()).toAbsolutePath().normalize();
        Path resolved = assetDir.resolve(segmentName).normalize();
        if (!resolved.startsWith(assetDir) || resolved.equals(assetDir)) {
            throw new BusinessException(StreamingErrorCodes.INVALID_SEGMENT_PATH, "分片路径不合法", "请刷新播放器后重试");
        }
        return resolved;
    }

    private <T> CompletableFuture<T> submitWait(StreamingSession session, String assetType, String traceId,
                                                Supplier<T> wait) {
        try {
            return CompletableFuture.supplyAsync(wait, waitExecutor);
        } catch (RejectedExecutionException e) {
            recordWait(assetType, "rejected");
            log.warn("STREAMING_ASSET_WAIT_REJECTED sessionId={} cacheKey={} asset={} traceId={}",
                    session.getSessionId(), session.getCacheKey(), assetType, traceId);
            return CompletableFuture.failedFuture(new BusinessException(StreamingErrorCodes.ASSET_NOT_READY,
                    "音频分片等待队列已满", "请稍后重试", 503));
        }
    }

    private void markSegmentReady(String key) {
        segmentReadyUntil.put(key, clock.millis() + streamingProperties.getSegmentReadyMicrocacheTtlMs());
    }

    private static BusinessException buildFailed(BuildFailure failure) {
        return new BusinessException(StreamingErrorCodes.ASSET_BUILD_FAILED,
                "音频分片生成失败: " + failure.getMessage(), "请稍后重试", 502);
    }

    private void awaitManifest(StreamingSession session, long deadlineEpochMs, String traceId) {
        Path manifestPath = Paths.get(session.getManifestPath());
        ReadinessPoll poll = new ReadinessPoll(session, traceId);
        String phase = ASSET_MANIFEST;
        try {
            poll.await(ASSET_MANIFEST, deadlineEpochMs, false, () -> fileSystem.exists(manifestPath));

            long startupDeadline = deadlineEpochMs;
            if (poll.selfHealReturnedAt != null) {
                startupDeadline = Math.max(deadlineEpochMs,
                        poll.selfHealReturnedAt + streamingProperties.getAssetReadyTimeoutMs());
            }
            phase = ASSET_STARTUP_WINDOW;
            poll.await(ASSET_STARTUP_WINDOW, startupDeadline, true, () -> isStartupWindowReady(session, manifestPath));
            recordWait(ASSET_MANIFEST, "ready");
        } catch (BusinessException e) {
            recordWait(ASSET_MANIFEST, e.getCode());
            log.warn("STREAMING_MANIFEST_WAIT_FAILED sessionId={} cacheKey={} phase={} code={} traceId={}",
                    session.getSessionId(), session.getCacheKey(), phase, e.getCode(), traceId);
            throw e;
        }
    }

    private void awaitSegment(StreamingSession session, String segmentName, Path segmentPath, String traceId) {
        ReadinessPoll poll = new ReadinessPoll(session, traceId);
        try {
            poll.await(ASSET_SEGMENT, clock.millis() + streamingProperties.getAssetReadyTimeoutMs(), false,
                    () -> fileSystem.exists(segmentPath));
            recordWait(ASSET_SEGMENT, "ready");
        } catch (BusinessException e) {
            recordWait(ASSET_SEGMENT, e.getCode());
            log.warn("STREAMING_SEGMENT_WAIT_FAILED sessionId={} cacheKey={} segment={} code={} traceId={}",
                    session.getSessionId(), session.getCacheKey(), segmentName, e.getCode(), traceId);
            throw e;
        }
    }

    boolean isStartupWindowReady(StreamingSession session, Path manifestPath) throws IOException {
        DashManifestProfile profile = session.getManifestProfile() == null
                ? DashManifestProfile.STARTUP_SINGLE
                : session.getManifestProfile();
        List<String> requiredIds = profile.getRequiredRepresentationIds();

        Map<String, Integer> timelineCounts;
        try {
            timelineCounts = DashManifestParser.countTimelineSegments(fileSystem.readString(manifestPath), requiredIds);
        } catch (DashManifestParser.ManifestParseException e) {
            log.debug("STREAMING_MANIFEST_UNPARSEABLE sessionId={} error={}", session.getSessionId(), e.getMessage());
            return false;
        }

        Path assetDir = Paths.get(session.getAssetDir());
        for (String representationId : requiredIds) {
            Integer declared = timelineCounts.get(representationId);
            if (declared == null || declared < streamingProperties.getStartupMinTimelineSegments()) {
                return false;
            }
            if (!anySegmentExists(assetDir, "init-" + representationId)) {
                return false;
            }
            for (int number = 1; number <= streamingProperties.getStartupChunkCount(); number++) {
                if (!anySegmentExists(assetDir, String.format("chunk-%s-%05d", representationId, number))) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean anySegmentExists(Path assetDir, String baseName) {
        for (String extension : SEGMENT_EXTENSIONS) {
            if (fileSystem.exists(assetDir.resolve(baseName + extension))) {
                return true;
            }
        }
        return false;
    }

    private boolean isSegmentMicrocached(String key) {
        Long readyUntil = segmentReadyUntil.get(key);
        long now = clock.millis();
        if (readyUntil != null && now < readyUntil) {
            return true;
        }
        if (readyUntil != null) {
            segmentReadyUntil.remove(key, readyUntil);
        }
        if (segmentReadyUntil.size() > MICROCACHE_PRUNE_THRESHOLD) {
            segmentReadyUntil.values().removeIf(until -> until <= now);
        }
        return false;
    }

    private void selfHeal(StreamingSession session, String assetType, String traceId) {
        try {
            TrackSource source = trackSourceLookup.findTrackSource(session.getTrackId());
            if (source == null) {
                log.warn("STREAMING_ASSET_SELF_HEAL_SKIPPED sessionId={} trackId={} asset={} reason=source_unavailable traceId={}",
                        session.getSessionId(), session.getTrackId(), assetType, traceId);
                return;
            }
            DashAsset asset = manifestAssetProvider.getOrCreateLocalDashAsset(
                    source, session.getQuality(), session.getManifestProfile());
            log.info("STREAMING_ASSET_SELF_HEAL_TRIGGERED sessionId={} trackId={} asset={} cacheKey={} rebuiltCacheKey={} traceId={}",
                    session.getSessionId(), session.getTrackId(), assetType, session.getCacheKey(),
                    asset == null ? "none" : asset.getCacheKey(), traceId);
        } catch (RuntimeException e) {
            log.warn("STREAMING_ASSET_SELF_HEAL_FAILED sessionId={} trackId={} asset={} traceId={}",
                    session.getSessionId(), session.getTrackId(), assetType, traceId, e);
        }
    }

    private void recordWait(String assetType, String outcome) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("music.streaming.asset.wait", "asset", assetType, "outcome", outcome).increment();
        } catch (Exception ex) {
            log.debug("Asset wait metric failed, asset={}", assetType, ex);
        }
    }

    private String currentTraceId() {
        String traceId = MDC.get("requestId");
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }

    @FunctionalInterface
    private interface ReadinessCheck {
        boolean isReady() throws IOException;
    }

    /**
     * Poll state shared by the phases of one wait.
     */
    private final class ReadinessPoll {

        private final StreamingSession session;
        private final String traceId;
        private Long selfHealReturnedAt;

        private ReadinessPoll(StreamingSession session, String traceId) {
            this.session = session;
            this.traceId = traceId;
        }

        /**
         * @param extendAfterSelfHeal whether a self-heal in this phase grants it a fresh full budget
         */
        void await(String assetType, long deadlineEpochMs, boolean extendAfterSelfHeal, ReadinessCheck check) {
            String cacheKey = session.getCacheKey();
            long deadline = deadlineEpochMs;
            boolean selfHealAttempted = false;
            while (true) {
                BuildFailure failure = buildEngine.getBuildFailure(cacheKey);
                if (failure != null) {
                    throw buildFailed(failure);
                }
                if (isReady(check, assetType)) {
                    if (buildEngine.isCacheMarkedInvalid(cacheKey)) {
                        log.debug("STREAMING_ASSET_READY_DESPITE_INVALIDATION sessionId={} cacheKey={} asset={}",
                                session.getSessionId(), cacheKey, assetType);
                    }
                    return;
                }

                BuildInFlightStatus status = buildEngine.getBuildInFlightStatus(cacheKey);
                if (!status.isInFlight() && !selfHealAttempted) {
                    selfHealAttempted = true;
                    selfHeal(session, assetType, traceId);
                    selfHealReturnedAt = clock.millis();
                    if (extendAfterSelfHeal) {
                        deadline = Math.max(deadline, selfHealReturnedAt + streamingProperties.getAssetReadyTimeoutMs());
                    }
                }

                if (clock.millis() >= deadline) {
                    throw new BusinessException(StreamingErrorCodes.ASSET_NOT_READY, "音频分片尚未就绪", "请稍后重试", 503);
                }
                pause();
            }
        }

        private boolean isReady(ReadinessCheck check, String assetType) {
            try {
                return check.isReady();
            } catch (IOException e) {
                log.debug("STREAMING_ASSET_READ_FAILED sessionId={} asset={} error={}",
                        session.getSessionId(), assetType, e.getMessage());
                return false;
            }
        }

        private void pause() {
            try {
                sleeper.sleep(streamingProperties.getAssetPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BusinessException(StreamingErrorCodes.ASSET_NOT_READY, "音频分片等待被中断", "请稍后重试", 503);
            }
        }
    }
}
