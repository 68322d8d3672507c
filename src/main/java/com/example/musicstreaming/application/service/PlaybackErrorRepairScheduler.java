package com.example.musicstreaming.application.service;

import com.example.musicstreaming.common.util.InFlightCoalescer;
import com.example.musicstreaming.domain.SourceType;
import com.example.musicstreaming.domain.model.DashAssetRequest;
import com.example.musicstreaming.domain.model.StreamingSession;
import com.example.musicstreaming.domain.model.TrackSource;
import com.example.musicstreaming.infrastructure.dash.DashBuildEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Rebuilds a session's cached segments after the player reports a playback error.
 * <p>
 * Per session at most one repair runs and at most one more waits behind it; further reports arriving
 * meanwhile are dropped. Repairs never fail the caller.
 */
@Service
public class PlaybackErrorRepairScheduler {

    private static final Logger log = LoggerFactory.getLogger(PlaybackErrorRepairScheduler.class);

    private final StreamingSessionService sessionService;
    private final TrackSourceLookup trackSourceLookup;
    private final DashBuildEngine buildEngine;
    private final Executor repairExecutor;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<String, CompletableFuture<Void>> inFlightRepairs = new ConcurrentHashMap<>();
    private final Set<String> queuedFollowUps = ConcurrentHashMap.newKeySet();

    @Autowired
    public PlaybackErrorRepairScheduler(StreamingSessionService sessionService,
                                        TrackSourceLookup trackSourceLookup,
                                        DashBuildEngine buildEngine,
                                        @Qualifier("playbackRepairExecutor") ExecutorService repairExecutor,
                                        ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(sessionService, trackSourceLookup, buildEngine, (Executor) repairExecutor,
                meterRegistryProvider.getIfAvailable());
    }

    PlaybackErrorRepairScheduler(StreamingSessionService sessionService,
                                 TrackSourceLookup trackSourceLookup,
                                 DashBuildEngine buildEngine,
                                 Executor repairExecutor,
                                 MeterRegistry meterRegistry) {
        this.sessionService = sessionService;
        this.trackSourceLookup = trackSourceLookup;
        this.buildEngine = buildEngine;
        this.repairExecutor = repairExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Fire-and-forget. Only reports whose source type is exactly {@code local} are repaired.
     *
     * @param trackId the track the player was on, used to ignore reports for a track the session has left
     */
    public void schedulePlaybackErrorRepair(String userId, String sessionId, Long trackId, String sourceType) {
        if (!StringUtils.hasText(sessionId) || !SourceType.LOCAL.getValue().equals(sourceType)) {
            return;
        }
        String key = sessionId.trim();
        RepairRequest request = new RepairRequest(userId, key, trackId);
        synchronized (inFlightRepairs) {
            CompletableFuture<Void> active = inFlightRepairs.get(key);
            if (active == null) {
                startRepair(request);
                return;
            }
            if (queuedFollowUps.add(key)) {
                log.info("STREAMING_PLAYBACK_REPAIR_QUEUED sessionId={} trackId={}", key, trackId);
                active.whenComplete((ignored, error) -> {
                    queuedFollowUps.remove(key);
                    startRepair(request);
                });
                return;
            }
        }
        log.debug("STREAMING_PLAYBACK_REPAIR_DROPPED sessionId={} reason=follow_up_pending", key);
    }

    /**
     * Regenerates the segments of the session's current track. Missing sessions, stale track ids and
     * unavailable sources end the repair quietly; regeneration errors are logged.
     */
    public void repairPlaybackErrorSessionCache(String userId, String sessionId, Long trackId) {
        try {
            StreamingSession session = sessionService.getAuthorizedSession(sessionId, userId);
            if (session == null) {
                log.info("STREAMING_PLAYBACK_REPAIR_SKIPPED sessionId={} reason=session_not_found", sessionId);
                recordRepair("skipped");
                return;
            }
            if (trackId != null && !trackId.equals(session.getTrackId())) {
                log.info("STREAMING_PLAYBACK_REPAIR_SKIPPED sessionId={} trackId={} activeTrackId={} reason=stale_track",
                        sessionId, trackId, session.getTrackId());
                recordRepair("skipped");
                return;
            }
            TrackSource source = trackSourceLookup.findTrackSource(session.getTrackId());
            if (source == null) {
                log.info("STREAMING_PLAYBACK_REPAIR_SKIPPED sessionId={} trackId={} reason=source_unavailable",
                        sessionId, session.getTrackId());
                recordRepair("skipped");
                return;
            }

            buildEngine.forceRegenerateDashSegments(new DashAssetRequest(
                    session.getTrackId(),
                    source.getSourcePath(),
                    source.getFileModified(),
                    session.getQuality(),
                    session.getManifestProfile()));
            recordRepair("success");
            log.info("STREAMING_PLAYBACK_REPAIR_DONE sessionId={} trackId={} cacheKey={}",
                    sessionId, session.getTrackId(), session.getCacheKey());
        } catch (RuntimeException e) {
            recordRepair("failed");
            log.warn("STREAMING_PLAYBACK_REPAIR_FAILED sessionId={} trackId={}", sessionId, trackId, e);
        }
    }

    private void startRepair(RepairRequest request) {
        InFlightCoalescer.coalesce(inFlightRepairs, request.sessionId,
                () -> CompletableFuture.runAsync(
                        () -> repairPlaybackErrorSessionCache(request.userId, request.sessionId, request.trackId),
                        repairExecutor))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        recordRepair("failed");
                        log.warn("STREAMING_PLAYBACK_REPAIR_FAILED sessionId={} trackId={} reason=not_started",
                                request.sessionId, request.trackId, error);
                    }
                });
    }

    private void recordRepair(String outcome) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("music.streaming.repair", "outcome", outcome).increment();
        } catch (Exception ex) {
            log.debug("Repair metric failed, outcome={}", outcome, ex);
        }
    }

    private static final class RepairRequest {
        private final String userId;
        private final String sessionId;
        private final Long trackId;

        private RepairRequest(String userId, String sessionId, Long trackId) {
            this.userId = userId;
            this.sessionId = sessionId;
            this.trackId = trackId;
        }
    }
}
