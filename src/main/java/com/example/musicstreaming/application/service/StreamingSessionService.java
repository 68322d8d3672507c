package com.example.musicstreaming.application.service;

import com.example.musicstreaming.api.response.HandoffResponse;
import com.example.musicstreaming.api.response.HeartbeatResponse;
import com.example.musicstreaming.api.response.StreamingSessionResponse;
import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.common.exception.BusinessException;
import com.example.musicstreaming.common.exception.StreamingErrorCodes;
import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.SourceType;
import com.example.musicstreaming.domain.StreamingQuality;
import com.example.musicstreaming.domain.model.BuildInFlightStatus;
import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.EngineHints;
import com.example.musicstreaming.domain.model.PlaybackProfile;
import com.example.musicstreaming.domain.model.SessionSnapshot;
import com.example.musicstreaming.domain.model.StreamingSession;
import com.example.musicstreaming.domain.model.TrackSource;
import com.example.musicstreaming.infrastructure.cache.SegmentCacheReferenceTracker;
import com.example.musicstreaming.infrastructure.dash.DashBuildEngine;
import com.example.musicstreaming.infrastructure.persistence.entity.TrackEntity;
import com.example.musicstreaming.infrastructure.persistence.mapper.UserMapper;
import com.example.musicstreaming.infrastructure.session.StreamingSessionStore;
import com.example.musicstreaming.infrastructure.storage.AssetFileSystem;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Lifecycle of segmented streaming sessions: creation, ownership checks, heartbeats and handoffs.
 */
@Service
public class StreamingSessionService {

    private static final Logger log = LoggerFactory.getLogger(StreamingSessionService.class);

    static final String MANIFEST_URL_TEMPLATE = "/api/streaming/v1/sessions/%s/manifest.mpd?st=%s";

    private final AppStreamingProperties streamingProperties;
    private final TrackSourceLookup trackSourceLookup;
    private final UserMapper userMapper;
    private final ManifestAssetProvider manifestAssetProvider;
    private final DashBuildEngine buildEngine;
    private final SegmentCacheReferenceTracker referenceTracker;
    private final StreamingSessionStore sessionStore;
    private final SessionTokenService sessionTokenService;
    private final AssetFileSystem fileSystem;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Autowired
    public StreamingSessionService(AppStreamingProperties streamingProperties,
                                   TrackSourceLookup trackSourceLookup,
                                   UserMapper userMapper,
                                   ManifestAssetProvider manifestAssetProvider,
                                   DashBuildEngine buildEngine,
                                   SegmentCacheReferenceTracker referenceTracker,
                                   StreamingSessionStore sessionStore,
                                   SessionTokenService sessionTokenService,
                                   AssetFileSystem fileSystem,
                                   Clock clock,
                                   ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(streamingProperties, trackSourceLookup, userMapper, manifestAssetProvider, buildEngine, referenceTracker,
                sessionStore, sessionTokenService, fileSystem, clock, meterRegistryProvider.getIfAvailable());
    }

    StreamingSessionService(AppStreamingProperties streamingProperties,
                            TrackSourceLookup trackSourceLookup,
                            UserMapper userMapper,
                            ManifestAssetProvider manifestAssetProvider,
                            DashBuildEngine buildEngine,
                            SegmentCacheReferenceTracker referenceTracker,
                            StreamingSessionStore sessionStore,
                            SessionTokenService sessionTokenService,
                            AssetFileSystem fileSystem,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.streamingProperties = streamingProperties;
        this.trackSourceLookup = trackSourceLookup;
        this.userMapper = userMapper;
        this.manifestAssetProvider = manifestAssetProvider;
        this.buildEngine = buildEngine;
        this.referenceTracker = referenceTracker;
        this.sessionStore = sessionStore;
        this.sessionTokenService = sessionTokenService;
        this.fileSystem = fileSystem;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Creates a session for a track stored on the local music volume and makes sure its DASH asset exists
     * or is being built.
     *
     * @param desiredQuality explicit quality, or {@code null} to use the user's setting
     */
    public StreamingSessionResponse createLocalSession(String userId, Long trackId, String desiredQuality) {
        long startedAtNanos = System.nanoTime();
        try {
            if (!StringUtils.hasText(userId)) {
                throw new BusinessException("401", "用户身份缺失", "请重新登录后重试", 401);
            }
            StreamingQuality quality = resolveQuality(userId, desiredQuality);

            TrackEntity track = trackSourceLookup.findTrack(trackId);
            if (track == null) {
                throw new BusinessException(StreamingErrorCodes.TRACK_NOT_FOUND, "歌曲不存在", "请刷新后重试", 404);
            }
            TrackSource source = trackSourceLookup.toSource(track);
            if (source == null) {
                throw new BusinessException(StreamingErrorCodes.TRACK_NOT_LOCALLY_AVAILABLE, "歌曲没有本地音频文件",
                        "请重新扫描音乐库后重试", 404);
            }
            if (!fileSystem.exists(Paths.get(source.getSourcePath()))) {
                throw new BusinessException(StreamingErrorCodes.TRACK_SOURCE_MISSING, "歌曲音频文件不存在",
                        "请重新扫描音乐库后重试", 404);
            }

            DashManifestProfile manifestProfile = DashManifestProfile.fromValue(
                    streamingProperties.getManifestProfile(), DashManifestProfile.STARTUP_SINGLE);
            PlaybackProfile playbackProfile = PlaybackProfile.resolve(SourceType.LOCAL, quality, source.getSourcePath());
            DashAsset asset = manifestAssetProvider.getOrCreateLocalDashAsset(source, quality, manifestProfile);
            BuildInFlightStatus buildStatus = buildEngine.getBuildInFlightStatus(asset.getCacheKey());
            EngineHints engineHints = new EngineHints(PlaybackProfile.PROTOCOL_DASH, SourceType.LOCAL,
                    EngineHints.RECOMMENDED_ENGINE, buildStatus.isInFlight());

            Instant now = clock.instant();
            StreamingSession session = new StreamingSession();
            session.setSessionId(UUID.randomUUID().toString());
            session.setUserId(userId);
            session.setTrackId(source.getTrackId());
            session.setCacheKey(asset.getCacheKey());
            session.setQuality(quality);
            session.setSourceType(SourceType.LOCAL);
            session.setManifestProfile(manifestProfile);
            session.setPlaybackCodec(playbackProfile.getCodec());
            session.setPlaybackBitrateKbps(playbackProfile.getBitrateKbps());
            session.setManifestPath(asset.getManifestPath());
            session.setAssetDir(asset.getOutputDir());
            session.setCreatedAt(now);
            session.setExpiresAt(now.plusSeconds(streamingProperties.getSessionTtlSeconds()));

            referenceTracker.registerSessionReference(session.getSessionId(), session.getCacheKey());
            sessionStore.save(session);
            String sessionToken = sessionTokenService.issueSessionToken(session);

            recordCreate("success");
            log.info("STREAMING_SESSION_CREATED sessionId={} userId={} trackId={} quality={} codec={} cacheKey={} buildInFlight={} traceId={}",
                    session.getSessionId(), userId, session.getTrackId(), quality.getValue(),
                    playbackProfile.getCodec().getValue(), session.getCacheKey(), buildStatus.isInFlight(),
                    currentTraceId());
            return new StreamingSessionResponse(
                    session.getSessionId(),
                    buildManifestUrl(session.getSessionId(), sessionToken),
                    sessionToken,
                    session.getExpiresAt(),
                    playbackProfile,
                    engineHints);
        } catch (BusinessException e) {
            recordCreate(e.getCode());
            log.warn("STREAMING_SESSION_CREATE_REJECTED userId={} trackId={} code={} traceId={}",
                    userId, trackId, e.getCode(), currentTraceId());
            throw e;
        } finally {
            recordDuration(System.nanoTime() - startedAtNanos);
        }
    }

    /**
     * @return the live session owned by the user, or {@code null} when it is absent, expired or owned by
     * someone else. Expired records are removed on the way.
     */
    public StreamingSession getAuthorizedSession(String sessionId, String userId) {
        if (!StringUtils.hasText(sessionId) || !StringUtils.hasText(userId)) {
            return null;
        }
        StreamingSession session = sessionStore.findById(sessionId.trim());
        if (session == null || !userId.equals(session.getUserId())) {
            return null;
        }
        if (session.isExpiredAt(clock.instant())) {
            removeSession(session.getSessionId());
            log.info("STREAMING_SESSION_EXPIRED sessionId={} userId={}", session.getSessionId(), userId);
            return null;
        }
        return session;
    }

    /**
     * Resolves the session a media request addresses using only its session token, then applies the
     * ownership and token scope checks.
     *
     * @throws BusinessException {@code STREAMING_SESSION_NOT_FOUND} when no live session matches
     */
    public StreamingSession authorizeMediaRequest(String sessionId, String sessionToken, boolean allowSessionIdMismatch) {
        String tokenUserId = sessionTokenService.resolveTokenUserId(sessionToken);
        StreamingSession session = requireAuthorizedSession(sessionId, tokenUserId);
        sessionTokenService.validateSessionToken(session, sessionToken, allowSessionIdMismatch);
        return session;
    }

    public StreamingSession requireAuthorizedSession(String sessionId, String userId) {
        StreamingSession session = getAuthorizedSession(sessionId, userId);
        if (session == null) {
            throw new BusinessException(StreamingErrorCodes.SESSION_NOT_FOUND, "播放会话不存在或已过期", "请重新开始播放", 404);
        }
        return session;
    }

    public void validateSessionToken(StreamingSession session, String sessionToken, boolean allowSessionIdMismatch) {
        sessionTokenService.validateSessionToken(session, sessionToken, allowSessionIdMismatch);
    }

    /**
     * Extends the session and records the player state. The returned token is freshly minted; older tokens
     * of this session stay usable through heartbeat continuity.
     */
    public HeartbeatResponse heartbeatSession(StreamingSession session, SessionSnapshot snapshot) {
        Instant now = clock.instant();
        SessionSnapshot input = snapshot == null ? SessionSnapshot.empty() : snapshot;
        StreamingSession updated = session.copy();
        updated.setExpiresAt(now.plusSeconds(streamingProperties.getSessionTtlSeconds()));
        updated.setLastHeartbeatAt(now);
        Double positionSec = normalizePositionSec(input.getPositionSec());
        if (positionSec != null) {
            updated.setLastKnownPositionSec(positionSec);
        }
        if (input.getIsPlaying() != null) {
            updated.setLastKnownIsPlaying(input.getIsPlaying());
        }
        sessionStore.save(updated);

        session.setExpiresAt(updated.getExpiresAt());
        session.setLastHeartbeatAt(updated.getLastHeartbeatAt());
        session.setLastKnownPositionSec(updated.getLastKnownPositionSec());
        session.setLastKnownIsPlaying(updated.getLastKnownIsPlaying());
        return new HeartbeatResponse(updated.getSessionId(), sessionTokenService.issueSessionToken(updated),
                updated.getExpiresAt());
    }

    /**
     * Replaces a session with a fresh one for the same user, track and quality, keeping the old one alive
     * until it expires so in-flight segment requests can drain.
     */
    public HandoffResponse createHandoffSession(StreamingSession session, SessionSnapshot snapshot) {
        SessionSnapshot input = snapshot == null ? SessionSnapshot.empty() : snapshot;
        Double positionSec = normalizePositionSec(input.getPositionSec());
        if (positionSec == null) {
            positionSec = normalizePositionSec(session.getLastKnownPositionSec());
        }
        double resumeAtSec = positionSec == null ? 0D : positionSec;
        Boolean isPlaying = input.getIsPlaying() != null ? input.getIsPlaying() : session.getLastKnownIsPlaying();
        boolean shouldPlay = isPlaying == null || isPlaying;

        heartbeatSession(session, new SessionSnapshot(resumeAtSec, shouldPlay));
        StreamingSessionResponse next = createLocalSession(session.getUserId(), session.getTrackId(),
                session.getQuality().getValue());
        log.info("STREAMING_SESSION_HANDOFF previousSessionId={} sessionId={} trackId={} resumeAtSec={} traceId={}",
                session.getSessionId(), next.getSessionId(), session.getTrackId(), resumeAtSec, currentTraceId());
        return new HandoffResponse(next, session.getSessionId(), resumeAtSec, shouldPlay);
    }

    /**
     * Deletes expired session records and releases their cache references.
     *
     * @return number of sessions removed
     */
    public int purgeExpiredSessions() {
        List<StreamingSession> expired = sessionStore.findExpired(clock.instant());
        int removed = 0;
        for (StreamingSession session : expired) {
            if (removeSession(session.getSessionId())) {
                removed++;
            }
        }
        return removed;
    }

    StreamingQuality resolveQuality(String userId, String desiredQuality) {
        if (StringUtils.hasText(desiredQuality)) {
            StreamingQuality explicit = StreamingQuality.fromValue(desiredQuality);
            if (explicit == null) {
                throw new BusinessException(StreamingErrorCodes.INVALID_REQUEST, "播放音质不合法", "请选择有效的音质");
            }
            return explicit;
        }
        try {
            StreamingQuality stored = StreamingQuality.fromValue(userMapper.selectPlaybackQuality(userId));
            if (stored != null) {
                return stored;
            }
        } catch (RuntimeException e) {
            log.warn("STREAMING_QUALITY_SETTING_LOOKUP_FAILED userId={} traceId={}", userId, currentTraceId(), e);
        }
        StreamingQuality configured = StreamingQuality.fromValue(streamingProperties.getDefaultQuality());
        return configured == null ? StreamingQuality.MEDIUM : configured;
    }

    private boolean removeSession(String sessionId) {
        StreamingSession removed = sessionStore.deleteById(sessionId);
        referenceTracker.clearSessionReference(sessionId);
        return removed != null;
    }

    private String buildManifestUrl(String sessionId, String sessionToken) {
        return String.format(MANIFEST_URL_TEMPLATE, sessionId, URLEncoder.encode(sessionToken, StandardCharsets.UTF_8));
    }

    private Double normalizePositionSec(Double positionSec) {
        if (positionSec == null || positionSec.isNaN() || positionSec.isInfinite() || positionSec < 0) {
            return null;
        }
        return positionSec;
    }

    private String currentTraceId() {
        String traceId = MDC.get("requestId");
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }

    private void recordCreate(String outcome) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("music.streaming.session.create", "outcome", outcome).increment();
        } catch (Exception ex) {
            log.debug("Session create metric failed, outcome={}", outcome, ex);
        }
    }

    private void recordDuration(long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer("music.streaming.session.create.latency").record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Session create timer failed", ex);
        }
    }
}
