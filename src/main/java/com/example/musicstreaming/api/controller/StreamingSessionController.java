package com.example.musicstreaming.api.controller;

import com.example.musicstreaming.api.request.CreateStreamingSessionRequest;
import com.example.musicstreaming.api.request.PlaybackErrorReportRequest;
import com.example.musicstreaming.api.request.SessionSnapshotRequest;
import com.example.musicstreaming.api.response.ApiResponse;
import com.example.musicstreaming.api.response.HandoffResponse;
import com.example.musicstreaming.api.response.HeartbeatResponse;
import com.example.musicstreaming.api.response.StreamingSessionResponse;
import com.example.musicstreaming.application.service.AssetReadinessService;
import com.example.musicstreaming.application.service.PlaybackErrorRepairScheduler;
import com.example.musicstreaming.application.service.StreamingSessionService;
import com.example.musicstreaming.domain.model.SessionSnapshot;
import com.example.musicstreaming.domain.model.StreamingSession;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import javax.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/streaming/v1")
public class StreamingSessionController {

    private static final Logger log = LoggerFactory.getLogger(StreamingSessionController.class);

    static final MediaType DASH_MANIFEST = MediaType.parseMediaType("application/dash+xml");
    static final MediaType ISO_SEGMENT = MediaType.parseMediaType("video/iso.segment");
    static final MediaType WEBM_SEGMENT = MediaType.parseMediaType("video/webm");

    private final StreamingSessionService streamingSessionService;
    private final AssetReadinessService assetReadinessService;
    private final PlaybackErrorRepairScheduler playbackErrorRepairScheduler;

    public StreamingSessionController(StreamingSessionService streamingSessionService,
                                      AssetReadinessService assetReadinessService,
                                      PlaybackErrorRepairScheduler playbackErrorRepairScheduler) {
        this.streamingSessionService = streamingSessionService;
        this.assetReadinessService = assetReadinessService;
        this.playbackErrorRepairScheduler = playbackErrorRepairScheduler;
    }

    @PostMapping("/sessions")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<StreamingSessionResponse> createSession(@Valid @RequestBody CreateStreamingSessionRequest request) {
        return ApiResponse.success(streamingSessionService.createLocalSession(
                resolveCurrentActor(), request.getTrackId(), request.getDesiredQuality()));
    }

    /**
     * Answered once the manifest and the startup window of every required representation are on disk.
     */
    @GetMapping("/sessions/{sessionId}/manifest.mpd")
    public CompletableFuture<ResponseEntity<Resource>> manifest(@PathVariable String sessionId,
                                                                @RequestParam(value = "st", required = false) String sessionToken) {
        StreamingSession session = streamingSessionService.authorizeMediaRequest(sessionId, sessionToken, true);
        return assetReadinessService.waitForManifestReady(session)
                .thenApply(ignored -> ResponseEntity.ok()
                        .header(HttpHeaders.CACHE_CONTROL, "private, no-cache, must-revalidate")
                        .contentType(DASH_MANIFEST)
                        .body((Resource) new FileSystemResource(Paths.get(session.getManifestPath()))));
    }

    @GetMapping("/sessions/{sessionId}/segments/{segmentName:.+}")
    public CompletableFuture<ResponseEntity<Resource>> segment(@PathVariable String sessionId,
                                                               @PathVariable String segmentName,
                                                               @RequestParam(value = "st", required = false) String sessionToken) {
        StreamingSession session = streamingSessionService.authorizeMediaRequest(sessionId, sessionToken, true);
        MediaType contentType = segmentName.toLowerCase(Locale.ROOT).endsWith(".webm") ? WEBM_SEGMENT : ISO_SEGMENT;
        return assetReadinessService.waitForSegmentReady(session, segmentName)
                .thenApply(segmentPath -> ResponseEntity.ok()
                        .header(HttpHeaders.CACHE_CONTROL, "private, max-age=30")
                        .contentType(contentType)
                        .body((Resource) new FileSystemResource(segmentPath)));
    }

    @PostMapping("/sessions/{sessionId}/heartbeat")
    public ApiResponse<HeartbeatResponse> heartbeat(@PathVariable String sessionId,
                                                    @RequestParam(value = "st", required = false) String sessionToken,
                                                    @RequestBody(required = false) SessionSnapshotRequest request) {
        StreamingSession session = authorizeOwnedSession(sessionId, sessionToken);
        return ApiResponse.success(streamingSessionService.heartbeatSession(session, toSnapshot(request)));
    }

    @PostMapping("/sessions/{sessionId}/handoff")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<HandoffResponse> handoff(@PathVariable String sessionId,
                                                @RequestParam(value = "st", required = false) String sessionToken,
                                                @RequestBody(required = false) SessionSnapshotRequest request) {
        StreamingSession session = authorizeOwnedSession(sessionId, sessionToken);
        return ApiResponse.success(streamingSessionService.createHandoffSession(session, toSnapshot(request)));
    }

    @PostMapping("/playback-errors")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<Void> reportPlaybackError(@Valid @RequestBody PlaybackErrorReportRequest request) {
        String actor = resolveCurrentActor();
        log.info("STREAMING_PLAYBACK_ERROR_REPORTED userId={} sessionId={} trackId={} sourceType={} errorCode={}",
                actor, request.getSessionId(), request.getTrackId(), request.getSourceType(), request.getErrorCode());
        playbackErrorRepairScheduler.schedulePlaybackErrorRepair(
                actor, request.getSessionId(), request.getTrackId(), request.getSourceType());
        return ApiResponse.success(null);
    }

    private StreamingSession authorizeOwnedSession(String sessionId, String sessionToken) {
        StreamingSession session = streamingSessionService.requireAuthorizedSession(sessionId, resolveCurrentActor());
        streamingSessionService.validateSessionToken(session, sessionToken, false);
        return session;
    }

    private SessionSnapshot toSnapshot(SessionSnapshotRequest request) {
        return request == null ? SessionSnapshot.empty() : request.toSnapshot();
    }

    private String resolveCurrentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || authentication.getPrincipal() == null) {
            return "anonymous";
        }
        String actor = String.valueOf(authentication.getPrincipal());
        if (actor.trim().isEmpty()) {
            return "anonymous";
        }
        return actor.trim();
    }
}
