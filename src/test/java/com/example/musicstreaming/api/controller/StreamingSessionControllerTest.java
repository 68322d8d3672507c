package com.example.musicstreaming.api.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musicstreaming.api.request.PlaybackErrorReportRequest;
import com.example.musicstreaming.api.request.SessionSnapshotRequest;
import com.example.musicstreaming.api.response.ApiResponse;
import com.example.musicstreaming.api.response.HeartbeatResponse;
import com.example.musicstreaming.application.service.AssetReadinessService;
import com.example.musicstreaming.application.service.PlaybackErrorRepairScheduler;
import com.example.musicstreaming.application.service.StreamingSessionService;
import com.example.musicstreaming.common.exception.BusinessException;
import com.example.musicstreaming.common.exception.StreamingErrorCodes;
import com.example.musicstreaming.domain.model.SessionSnapshot;
import com.example.musicstreaming.domain.model.StreamingSession;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

class StreamingSessionControllerTest {

    private StreamingSessionService streamingSessionService;
    private AssetReadinessService assetReadinessService;
    private PlaybackErrorRepairScheduler repairScheduler;
    private StreamingSessionController controller;
    private StreamingSession session;

    @BeforeEach
    void setUp() {
        streamingSessionService = mock(StreamingSessionService.class);
        assetReadinessService = mock(AssetReadinessService.class);
        repairScheduler = mock(PlaybackErrorRepairScheduler.class);
        controller = new StreamingSessionController(streamingSessionService, assetReadinessService, repairScheduler);

        session = new StreamingSession();
        session.setSessionId("session-1");
        session.setUserId("alice");
        session.setTrackId(7L);
        session.setManifestPath("/cache/segmented-dash/key/manifest.mpd");
        session.setAssetDir("/cache/segmented-dash/key");

        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("alice", null, Collections.emptyList()));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void shouldServeManifestWithDashContentTypeOnceReady() {
        when(streamingSessionService.authorizeMediaRequest("session-1", "st-token", true)).thenReturn(session);
        when(assetReadinessService.waitForManifestReady(session)).thenReturn(CompletableFuture.completedFuture(null));

        ResponseEntity<Resource> response = controller.manifest("session-1", "st-token").join();

        Assertions.assertEquals(200, response.getStatusCodeValue());
        Assertions.assertEquals("application/dash+xml", response.getHeaders().getContentType().toString());
        Assertions.assertEquals("private, no-cache, must-revalidate",
                response.getHeaders().getFirst(HttpHeaders.CACHE_CONTROL));
    }

    @Test
    void shouldServeLegacyWebmSegmentWithWebmContentType() {
        when(streamingSessionService.authorizeMediaRequest("session-1", "st-token", true)).thenReturn(session);
        when(assetReadinessService.waitForSegmentReady(session, "chunk-0-00001.webm"))
                .thenReturn(CompletableFuture.completedFuture(Paths.get("/cache/segmented-dash/key/chunk-0-00001.webm")));
        when(assetReadinessService.waitForSegmentReady(session, "chunk-0-00002.m4s"))
                .thenReturn(CompletableFuture.completedFuture(Paths.get("/cache/segmented-dash/key/chunk-0-00002.m4s")));

        ResponseEntity<Resource> webm = controller.segment("session-1", "chunk-0-00001.webm", "st-token").join();
        ResponseEntity<Resource> m4s = controller.segment("session-1", "chunk-0-00002.m4s", "st-token").join();

        Assertions.assertEquals("video/webm", webm.getHeaders().getContentType().toString());
        Assertions.assertEquals("video/iso.segment", m4s.getHeaders().getContentType().toString());
        Assertions.assertEquals("private, max-age=30", m4s.getHeaders().getFirst(HttpHeaders.CACHE_CONTROL));
    }

    @Test
    void shouldNotWaitWhenMediaTokenIsRejected() {
        when(streamingSessionService.authorizeMediaRequest(anyString(), any(), anyBoolean()))
                .thenThrow(new BusinessException(StreamingErrorCodes.SESSION_TOKEN_INVALID, "播放会话令牌无效", "请重新开始播放", 401));

        Assertions.assertThrows(BusinessException.class, () -> controller.manifest("session-1", "bad"));
        verify(assetReadinessService, never()).waitForManifestReady(any());
    }

    @Test
    void shouldRequireOwnedSessionAndExactTokenForHeartbeat() {
        when(streamingSessionService.requireAuthorizedSession("session-1", "alice")).thenReturn(session);
        HeartbeatResponse heartbeat = new HeartbeatResponse("session-1", "next-token", Instant.parse("2026-03-01T08:05:00Z"));
        when(streamingSessionService.heartbeatSession(eq(session), any())).thenReturn(heartbeat);
        SessionSnapshotRequest request = new SessionSnapshotRequest();
        request.setPositionSec(12D);
        request.setIsPlaying(true);

        ApiResponse<HeartbeatResponse> response = controller.heartbeat("session-1", "st-token", request);

        Assertions.assertSame(heartbeat, response.getData());
        verify(streamingSessionService).validateSessionToken(session, "st-token", false);
        ArgumentCaptor<SessionSnapshot> snapshot = ArgumentCaptor.forClass(SessionSnapshot.class);
        verify(streamingSessionService).heartbeatSession(eq(session), snapshot.capture());
        Assertions.assertEquals(Double.valueOf(12D), snapshot.getValue().getPositionSec());
    }

    @Test
    void shouldNotHeartbeatWithForeignToken() {
        when(streamingSessionService.requireAuthorizedSession("session-1", "alice")).thenReturn(session);
        doThrow(new BusinessException(StreamingErrorCodes.SESSION_TOKEN_SCOPE_MISMATCH, "播放会话令牌与当前会话不匹配",
                "请刷新播放器后重试", 403))
                .when(streamingSessionService).validateSessionToken(session, "other", false);

        Assertions.assertThrows(BusinessException.class, () -> controller.heartbeat("session-1", "other", null));
        verify(streamingSessionService, never()).heartbeatSession(any(), any());
    }

    @Test
    void shouldScheduleRepairForReportedPlaybackError() {
        PlaybackErrorReportRequest request = new PlaybackErrorReportRequest();
        request.setSessionId("session-1");
        request.setTrackId(7L);
        request.setSourceType("local");
        request.setErrorCode("MEDIA_ERR_DECODE");

        controller.reportPlaybackError(request);

        verify(repairScheduler).schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");
    }
}
