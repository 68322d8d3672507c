package com.example.musicstreaming.application.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.SourceType;
import com.example.musicstreaming.domain.StreamingQuality;
import com.example.musicstreaming.domain.model.DashAssetRequest;
import com.example.musicstreaming.domain.model.StreamingSession;
import com.example.musicstreaming.domain.model.TrackSource;
import com.example.musicstreaming.infrastructure.dash.DashBuildEngine;
import com.example.musicstreaming.infrastructure.dash.DashBuildException;
import com.example.musicstreaming.support.DeterministicExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class PlaybackErrorRepairSchedulerTest {

    private StreamingSessionService sessionService;
    private TrackSourceLookup trackSourceLookup;
    private DashBuildEngine buildEngine;
    private DeterministicExecutor executor;
    private SimpleMeterRegistry meterRegistry;
    private PlaybackErrorRepairScheduler scheduler;

    @BeforeEach
    void setUp() {
        sessionService = mock(StreamingSessionService.class);
        trackSourceLookup = mock(TrackSourceLookup.class);
        buildEngine = mock(DashBuildEngine.class);
        executor = new DeterministicExecutor();
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new PlaybackErrorRepairScheduler(sessionService, trackSourceLookup, buildEngine, executor,
                meterRegistry);

        when(sessionService.getAuthorizedSession("session-1", "alice")).thenReturn(session());
        when(trackSourceLookup.findTrackSource(7L)).thenReturn(new TrackSource(7L, "Album/Song.flac",
                "/music/Album/Song.flac", Instant.parse("2026-01-15T10:30:00Z")));
    }

    @Test
    void shouldRunOneRepairPlusOneFollowUpForBurst() {
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");

        assertEquals(1, executor.pendingCount());
        executor.runAll();

        assertEquals(2, executor.executedCount());
        verify(buildEngine, times(2)).forceRegenerateDashSegments(any());

        scheduler.schedulePlaybackErrorRepair("alice", " session-1 ", 7L, "local");
        executor.runAll();

        assertEquals(3, executor.executedCount());
        verify(buildEngine, times(3)).forceRegenerateDashSegments(any());
    }

    @Test
    void shouldRepairDifferentSessionsIndependently() {
        StreamingSession other = session();
        other.setSessionId("session-2");
        when(sessionService.getAuthorizedSession("session-2", "alice")).thenReturn(other);

        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");
        scheduler.schedulePlaybackErrorRepair("alice", "session-2", 7L, "local");

        assertEquals(2, executor.pendingCount());
        executor.runAll();
        verify(buildEngine, times(2)).forceRegenerateDashSegments(any());
    }

    @Test
    void shouldIgnoreNonLocalOrBlankReports() {
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "remote");
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, null);
        scheduler.schedulePlaybackErrorRepair("alice", " ", 7L, "local");
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "LOCAL");
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, " local ");

        assertEquals(0, executor.pendingCount());
    }

    @Test
    void shouldRecordRepairThatCouldNotBeStarted() {
        PlaybackErrorRepairScheduler saturated = new PlaybackErrorRepairScheduler(sessionService, trackSourceLookup,
                buildEngine, command -> {
                    throw new RejectedExecutionException("playback repair pool saturated");
                }, meterRegistry);

        assertDoesNotThrow(() -> saturated.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local"));

        verify(buildEngine, never()).forceRegenerateDashSegments(any());
        assertEquals(1.0D, meterRegistry.find("music.streaming.repair").tag("outcome", "failed").counter().count());

        saturated.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");
        assertEquals(2.0D, meterRegistry.find("music.streaming.repair").tag("outcome", "failed").counter().count());
    }

    @Test
    void shouldRegenerateCurrentRendition() {
        scheduler.repairPlaybackErrorSessionCache("alice", "session-1", 7L);

        ArgumentCaptor<DashAssetRequest> captor = ArgumentCaptor.forClass(DashAssetRequest.class);
        verify(buildEngine).forceRegenerateDashSegments(captor.capture());
        DashAssetRequest request = captor.getValue();
        assertEquals(Long.valueOf(7L), request.getTrackId());
        assertEquals("/music/Album/Song.flac", request.getSourcePath());
        assertEquals(StreamingQuality.HIGH, request.getQuality());
        assertEquals(DashManifestProfile.STARTUP_SINGLE, request.getManifestProfile());
        assertEquals(1.0D, meterRegistry.find("music.streaming.repair").tag("outcome", "success").counter().count());
    }

    @Test
    void shouldSkipStaleTrackReport() {
        scheduler.repairPlaybackErrorSessionCache("alice", "session-1", 8L);

        verify(buildEngine, never()).forceRegenerateDashSegments(any());
        assertEquals(1.0D, meterRegistry.find("music.streaming.repair").tag("outcome", "skipped").counter().count());
    }

    @Test
    void shouldSkipMissingSessionOrSource() {
        scheduler.repairPlaybackErrorSessionCache("bob", "session-1", 7L);
        when(trackSourceLookup.findTrackSource(7L)).thenReturn(null);
        scheduler.repairPlaybackErrorSessionCache("alice", "session-1", 7L);

        verify(buildEngine, never()).forceRegenerateDashSegments(any());
        assertEquals(2.0D, meterRegistry.find("music.streaming.repair").tag("outcome", "skipped").counter().count());
    }

    @Test
    void shouldContainRegenerationFailure() {
        doThrow(new DashBuildException("ffmpeg exited with code 1"))
                .when(buildEngine).forceRegenerateDashSegments(any());

        assertDoesNotThrow(() -> scheduler.repairPlaybackErrorSessionCache("alice", "session-1", 7L));
        assertEquals(1.0D, meterRegistry.find("music.streaming.repair").tag("outcome", "failed").counter().count());

        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");
        executor.runAll();
        scheduler.schedulePlaybackErrorRepair("alice", "session-1", 7L, "local");
        assertEquals(1, executor.pendingCount());
    }

    private StreamingSession session() {
        StreamingSession session = new StreamingSession();
        session.setSessionId("session-1");
        session.setUserId("alice");
        session.setTrackId(7L);
        session.setCacheKey("a1b2c3d4e5f6a1b2c3d4e5f6");
        session.setQuality(StreamingQuality.HIGH);
        session.setSourceType(SourceType.LOCAL);
        session.setManifestProfile(DashManifestProfile.STARTUP_SINGLE);
        return session;
    }
}
