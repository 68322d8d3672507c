package com.example.musicstreaming.domain.model;

import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.PlaybackCodec;
import com.example.musicstreaming.domain.SourceType;
import com.example.musicstreaming.domain.StreamingQuality;
import java.time.Instant;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One playback attempt. Several sessions may share a cache key; only heartbeats mutate a stored record.
 */
@Data
@NoArgsConstructor
public class StreamingSession {

    private String sessionId;

    private String userId;

    private Long trackId;

    private String cacheKey;

    private StreamingQuality quality;

    private SourceType sourceType;

    private DashManifestProfile manifestProfile;

    private PlaybackCodec playbackCodec;

    private Integer playbackBitrateKbps;

    private String manifestPath;

    private String assetDir;

    private Instant createdAt;

    private Instant expiresAt;

    private Instant lastHeartbeatAt;

    private Double lastKnownPositionSec;

    private Boolean lastKnownIsPlaying;

    public StreamingSession copy() {
        StreamingSession copy = new StreamingSession();
        copy.sessionId = sessionId;
        copy.userId = userId;
        copy.trackId = trackId;
        copy.cacheKey = cacheKey;
        copy.quality = quality;
        copy.sourceType = sourceType;
        copy.manifestProfile = manifestProfile;
        copy.playbackCodec = playbackCodec;
        copy.playbackBitrateKbps = playbackBitrateKbps;
        copy.manifestPath = manifestPath;
        copy.assetDir = assetDir;
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.lastHeartbeatAt = lastHeartbeatAt;
        copy.lastKnownPositionSec = lastKnownPositionSec;
        copy.lastKnownIsPlaying = lastKnownIsPlaying;
        return copy;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
