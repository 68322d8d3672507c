package com.example.musicstreaming.domain.model;

import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.StreamingQuality;
import java.time.Instant;
import lombok.Value;

@Value
public class DashAssetRequest {

    Long trackId;
    String sourcePath;
    Instant sourceModified;
    StreamingQuality quality;
    DashManifestProfile manifestProfile;

    public static DashAssetRequest of(TrackSource source, StreamingQuality quality, DashManifestProfile profile) {
        return new DashAssetRequest(source.getTrackId(), source.getSourcePath(), source.getFileModified(),
                quality, profile);
    }
}
