package com.example.musicstreaming.application.service;

import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.StreamingQuality;
import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.DashAssetRequest;
import com.example.musicstreaming.domain.model.TrackSource;
import com.example.musicstreaming.infrastructure.dash.DashBuildEngine;
import org.springframework.stereotype.Service;

/**
 * Entry point for locating or creating the DASH asset of a track rendition.
 */
@Service
public class ManifestAssetProvider {

    private final DashBuildEngine buildEngine;

    public ManifestAssetProvider(DashBuildEngine buildEngine) {
        this.buildEngine = buildEngine;
    }

    public DashAsset getOrCreateLocalDashAsset(TrackSource source,
                                               StreamingQuality quality,
                                               DashManifestProfile manifestProfile) {
        return buildEngine.ensureLocalDashSegments(DashAssetRequest.of(source, quality, manifestProfile));
    }
}
