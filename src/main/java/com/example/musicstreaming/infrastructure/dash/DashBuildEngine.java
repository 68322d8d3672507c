package com.example.musicstreaming.infrastructure.dash;

import com.example.musicstreaming.domain.model.BuildFailure;
import com.example.musicstreaming.domain.model.BuildInFlightStatus;
import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.DashAssetRequest;

/**
 * Produces init and chunk segments plus the manifest for a track rendition, and reports what it is
 * doing. Builds for one cache key may run in this process or on another pod sharing the cache volume.
 */
public interface DashBuildEngine {

    /**
     * Makes sure assets for the request exist or are being built. Does not wait for a build to finish.
     */
    DashAsset ensureLocalDashSegments(DashAssetRequest request);

    boolean hasInFlightBuild(String cacheKey);

    BuildInFlightStatus getBuildInFlightStatus(String cacheKey);

    /**
     * @return the terminal failure of the latest build, or {@code null} when none is recorded
     */
    BuildFailure getBuildFailure(String cacheKey);

    boolean isCacheMarkedInvalid(String cacheKey);

    /**
     * Discards existing assets and rebuilds them from the given source, blocking until done.
     *
     * @throws DashBuildException when the rebuild fails
     */
    void forceRegenerateDashSegments(DashAssetRequest request);
}
