package com.example.musicstreaming.infrastructure.dash;

import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.DashAssetRequest;

/**
 * Writes the manifest and its segment files for one asset into {@link DashAsset#getOutputDir()}.
 */
public interface DashSegmentGenerator {

    void generate(DashAssetRequest request, DashAsset asset) throws DashBuildException;
}
