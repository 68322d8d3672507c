package com.example.musicstreaming.domain.model;

import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.StreamingQuality;
import lombok.Value;

@Value
public class DashAsset {

    String cacheKey;
    String outputDir;
    String manifestPath;
    StreamingQuality quality;
    DashManifestProfile manifestProfile;
}
