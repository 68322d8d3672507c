package com.example.musicstreaming.domain.model;

import com.example.musicstreaming.domain.SourceType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngineHints {

    public static final String RECOMMENDED_ENGINE = "videojs";

    private String protocol;
    private SourceType sourceType;
    private String recommendedEngine;
    /** Whether a local or cross-pod build for the asset was running when the session was created. */
    private boolean assetBuildInFlight;
}
