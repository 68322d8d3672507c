package com.example.musicstreaming.api.response;

import com.example.musicstreaming.domain.model.EngineHints;
import com.example.musicstreaming.domain.model.PlaybackProfile;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamingSessionResponse {

    private String sessionId;
    private String manifestUrl;
    private String sessionToken;
    private Instant expiresAt;
    private PlaybackProfile playbackProfile;
    private EngineHints engineHints;
}
