package com.example.musicstreaming.api.response;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A replacement session plus where the player should pick up.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class HandoffResponse extends StreamingSessionResponse {

    private String previousSessionId;
    private double resumeAtSec;
    private boolean shouldPlay;

    public HandoffResponse(StreamingSessionResponse next, String previousSessionId, double resumeAtSec,
                           boolean shouldPlay) {
        super(next.getSessionId(), next.getManifestUrl(), next.getSessionToken(), next.getExpiresAt(),
                next.getPlaybackProfile(), next.getEngineHints());
        this.previousSessionId = previousSessionId;
        this.resumeAtSec = resumeAtSec;
        this.shouldPlay = shouldPlay;
    }
}
