package com.example.musicstreaming.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Player state reported with heartbeats and handoffs. Every field is optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionSnapshot {

    private Double positionSec;
    private Boolean isPlaying;

    public static SessionSnapshot empty() {
        return new SessionSnapshot();
    }
}
