package com.example.musicstreaming.api.request;

import com.example.musicstreaming.domain.model.SessionSnapshot;
import lombok.Data;

@Data
public class SessionSnapshotRequest {

    private Double positionSec;

    private Boolean isPlaying;

    public SessionSnapshot toSnapshot() {
        SessionSnapshot snapshot = new SessionSnapshot();
        snapshot.setPositionSec(positionSec);
        snapshot.setIsPlaying(isPlaying);
        return snapshot;
    }
}
