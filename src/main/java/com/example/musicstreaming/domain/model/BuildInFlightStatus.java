package com.example.musicstreaming.domain.model;

import lombok.Value;

@Value
public class BuildInFlightStatus {

    boolean localInFlight;
    boolean distributedInFlight;

    public static BuildInFlightStatus of(boolean localInFlight, boolean distributedInFlight) {
        return new BuildInFlightStatus(localInFlight, distributedInFlight);
    }

    public boolean isInFlight() {
        return localInFlight || distributedInFlight;
    }
}
