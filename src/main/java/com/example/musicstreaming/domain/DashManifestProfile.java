package com.example.musicstreaming.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Manifest shape a build produces. Each profile knows which representations a player needs
 * before it can start; other representations in the same document never gate startup.
 */
public enum DashManifestProfile {

    STARTUP_SINGLE("startup_single", Collections.singletonList("0")),
    STEADY_STATE_DUAL("steady_state_dual", Arrays.asList("0", "1"));

    private final String value;
    private final List<String> requiredRepresentationIds;

    DashManifestProfile(String value, List<String> requiredRepresentationIds) {
        this.value = value;
        this.requiredRepresentationIds = Collections.unmodifiableList(requiredRepresentationIds);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public List<String> getRequiredRepresentationIds() {
        return requiredRepresentationIds;
    }

    public static DashManifestProfile fromValue(String raw, DashManifestProfile fallback) {
        if (raw == null) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DashManifestProfile profile : values()) {
            if (profile.value.equals(normalized)) {
                return profile;
            }
        }
        return fallback;
    }
}
