package com.example.musicstreaming.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum StreamingQuality {

    ORIGINAL("original"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    StreamingQuality(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return the matching quality, or {@code null} for blank or unknown input
     */
    public static StreamingQuality fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (StreamingQuality quality : values()) {
            if (quality.value.equals(normalized)) {
                return quality;
            }
        }
        return null;
    }
}
