package com.example.musicstreaming.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SourceType {

    LOCAL("local"),
    REMOTE("remote");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SourceType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SourceType sourceType : values()) {
            if (sourceType.value.equals(normalized)) {
                return sourceType;
            }
        }
        return null;
    }
}
