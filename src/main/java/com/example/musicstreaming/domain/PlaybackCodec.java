package com.example.musicstreaming.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlaybackCodec {

    /** Lossless passthrough of the source. */
    FLAC("flac"),
    AAC("aac");

    private final String value;

    PlaybackCodec(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
