package com.example.musicstreaming.domain.model;

import com.example.musicstreaming.domain.PlaybackCodec;
import com.example.musicstreaming.domain.SourceFormat;
import com.example.musicstreaming.domain.SourceType;
import com.example.musicstreaming.domain.StreamingQuality;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class PlaybackProfile {

    public static final String PROTOCOL_DASH = "dash";
    public static final int TRANSCODED_BITRATE_KBPS = 320;

    private String protocol;
    private SourceType sourceType;
    private PlaybackCodec codec;
    /** Null for lossless passthrough. */
    private Integer bitrateKbps;

    /**
     * Lossless containers requested at original quality pass through untouched; everything else is
     * transcoded to AAC.
     */
    public static PlaybackProfile resolve(SourceType sourceType, StreamingQuality quality, String sourcePath) {
        if (quality == StreamingQuality.ORIGINAL && SourceFormat.classify(sourcePath) == SourceFormat.LOSSLESS) {
            return new PlaybackProfile(PROTOCOL_DASH, sourceType, PlaybackCodec.FLAC, null);
        }
        return new PlaybackProfile(PROTOCOL_DASH, sourceType, PlaybackCodec.AAC, TRANSCODED_BITRATE_KBPS);
    }
}
