package com.example.musicstreaming.domain.model;

import com.example.musicstreaming.domain.PlaybackCodec;
import com.example.musicstreaming.domain.SourceFormat;
import com.example.musicstreaming.domain.SourceType;
import com.example.musicstreaming.domain.StreamingQuality;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PlaybackProfileTest {

    @Test
    void shouldPassThroughLosslessSourceAtOriginalQuality() {
        PlaybackProfile profile = PlaybackProfile.resolve(SourceType.LOCAL, StreamingQuality.ORIGINAL,
                "/music/Album/01 Track.FLAC");

        Assertions.assertEquals("dash", profile.getProtocol());
        Assertions.assertEquals(PlaybackCodec.FLAC, profile.getCodec());
        Assertions.assertNull(profile.getBitrateKbps());
    }

    @Test
    void shouldTranscodeLossySourceAtOriginalQuality() {
        PlaybackProfile profile = PlaybackProfile.resolve(SourceType.LOCAL, StreamingQuality.ORIGINAL,
                "/music/Album/01 Track.mp3");

        Assertions.assertEquals(PlaybackCodec.AAC, profile.getCodec());
        Assertions.assertEquals(Integer.valueOf(320), profile.getBitrateKbps());
    }

    @Test
    void shouldTranscodeLosslessSourceBelowOriginalQuality() {
        for (StreamingQuality quality : new StreamingQuality[] {
                StreamingQuality.HIGH, StreamingQuality.MEDIUM, StreamingQuality.LOW}) {
            PlaybackProfile profile = PlaybackProfile.resolve(SourceType.LOCAL, quality, "/music/a.wav");
            Assertions.assertEquals(PlaybackCodec.AAC, profile.getCodec(), quality.getValue());
        }
    }

    @Test
    void shouldClassifyByExtensionOnly() {
        Assertions.assertEquals(SourceFormat.LOSSLESS, SourceFormat.classify("C:\\Music\\song.ape"));
        Assertions.assertEquals(SourceFormat.LOSSLESS, SourceFormat.classify("song.dsf"));
        Assertions.assertEquals(SourceFormat.LOSSY, SourceFormat.classify("/music/flac/song.m4a"));
        Assertions.assertEquals(SourceFormat.LOSSY, SourceFormat.classify("/music/noextension"));
        Assertions.assertEquals(SourceFormat.LOSSY, SourceFormat.classify("/music/trailingdot."));
        Assertions.assertEquals(SourceFormat.LOSSY, SourceFormat.classify(null));
    }

    @Test
    void shouldParseQualityCaseInsensitively() {
        Assertions.assertEquals(StreamingQuality.ORIGINAL, StreamingQuality.fromValue(" Original "));
        Assertions.assertNull(StreamingQuality.fromValue("lossless"));
        Assertions.assertNull(StreamingQuality.fromValue(null));
    }
}
