package com.example.musicstreaming.domain.model;

import java.time.Instant;
import lombok.Value;

/**
 * Where a track's audio lives on disk, and when it last changed.
 */
@Value
public class TrackSource {

    Long trackId;
    /** Path as stored for the track, relative to the music root. */
    String filePath;
    /** Absolute path under the music root. */
    String sourcePath;
    Instant fileModified;
}
