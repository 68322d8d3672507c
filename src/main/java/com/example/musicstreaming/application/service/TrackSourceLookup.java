package com.example.musicstreaming.application.service;

import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.domain.model.TrackSource;
import com.example.musicstreaming.infrastructure.persistence.entity.TrackEntity;
import com.example.musicstreaming.infrastructure.persistence.mapper.TrackMapper;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves a track to its source file under the music root.
 */
@Service
public class TrackSourceLookup {

    private final TrackMapper trackMapper;
    private final AppStreamingProperties streamingProperties;

    public TrackSourceLookup(TrackMapper trackMapper, AppStreamingProperties streamingProperties) {
        this.trackMapper = trackMapper;
        this.streamingProperties = streamingProperties;
    }

    /**
     * @return the live track row, or {@code null} when missing or soft-deleted
     */
    public TrackEntity findTrack(Long trackId) {
        if (trackId == null || trackId <= 0) {
            return null;
        }
        TrackEntity track = trackMapper.selectById(trackId);
        if (track == null || (track.getIsDeleted() != null && track.getIsDeleted() == 1)) {
            return null;
        }
        return track;
    }

    /**
     * @return the source description, or {@code null} when the track has no usable local file
     */
    public TrackSource toSource(TrackEntity track) {
        if (track == null || !StringUtils.hasText(track.getFilePath()) || track.getFileModified() == null) {
            return null;
        }
        String normalizedFilePath = track.getFilePath().replace('\\', '/');
        while (normalizedFilePath.startsWith("/")) {
            normalizedFilePath = normalizedFilePath.substring(1);
        }
        Path root = Paths.get(streamingProperties.getMusicPath()).toAbsolutePath().normalize();
        Path sourcePath = root.resolve(normalizedFilePath).normalize();
        if (!sourcePath.startsWith(root)) {
            return null;
        }
        return new TrackSource(
                track.getId(),
                track.getFilePath(),
                sourcePath.toString(),
                track.getFileModified().toInstant(ZoneOffset.UTC));
    }

    public TrackSource findTrackSource(Long trackId) {
        return toSource(findTrack(trackId));
    }
}
