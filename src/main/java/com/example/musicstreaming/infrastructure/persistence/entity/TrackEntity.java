package com.example.musicstreaming.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class TrackEntity {

    private Long id;

    /** Path relative to the music root. */
    private String filePath;

    private LocalDateTime fileModified;

    private String title;

    private String artist;

    private String album;

    private Integer durationSec;

    private Integer isDeleted;
}
