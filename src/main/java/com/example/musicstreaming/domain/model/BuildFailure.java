package com.example.musicstreaming.domain.model;

import lombok.Value;

@Value
public class BuildFailure {

    String message;
    long failedAtEpochMs;
}
