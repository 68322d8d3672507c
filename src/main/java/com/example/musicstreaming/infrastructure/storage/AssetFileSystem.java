package com.example.musicstreaming.infrastructure.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * File access used by readiness checks. Built assets may be written by another pod onto shared storage.
 */
public interface AssetFileSystem {

    boolean exists(Path path);

    String readString(Path path) throws IOException;
}
