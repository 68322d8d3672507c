package com.example.musicstreaming.infrastructure.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

@Component
public class LocalAssetFileSystem implements AssetFileSystem {

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public String readString(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }
}
