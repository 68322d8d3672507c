package com.example.musicstreaming.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Classification of a source file by container extension. The only place that knows which
 * extensions are lossless.
 */
public enum SourceFormat {

    LOSSLESS,
    LOSSY;

    private static final Set<String> LOSSLESS_EXTENSIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "flac", "wav", "aiff", "aif", "alac", "ape", "wv", "tta", "dff", "dsf")));

    public static SourceFormat classify(String sourcePath) {
        if (sourcePath == null) {
            return LOSSY;
        }
        String normalized = sourcePath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        String fileName = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return LOSSY;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return LOSSLESS_EXTENSIONS.contains(extension) ? LOSSLESS : LOSSY;
    }
}
