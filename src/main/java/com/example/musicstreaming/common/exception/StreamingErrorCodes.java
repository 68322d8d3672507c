package com.example.musicstreaming.common.exception;

/**
 * Machine-readable error codes returned by the segmented streaming endpoints.
 */
public final class StreamingErrorCodes {

    /** Deadline elapsed before the asset became ready. Clients retry with backoff. */
    public static final String ASSET_NOT_READY = "STREAMING_ASSET_NOT_READY";
    /** The build engine recorded a terminal failure for the cache key. */
    public static final String ASSET_BUILD_FAILED = "STREAMING_ASSET_BUILD_FAILED";

    public static final String SESSION_TOKEN_INVALID = "STREAMING_SESSION_TOKEN_INVALID";
    public static final String SESSION_TOKEN_EXPIRED = "STREAMING_SESSION_TOKEN_EXPIRED";
    public static final String SESSION_TOKEN_SCOPE_MISMATCH = "STREAMING_SESSION_TOKEN_SCOPE_MISMATCH";
    public static final String SESSION_NOT_FOUND = "STREAMING_SESSION_NOT_FOUND";
    public static final String SIGNING_FAILED = "STREAMING_SIGNING_FAILED";

    public static final String TRACK_NOT_FOUND = "TRACK_NOT_FOUND";
    public static final String TRACK_NOT_LOCALLY_AVAILABLE = "TRACK_NOT_LOCALLY_AVAILABLE";
    public static final String TRACK_SOURCE_MISSING = "TRACK_SOURCE_MISSING";

    public static final String INVALID_SEGMENT_NAME = "INVALID_SEGMENT_NAME";
    public static final String INVALID_SEGMENT_PATH = "INVALID_SEGMENT_PATH";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    private StreamingErrorCodes() {
    }
}
