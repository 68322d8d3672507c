package com.example.musicstreaming.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.streaming")
public class AppStreamingProperties {

    /**
     * Root directory that track file paths are relative to.
     */
    private String musicPath = "/music";

    /**
     * Root directory for built DASH assets. Shared between pods.
     */
    private String cacheRoot = "/var/cache/music-streaming";

    /**
     * Session record TTL; extended by every heartbeat.
     */
    private long sessionTtlSeconds = 300;

    /**
     * Wall-clock lifetime of a minted session token.
     */
    private long tokenTtlSeconds = 300;

    /**
     * Budget of one readiness phase (manifest file, startup window, segment file).
     */
    private long assetReadyTimeoutMs = 20_000;

    private long assetPollIntervalMs = 75;

    /**
     * Upper bound of readiness waits polling at the same time. Each wait holds one thread.
     */
    private int assetWaitMaxConcurrency = 256;

    /**
     * How long a positive segment readiness check is remembered per session and segment.
     */
    private long segmentReadyMicrocacheTtlMs = 1_500;

    /**
     * Minimum number of timeline entries every required representation must declare.
     */
    private int startupMinTimelineSegments = 3;

    /**
     * Number of leading chunk files every required representation must have on disk.
     */
    private int startupChunkCount = 3;

    /**
     * Quality used when neither the request nor the user settings name one.
     */
    private String defaultQuality = "medium";

    /**
     * Manifest shape requested for new sessions: startup_single or steady_state_dual.
     */
    private String manifestProfile = "startup_single";

    /**
     * How long a terminal build failure is reported before it is forgotten.
     */
    private long buildFailureTtlMs = 60_000;

    /**
     * Bump to invalidate every cache key after a layout change.
     */
    private String cacheSchemaVersion = "dash-v2";

    private String ffmpegPath = "ffmpeg";

    private int segmentDurationSeconds = 4;

    private long buildTimeoutSeconds = 600;

    /**
     * TTL of the cross-pod build lock; must outlive a normal build.
     */
    private long buildLockTtlSeconds = 900;

    /**
     * Use Redis for the cross-pod build lock. When false builds are coordinated per process only.
     */
    private boolean redisBuildLockEnabled = false;

    private double cacheMaxGb = 10D;

    private long cachePruneMinAgeMs = 600_000;

    private double cachePruneTargetRatio = 0.8D;

    /**
     * Cron for the segment cache prune job.
     */
    private String cachePruneCron = "0 */10 * * * *";

    /**
     * Cron for the expired-session sweep.
     */
    private String sessionCleanupCron = "30 * * * * *";
}
