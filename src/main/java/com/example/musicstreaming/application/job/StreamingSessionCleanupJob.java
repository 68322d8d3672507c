package com.example.musicstreaming.application.job;

import com.example.musicstreaming.application.service.StreamingSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StreamingSessionCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(StreamingSessionCleanupJob.class);

    private final StreamingSessionService streamingSessionService;

    public StreamingSessionCleanupJob(StreamingSessionService streamingSessionService) {
        this.streamingSessionService = streamingSessionService;
    }

    @Scheduled(cron = "${app.streaming.session-cleanup-cron:30 * * * * *}")
    public void cleanup() {
        try {
            int removed = streamingSessionService.purgeExpiredSessions();
            if (removed > 0) {
                log.info("Expired streaming sessions removed: {}", removed);
            }
        } catch (Exception e) {
            log.error("Streaming session cleanup failed", e);
        }
    }
}
