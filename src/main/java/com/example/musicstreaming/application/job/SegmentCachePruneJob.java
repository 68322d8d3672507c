package com.example.musicstreaming.application.job;

import com.example.musicstreaming.infrastructure.cache.SegmentCachePruner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SegmentCachePruneJob {

    private static final Logger log = LoggerFactory.getLogger(SegmentCachePruneJob.class);

    private final SegmentCachePruner segmentCachePruner;

    public SegmentCachePruneJob(SegmentCachePruner segmentCachePruner) {
        this.segmentCachePruner = segmentCachePruner;
    }

    @Scheduled(cron = "${app.streaming.cache-prune-cron:0 */10 * * * *}")
    public void prune() {
        try {
            SegmentCachePruner.PruneResult result = segmentCachePruner.prune();
            log.debug("Segment cache prune finished: {}", result);
        } catch (Exception e) {
            log.error("Segment cache prune failed", e);
        }
    }
}
