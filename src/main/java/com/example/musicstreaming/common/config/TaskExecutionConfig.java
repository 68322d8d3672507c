package com.example.musicstreaming.common.config;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private final List<ExecutorService> executors = new ArrayList<>();

    /**
     * Runs readiness poll loops. One task per distinct manifest or segment wait.
     * <p>
     * Hand-off pool: a wait never queues behind another wait's poll loop. Submissions beyond
     * {@code assetWaitMaxConcurrency} are rejected.
     */
    @Bean
    public ExecutorService assetWaitExecutor(AppStreamingProperties streamingProperties) {
        int max = Math.max(1, streamingProperties.getAssetWaitMaxConcurrency());
        return register(new ThreadPoolExecutor(
                0,
                max,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new NamedThreadFactory("asset-wait-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    @Bean
    public ExecutorService dashBuildExecutor() {
        int core = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors() / 2));
        return register(new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(256),
                new NamedThreadFactory("dash-build-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    @Bean
    public ExecutorService playbackRepairExecutor() {
        return register(new ThreadPoolExecutor(
                1,
                2,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(64),
                new NamedThreadFactory("playback-repair-"),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    @PreDestroy
    public void shutdown() {
        for (ExecutorService executor : executors) {
            executor.shutdown();
        }
    }

    private ExecutorService register(ExecutorService executor) {
        executors.add(executor);
        return executor;
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
