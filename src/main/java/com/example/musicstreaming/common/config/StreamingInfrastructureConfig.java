package com.example.musicstreaming.common.config;

import com.example.musicstreaming.common.util.Sleeper;
import com.example.musicstreaming.infrastructure.lock.DashBuildLock;
import com.example.musicstreaming.infrastructure.lock.ProcessLocalDashBuildLock;
import com.example.musicstreaming.infrastructure.lock.RedisDashBuildLock;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class StreamingInfrastructureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.streaming", name = "redis-build-lock-enabled", havingValue = "true")
    public DashBuildLock redisDashBuildLock(StringRedisTemplate redisTemplate,
                                            AppStreamingProperties streamingProperties) {
        return new RedisDashBuildLock(redisTemplate, Duration.ofSeconds(streamingProperties.getBuildLockTtlSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean(DashBuildLock.class)
    public DashBuildLock processLocalDashBuildLock() {
        return new ProcessLocalDashBuildLock();
    }
}
