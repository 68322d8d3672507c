package com.example.musicstreaming;

import com.example.musicstreaming.common.config.AppAuthProperties;
import com.example.musicstreaming.common.config.AppStreamingProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.musicstreaming.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppAuthProperties.class,
        AppStreamingProperties.class
})
public class MusicStreamingApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicStreamingApplication.class, args);
    }
}
