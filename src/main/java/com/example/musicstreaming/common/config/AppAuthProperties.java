package com.example.musicstreaming.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.auth")
public class AppAuthProperties {

    /**
     * JWT issuer claim, shared by access tokens and streaming session tokens.
     */
    private String issuer = "music-streaming";

    /**
     * JWT audience claim.
     */
    private String audience = "music-streaming-clients";

    /**
     * HMAC secret used for HS256 signatures. Must be at least 32 bytes.
     */
    private String jwtSecret = "changeit-music-streaming-jwt-secret-0123456789";
}
