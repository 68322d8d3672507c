package com.example.musicstreaming.api.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatResponse {

    private String sessionId;
    private String sessionToken;
    private Instant expiresAt;
}
