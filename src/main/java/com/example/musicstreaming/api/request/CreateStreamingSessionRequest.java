package com.example.musicstreaming.api.request;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import lombok.Data;

@Data
public class CreateStreamingSessionRequest {

    @NotNull(message = "trackId is required")
    @Min(value = 1, message = "trackId must be positive")
    private Long trackId;

    /**
     * original | high | medium | low; falls back to the user's setting when absent.
     */
    @Pattern(regexp = "(?i)original|high|medium|low", message = "desiredQuality must be original, high, medium, or low")
    private String desiredQuality;
}
