package com.example.musicstreaming.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class PlaybackErrorReportRequest {

    @NotBlank(message = "sessionId is required")
    @Size(max = 128)
    private String sessionId;

    private Long trackId;

    /**
     * local | remote
     */
    @NotBlank(message = "sourceType is required")
    private String sourceType;

    @Size(max = 64)
    private String errorCode;

    @Size(max = 512)
    private String message;
}
