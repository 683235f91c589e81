package com.example.ample.common.config;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.lastfm")
public class AppLastFmProperties {

    @NotBlank
    private String apiRoot = "https://ws.audioscrobbler.com/2.0/";

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 15000;

    /**
     * Session bootstrap attempts before scrobbling is disabled for this run.
     */
    @Min(1)
    private int bootstrapAttempts = 10;

    private long bootstrapBackoffMs = 1000;

    private String userAgent = "ample-scrobbler/0.1";
}
