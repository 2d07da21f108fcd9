package com.livedesk.support.chat.ws;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "app.ws")
public record WsProperties(
        Integer sendTimeLimitMs,
        Integer bufferSizeLimitBytes,
        List<String> allowedOrigins
) {
    public WsProperties {
        if (sendTimeLimitMs == null || sendTimeLimitMs <= 0) sendTimeLimitMs = 10_000;
        if (bufferSizeLimitBytes == null || bufferSizeLimitBytes <= 0) bufferSizeLimitBytes = 512 * 1024;
        if (allowedOrigins == null || allowedOrigins.isEmpty()) allowedOrigins = List.of("*");
    }
}
