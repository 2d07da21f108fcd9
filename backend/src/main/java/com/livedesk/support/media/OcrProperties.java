package com.livedesk.support.media;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.media.ocr")
public record OcrProperties(String endpoint, String apiKey, Integer timeoutSeconds) {
    public OcrProperties {
        if (timeoutSeconds == null || timeoutSeconds <= 0) timeoutSeconds = 20;
    }

    public boolean configured() {
        return endpoint != null && !endpoint.isBlank() && apiKey != null && !apiKey.isBlank();
    }
}
