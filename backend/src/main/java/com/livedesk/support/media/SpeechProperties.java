package com.livedesk.support.media;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.media.speech")
public record SpeechProperties(String region, String apiKey, String language, Integer timeoutSeconds) {
    public SpeechProperties {
        if (language == null || language.isBlank()) language = "en-US";
        if (timeoutSeconds == null || timeoutSeconds <= 0) timeoutSeconds = 60;
    }

    public boolean configured() {
        return region != null && !region.isBlank() && apiKey != null && !apiKey.isBlank();
    }
}
