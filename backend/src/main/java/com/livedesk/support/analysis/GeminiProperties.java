package com.livedesk.support.analysis;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.analysis.gemini")
public record GeminiProperties(
        String apiKey,
        String baseUrl,
        String model,
        Integer timeoutSeconds,
        Double temperature
) {
    public GeminiProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://generativelanguage.googleapis.com";
        if (model == null || model.isBlank()) model = "gemini-2.0-flash";
        if (timeoutSeconds == null || timeoutSeconds <= 0) timeoutSeconds = 30;
        if (temperature == null) temperature = 0.2;
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
