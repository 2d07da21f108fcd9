package com.livedesk.support.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Azure AI Vision Image Analysis 4.0, {@code read} feature.
 */
@Component
public class AzureVisionOcrClient implements OcrClient {

    private static final Logger log = LoggerFactory.getLogger(AzureVisionOcrClient.class);

    private static final String FAILED = "ocr_failed";

    private final OcrProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public AzureVisionOcrClient(OcrProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public Optional<String> extractText(byte[] image, String contentType) {
        if (!properties.configured()) {
            log.warn("ocr_not_configured");
            throw new MediaExtractionException(FAILED);
        }
        if (image == null || image.length == 0) {
            throw new MediaExtractionException(FAILED);
        }

        var endpoint = properties.endpoint().endsWith("/")
                ? properties.endpoint().substring(0, properties.endpoint().length() - 1)
                : properties.endpoint();
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "/computervision/imageanalysis:analyze?api-version=2023-10-01&features=read"))
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .header("Content-Type", "application/octet-stream")
                .header("Ocp-Apim-Subscription-Key", properties.apiKey())
                .POST(HttpRequest.BodyPublishers.ofByteArray(image))
                .build();

        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                log.warn("ocr_http_error status={} content_type={}", resp.statusCode(), contentType);
                throw new MediaExtractionException(FAILED);
            }
            return readLines(objectMapper.readTree(resp.body()));
        } catch (IOException ex) {
            throw new MediaExtractionException(FAILED, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MediaExtractionException(FAILED, ex);
        }
    }

    static Optional<String> readLines(JsonNode root) {
        var lines = new ArrayList<String>();
        for (var block : root.path("readResult").path("blocks")) {
            for (var line : block.path("lines")) {
                var text = line.path("text").asText("").trim();
                if (!text.isEmpty()) lines.add(text);
            }
        }
        if (lines.isEmpty()) return Optional.empty();
        return Optional.of(String.join("\n", lines));
    }
}
