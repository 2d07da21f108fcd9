package com.livedesk.support.media;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Azure Speech short-audio REST recognition. Only WAV (PCM 16 kHz mono) and OGG/Opus are accepted by the service.
 */
@Component
public class AzureSpeechTranscriptionClient implements TranscriptionClient {

    private static final Logger log = LoggerFactory.getLogger(AzureSpeechTranscriptionClient.class);

    private static final String FAILED = "transcription_failed";

    private final SpeechProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public AzureSpeechTranscriptionClient(SpeechProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public Optional<String> transcribe(byte[] audio, String filename) {
        if (!properties.configured()) {
            log.warn("speech_not_configured");
            throw new MediaExtractionException(FAILED);
        }
        if (audio == null || audio.length == 0) {
            throw new MediaExtractionException(FAILED);
        }

        var url = "https://" + properties.region() + ".stt.speech.microsoft.com"
                + "/speech/recognition/conversation/cognitiveservices/v1"
                + "?language=" + URLEncoder.encode(properties.language(), StandardCharsets.UTF_8)
                + "&format=simple";
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .header("Content-Type", contentTypeFor(filename))
                .header("Accept", "application/json")
                .header("Ocp-Apim-Subscription-Key", properties.apiKey())
                .POST(HttpRequest.BodyPublishers.ofByteArray(audio))
                .build();

        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                log.warn("speech_http_error status={} filename={}", resp.statusCode(), filename);
                throw new MediaExtractionException(FAILED);
            }
            var root = objectMapper.readTree(resp.body());
            var status = root.path("RecognitionStatus").asText("");
            switch (status) {
                case "Success" -> {
                    var text = root.path("DisplayText").asText("").trim();
                    return text.isEmpty() ? Optional.empty() : Optional.of(text);
                }
                case "NoMatch", "InitialSilenceTimeout", "BabbleTimeout" -> {
                    return Optional.empty();
                }
                default -> {
                    log.warn("speech_recognition_failed status={} filename={}", status, filename);
                    throw new MediaExtractionException(FAILED);
                }
            }
        } catch (IOException ex) {
            throw new MediaExtractionException(FAILED, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MediaExtractionException(FAILED, ex);
        }
    }

    static String contentTypeFor(String filename) {
        var name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".ogg") || name.endsWith(".opus")) {
            return "audio/ogg; codecs=opus";
        }
        return "audio/wav; codecs=audio/pcm; samplerate=16000";
    }
}
