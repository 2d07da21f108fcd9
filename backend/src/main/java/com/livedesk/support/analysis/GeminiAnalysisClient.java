package com.livedesk.support.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Calls the Gemini {@code generateContent} REST endpoint and maps its JSON answer to an {@link AnalysisResult}.
 */
@Component
public class GeminiAnalysisClient implements AnalysisClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiAnalysisClient.class);

    static final String DEFAULT_INTENT = "unclear_intent";
    static final String DEFAULT_RESPONSE =
            "I'm sorry, I couldn't generate a specific response at this moment. Please check the customer's query and the available knowledge base.";

    private final GeminiProperties properties;
    private final KnowledgeBaseProperties knowledgeBase;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public GeminiAnalysisClient(
            GeminiProperties properties,
            KnowledgeBaseProperties knowledgeBase,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.knowledgeBase = knowledgeBase;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public AnalysisOutcome analyze(AnalysisRequest request) {
        if (!properties.configured()) {
            return AnalysisOutcome.failure(AnalysisFailure.UNAVAILABLE, "api_key_missing");
        }

        String raw;
        try {
            raw = generate(AnalysisPrompts.build(request, knowledgeBase));
        } catch (IOException ex) {
            log.warn("gemini_call_failed model={} error={}", properties.model(), ex.toString());
            return AnalysisOutcome.failure(AnalysisFailure.API_ERROR, ex.toString());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return AnalysisOutcome.failure(AnalysisFailure.API_ERROR, "interrupted");
        } catch (GeminiResponseException ex) {
            log.warn("gemini_bad_response model={} reason={}", properties.model(), ex.getMessage());
            return AnalysisOutcome.failure(AnalysisFailure.API_ERROR, ex.getMessage());
        }

        return parseAnalysis(raw);
    }

    private String generate(String prompt) throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents")
                .addObject()
                .put("role", "user")
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        body.putObject("generationConfig")
                .put("temperature", properties.temperature())
                .put("topP", 0.95)
                .put("topK", 40)
                .put("responseMimeType", "application/json");

        var model = URLEncoder.encode(properties.model(), StandardCharsets.UTF_8);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(properties.baseUrl()) + "/v1beta/models/" + model + ":generateContent"))
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", properties.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

        HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new GeminiResponseException("http_" + resp.statusCode());
        }

        JsonNode root = objectMapper.readTree(resp.body());
        JsonNode parts = root.at("/candidates/0/content/parts");
        if (!parts.isArray() || parts.isEmpty()) {
            // blocked by safety settings, or an empty answer
            throw new GeminiResponseException("no_candidates");
        }
        var out = new StringBuilder();
        for (var part : parts) {
            out.append(part.path("text").asText(""));
        }
        return out.toString();
    }

    /**
     * Missing fields fall back to neutral defaults; anything that is not a JSON object is malformed.
     */
    AnalysisOutcome parseAnalysis(String raw) {
        var cleaned = stripFence(raw);
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException ex) {
            log.warn("gemini_output_unparseable error={}", ex.getOriginalMessage());
            return AnalysisOutcome.failure(AnalysisFailure.MALFORMED_OUTPUT, ex.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return AnalysisOutcome.failure(AnalysisFailure.MALFORMED_OUTPUT, "not_an_object");
        }

        var sentimentNode = root.path("sentiment");
        var sentiment = sentimentNode.isObject()
                ? new AnalysisResult.Sentiment(
                        sentimentNode.path("label").asText("NEUTRAL"),
                        sentimentNode.path("score").asDouble(0.5))
                : new AnalysisResult.Sentiment("NEUTRAL", 0.5);

        var entities = new ArrayList<AnalysisResult.Entity>();
        for (var e : root.path("detected_entities")) {
            if (!e.isObject()) continue;
            var text = e.path("text").asText("");
            if (text.isBlank()) continue;
            entities.add(new AnalysisResult.Entity(text, e.path("label").asText("")));
        }

        var s = root.path("suggestions");
        var suggestions = new AnalysisResult.Suggestions(
                textList(s.path("knowledge_base")),
                s.path("pre_written_response").asText(DEFAULT_RESPONSE),
                textList(s.path("next_actions"))
        );

        var intent = root.path("predicted_intent").asText("");
        return AnalysisOutcome.success(new AnalysisResult(
                intent.isBlank() ? DEFAULT_INTENT : intent,
                root.path("intent_confidence").asDouble(0.5),
                sentiment,
                List.copyOf(entities),
                suggestions,
                false
        ));
    }

    static String stripFence(String raw) {
        if (raw == null) return "";
        var s = raw.strip();
        if (s.startsWith("```json")) {
            s = s.substring("```json".length());
        } else if (s.startsWith("```")) {
            s = s.substring(3);
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.strip();
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        var out = new ArrayList<String>();
        for (var n : node) {
            if (n.isValueNode()) out.add(n.asText());
        }
        return List.copyOf(out);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    static final class GeminiResponseException extends RuntimeException {
        GeminiResponseException(String reason) {
            super(reason);
        }
    }
}
