package com.livedesk.support.analysis;

import java.util.List;

/**
 * Structured analysis of one customer unit, as shown on the agent dashboard.
 * {@code degraded} is true when the intent is a fallback marker rather than a model answer.
 */
public record AnalysisResult(
        String predicted_intent,
        double intent_confidence,
        Sentiment sentiment,
        List<Entity> detected_entities,
        Suggestions suggestions,
        boolean degraded
) {
    public record Sentiment(String label, double score) {
    }

    public record Entity(String text, String label) {
    }

    public record Suggestions(List<String> knowledge_base, String pre_written_response, List<String> next_actions) {
    }
}
