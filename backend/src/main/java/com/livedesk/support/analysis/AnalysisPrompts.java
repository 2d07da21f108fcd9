package com.livedesk.support.analysis;

import java.util.Locale;
import java.util.stream.Collectors;

final class AnalysisPrompts {

    static final String NO_KNOWLEDGE = "No highly relevant knowledge base articles found. Provide general guidance.";

    private static final String OUTPUT_SHAPE = """
            {
              "predicted_intent": "string",
              "intent_confidence": 0.0,
              "sentiment": {"label": "positive|neutral|negative", "score": 0.0},
              "detected_entities": [{"text": "string", "label": "string"}],
              "suggestions": {
                "knowledge_base": ["string"],
                "pre_written_response": "string",
                "next_actions": ["string"]
              }
            }""";

    private AnalysisPrompts() {
    }

    static String build(AnalysisRequest request, KnowledgeBaseProperties knowledgeBase) {
        var sb = new StringBuilder();
        sb.append("You are an AI customer support assistant.\n\n");

        sb.append("**Conversation History:**\n");
        if (request.history().isEmpty()) {
            sb.append("(no previous messages)\n");
        } else {
            sb.append(request.history().stream()
                    .map(t -> capitalize(t.sender()) + ": " + nullToEmpty(t.text()))
                    .collect(Collectors.joining("\n")));
            sb.append('\n');
        }
        sb.append('\n');

        switch (request.kind()) {
            case IMAGE -> sb.append("**Latest Customer Message (including image insights):** \"");
            case CALL_TRANSCRIPTION -> sb.append("**Recorded Call Transcription:** \"");
            default -> sb.append("**Latest Customer Message:** \"");
        }
        sb.append(nullToEmpty(request.text())).append("\"\n");

        if (request.extractedText() != null && !request.extractedText().isBlank()) {
            sb.append("\n**OCR Extracted Text:**\n\"").append(request.extractedText()).append("\"\n");
        }

        sb.append("\n**Instructions:**\n");
        var intents = knowledgeBase.intents();
        sb.append("- Predict intent from: ")
                .append(intents.isEmpty() ? GeminiAnalysisClient.DEFAULT_INTENT : String.join(", ", intents))
                .append('\n');
        sb.append("- Sentiment (positive, neutral, negative)\n");
        sb.append("- Entities (e.g., product name, order number, account number, date)\n");
        sb.append("- Suggest pre-written response\n");
        sb.append("- Recommend next actions\n");
        sb.append("- Base knowledge_base suggestions and the pre-written response on the knowledge below\n");

        sb.append("\n**Relevant Knowledge Base:**\n");
        sb.append(knowledgeSection(knowledgeBase, request));
        sb.append("\nRespond with a single JSON object of this shape and nothing else:\n");
        sb.append(OUTPUT_SHAPE).append('\n');
        return sb.toString();
    }

    static String knowledgeSection(KnowledgeBaseProperties knowledgeBase, AnalysisRequest request) {
        var text = nullToEmpty(request.text());
        if (request.extractedText() != null && !request.extractedText().isBlank()) {
            text = text + " " + request.extractedText();
        }
        var topics = knowledgeBase.matching(text);
        if (topics.isEmpty()) {
            return NO_KNOWLEDGE + "\n";
        }
        var sb = new StringBuilder();
        for (var t : topics) {
            sb.append("--- Knowledge for ")
                    .append(t.intent().replace('_', ' ').toUpperCase(Locale.ROOT))
                    .append(" ---\n");
            for (var fact : t.facts()) {
                sb.append(fact).append('\n');
            }
        }
        return sb.toString();
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
