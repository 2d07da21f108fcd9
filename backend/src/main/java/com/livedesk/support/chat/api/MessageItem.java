package com.livedesk.support.chat.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A stored message. {@code analysis} is present for analyzed customer messages only.
 */
public record MessageItem(
        String id,
        String conversation_id,
        String sender,
        String sender_id,
        String sender_name,
        String text,
        String image_url,
        String ocr_extracted_text,
        Analysis analysis,
        Instant timestamp
) {
    public record Analysis(
            String predicted_intent,
            Double intent_confidence,
            String sentiment_label,
            Double sentiment_score,
            JsonNode suggestions,
            JsonNode detected_entities
    ) {
    }
}
