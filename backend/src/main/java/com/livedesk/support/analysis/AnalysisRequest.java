package com.livedesk.support.analysis;

import java.util.List;

/**
 * @param text          what the model should read as the latest customer input
 * @param extractedText OCR text for images, null otherwise
 * @param history       prior turns of the conversation, oldest first
 */
public record AnalysisRequest(String text, String extractedText, InputKind kind, List<ConversationTurn> history) {

    public enum InputKind {
        CHAT_TEXT,
        IMAGE,
        CALL_TRANSCRIPTION
    }

    public record ConversationTurn(String sender, String text) {
    }

    public AnalysisRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
