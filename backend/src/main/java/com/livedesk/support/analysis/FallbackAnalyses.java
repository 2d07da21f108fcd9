package com.livedesk.support.analysis;

import java.util.List;

/**
 * Canned analyses substituted when the model cannot be used. Agents see the marker intent and handle the message manually.
 */
public final class FallbackAnalyses {

    private FallbackAnalyses() {
    }

    public static AnalysisResult forFailure(AnalysisFailure kind, AnalysisRequest.InputKind inputKind) {
        return switch (kind) {
            case UNAVAILABLE -> degraded(kind,
                    "System error: AI model not loaded. Please check server logs.",
                    "I apologize, the AI assistant is currently experiencing technical difficulties. Please proceed manually.",
                    List.of("Inform customer about AI issue.", "Provide manual assistance."));
            case MALFORMED_OUTPUT -> degraded(kind,
                    "AI response format error. Please check AI logs.",
                    "I apologize, there was an issue processing the AI's response. Please handle this request manually.",
                    List.of("Review AI output format.", "Manually assist customer."));
            case API_ERROR -> degraded(kind,
                    "Error contacting AI service. Please check network/API status.",
                    inputKind == AnalysisRequest.InputKind.IMAGE
                            ? "I apologize, there was an issue processing the image with the AI service. Please try again or provide manual assistance."
                            : "I apologize, there was an issue connecting to the AI service. Please try again or provide manual assistance.",
                    List.of("Check AI service logs.", "Provide manual assistance."));
        };
    }

    private static AnalysisResult degraded(AnalysisFailure kind, String kbHint, String response, List<String> nextActions) {
        return new AnalysisResult(
                kind.marker(),
                0.0,
                new AnalysisResult.Sentiment("UNKNOWN", 0.0),
                List.of(),
                new AnalysisResult.Suggestions(List.of(kbHint), response, nextActions),
                true
        );
    }
}
