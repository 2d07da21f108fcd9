package com.livedesk.support.chat.api;

import com.livedesk.support.analysis.AnalysisResult;

import java.time.Instant;

public record AnalyzeMessageResponse(
        String conversation_id,
        String message_id,
        String user_message,
        String image_url,
        String ocr_extracted_text,
        String transcription,
        AnalysisResult analysis,
        Instant timestamp
) {
}
