package com.livedesk.support.chat.api;

import java.time.Instant;

public record AgentMessageResponse(
        String conversation_id,
        String message_id,
        String agent_id,
        String agent_name,
        String text,
        Instant timestamp
) {
}
