package com.livedesk.support.chat.api;

import java.time.Instant;

public record ActiveConversationItem(
        String conversation_id,
        String customer_id,
        String customer_name,
        String source,
        String assigned_agent_id,
        String assigned_agent_name,
        String last_message,
        String last_message_sender,
        Instant last_message_at,
        Instant started_at
) {
}
