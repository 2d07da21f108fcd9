package com.livedesk.support.chat.api;

import java.time.Instant;

public record TicketItem(
        String id,
        String conversation_id,
        String raised_by_agent_id,
        String raised_by_agent_name,
        String issue_description,
        String status,
        String priority,
        String resolved_by_agent_id,
        String resolved_by_agent_name,
        Instant created_at,
        Instant updated_at
) {
}
