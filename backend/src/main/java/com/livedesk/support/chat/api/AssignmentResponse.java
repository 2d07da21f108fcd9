package com.livedesk.support.chat.api;

public record AssignmentResponse(
        String conversation_id,
        String assigned_agent_id,
        String assigned_agent_name,
        boolean changed
) {
}
