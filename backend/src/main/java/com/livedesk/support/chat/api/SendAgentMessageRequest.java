package com.livedesk.support.chat.api;

import jakarta.validation.constraints.NotBlank;

public record SendAgentMessageRequest(
        @NotBlank(message = "conversation_id_required") String conversation_id,
        @NotBlank(message = "agent_id_required") String agent_id,
        @NotBlank(message = "agent_name_required") String agent_name,
        @NotBlank(message = "message_required") String message
) {
}
