package com.livedesk.support.chat.api;

import jakarta.validation.constraints.NotBlank;

public record AssignConversationRequest(
        @NotBlank(message = "conversation_id_required") String conversation_id,
        @NotBlank(message = "agent_id_required") String agent_id,
        @NotBlank(message = "agent_name_required") String agent_name
) {
}
