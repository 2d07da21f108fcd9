package com.livedesk.support.chat.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTicketRequest(
        @NotBlank(message = "conversation_id_required") String conversation_id,
        @NotBlank(message = "agent_id_required") String agent_id,
        String agent_name,
        @NotBlank(message = "issue_description_required")
        @Size(max = 4000, message = "issue_description_too_long") String issue_description,
        String priority
) {
}
