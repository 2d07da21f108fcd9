package com.livedesk.support.chat.api;

import jakarta.validation.constraints.NotBlank;

public record ResolveTicketRequest(
        @NotBlank(message = "agent_id_required") String agent_id,
        String agent_name
) {
}
