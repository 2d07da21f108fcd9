package com.livedesk.support.chat.api;

import jakarta.validation.constraints.NotBlank;

public record UnassignConversationRequest(
        @NotBlank(message = "conversation_id_required") String conversation_id
) {
}
