package com.livedesk.support.chat.api;

import jakarta.validation.constraints.NotBlank;

public record AnalyzeMessageRequest(
        @NotBlank(message = "customer_id_required") String customer_id,
        @NotBlank(message = "customer_name_required") String customer_name,
        @NotBlank(message = "text_required") String text
) {
}
