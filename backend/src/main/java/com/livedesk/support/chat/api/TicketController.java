package com.livedesk.support.chat.api;

import com.livedesk.support.chat.service.TicketService;
import com.livedesk.support.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class TicketController {

    private final TicketService ticketService;

    public TicketController(TicketService ticketService) {
        this.ticketService = ticketService;
    }

    @PostMapping("/tickets")
    public ApiResponse<TicketItem> create(@Valid @RequestBody CreateTicketRequest req) {
        return ApiResponse.ok(ticketService.create(
                req.conversation_id().trim(),
                req.agent_id().trim(),
                req.agent_name(),
                req.issue_description(),
                req.priority()
        ));
    }

    @GetMapping("/conversations/{id}/tickets")
    public ApiResponse<List<TicketItem>> list(@PathVariable("id") String conversationId) {
        return ApiResponse.ok(ticketService.listForConversation(conversationId));
    }

    @PostMapping("/tickets/{id}/resolve")
    public ApiResponse<TicketItem> resolve(
            @PathVariable("id") String ticketId,
            @Valid @RequestBody ResolveTicketRequest req
    ) {
        return ApiResponse.ok(ticketService.resolve(ticketId, req.agent_id().trim(), req.agent_name()));
    }
}
