package com.livedesk.support.chat.api;

import com.livedesk.support.chat.service.AssignmentService;
import com.livedesk.support.chat.service.ConversationQueryService;
import com.livedesk.support.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class ConversationController {

    private final AssignmentService assignmentService;
    private final ConversationQueryService queryService;

    public ConversationController(AssignmentService assignmentService, ConversationQueryService queryService) {
        this.assignmentService = assignmentService;
        this.queryService = queryService;
    }

    @PostMapping("/assign-conversation")
    public ApiResponse<AssignmentResponse> assign(@Valid @RequestBody AssignConversationRequest req) {
        var result = assignmentService.assign(req.conversation_id().trim(), req.agent_id().trim(), req.agent_name().trim());
        var c = result.conversation();
        return ApiResponse.ok(new AssignmentResponse(c.id(), c.assignedAgentId(), c.assignedAgentName(), result.changed()));
    }

    @PostMapping("/unassign-conversation")
    public ApiResponse<AssignmentResponse> unassign(@Valid @RequestBody UnassignConversationRequest req) {
        var c = assignmentService.unassign(req.conversation_id().trim());
        return ApiResponse.ok(new AssignmentResponse(c.id(), c.assignedAgentId(), c.assignedAgentName(), true));
    }

    @GetMapping("/conversations/active")
    public ApiResponse<List<ActiveConversationItem>> active() {
        return ApiResponse.ok(queryService.listActive());
    }

    @GetMapping("/chat-history/conversation/{id}")
    public ApiResponse<List<MessageItem>> conversationHistory(@PathVariable("id") String conversationId) {
        return ApiResponse.ok(queryService.historyForConversation(conversationId));
    }

    @GetMapping("/chat-history/user/{userId}")
    public ApiResponse<List<MessageItem>> customerHistory(@PathVariable("userId") String customerId) {
        return ApiResponse.ok(queryService.historyForCustomer(customerId));
    }
}
