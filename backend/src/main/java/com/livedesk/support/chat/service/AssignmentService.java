package com.livedesk.support.chat.service;

import com.livedesk.support.chat.notify.Notification;
import com.livedesk.support.chat.repo.ConversationRepository;
import com.livedesk.support.common.api.ConflictException;
import com.livedesk.support.common.api.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single-agent ownership of a conversation. The write is a conditional update, so two agents racing for the
 * same conversation cannot both win.
 */
@Service
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    private static final int UNASSIGN_ATTEMPTS = 3;

    /**
     * @param changed false when the agent already held the conversation under the same name
     */
    public record AssignmentResult(ConversationRepository.ConversationRow conversation, boolean changed) {
    }

    private final ConversationRepository conversationRepository;
    private final ConversationRouter router;

    public AssignmentService(ConversationRepository conversationRepository, ConversationRouter router) {
        this.conversationRepository = conversationRepository;
        this.router = router;
    }

    public AssignmentResult assign(String conversationId, String agentId, String agentName) {
        var before = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("conversation_not_found"));
        if (!before.isOpen()) {
            throw new ConflictException("conversation_closed");
        }

        var updated = conversationRepository.tryAssign(conversationId, agentId, agentName);
        if (updated == 0) {
            var current = conversationRepository.findById(conversationId)
                    .orElseThrow(() -> new NotFoundException("conversation_not_found"));
            if (!current.isOpen()) {
                throw new ConflictException("conversation_closed");
            }
            log.info("assign_conflict conversation_id={} requested_agent_id={} assigned_agent_id={}",
                    conversationId, agentId, current.assignedAgentId());
            throw new ConflictException("conversation_already_assigned", assigneeDetails(current));
        }

        var after = conversationRepository.findById(conversationId).orElse(before);
        // a new display name from the current holder is a change too
        var changed = !agentId.equals(before.assignedAgentId())
                || !Objects.equals(agentName, before.assignedAgentName());
        if (changed) {
            log.info("conversation_assigned conversation_id={} agent_id={}", conversationId, agentId);
            router.deliver(router.resolveForAssignmentEvent(), new Notification.ConversationAssigned(
                    conversationId, agentId, agentName, Instant.now()));
        }
        return new AssignmentResult(after, changed);
    }

    /**
     * Releases whichever agent currently holds the conversation.
     */
    public ConversationRepository.ConversationRow unassign(String conversationId) {
        for (int attempt = 0; attempt < UNASSIGN_ATTEMPTS; attempt++) {
            var current = conversationRepository.findById(conversationId)
                    .orElseThrow(() -> new NotFoundException("conversation_not_found"));
            if (current.assignedAgentId() == null) {
                throw new ConflictException("conversation_not_assigned");
            }

            if (conversationRepository.tryUnassign(conversationId, current.assignedAgentId()) == 1) {
                log.info("conversation_unassigned conversation_id={} previous_agent_id={}",
                        conversationId, current.assignedAgentId());
                router.deliver(router.resolveForAssignmentEvent(), new Notification.ConversationUnassigned(
                        conversationId, current.assignedAgentId(), current.assignedAgentName(), Instant.now()));
                return conversationRepository.findById(conversationId).orElse(current);
            }
            // reassigned between the read and the update; read again
        }
        throw new ConflictException("conversation_assignment_contended");
    }

    private static Map<String, Object> assigneeDetails(ConversationRepository.ConversationRow current) {
        var details = new LinkedHashMap<String, Object>();
        details.put("assigned_agent_id", current.assignedAgentId());
        details.put("assigned_agent_name", current.assignedAgentName());
        var label = current.assignedAgentName() != null ? current.assignedAgentName() : current.assignedAgentId();
        details.put("message", "Conversation already assigned to " + label);
        return details;
    }
}
