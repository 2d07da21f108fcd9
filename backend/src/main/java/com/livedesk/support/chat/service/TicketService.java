package com.livedesk.support.chat.service;

import com.livedesk.support.chat.api.TicketItem;
import com.livedesk.support.chat.notify.Notification;
import com.livedesk.support.chat.repo.ConversationRepository;
import com.livedesk.support.chat.repo.TicketRepository;
import com.livedesk.support.common.api.ConflictException;
import com.livedesk.support.common.api.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class TicketService {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    private static final List<String> PRIORITIES = List.of("Low", "Medium", "High", "Urgent");
    private static final String DEFAULT_PRIORITY = "Medium";

    private final TicketRepository ticketRepository;
    private final ConversationRepository conversationRepository;
    private final ConversationRouter router;

    public TicketService(
            TicketRepository ticketRepository,
            ConversationRepository conversationRepository,
            ConversationRouter router
    ) {
        this.ticketRepository = ticketRepository;
        this.conversationRepository = conversationRepository;
        this.router = router;
    }

    public TicketItem create(String conversationId, String agentId, String agentName, String issueDescription, String priority) {
        conversationRepository.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("conversation_not_found"));
        var row = ticketRepository.create(conversationId, agentId, agentName, issueDescription.trim(), normalizePriority(priority));
        log.info("ticket_created ticket_id={} conversation_id={} priority={}", row.id(), conversationId, row.priority());
        return toItem(row);
    }

    public List<TicketItem> listForConversation(String conversationId) {
        conversationRepository.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("conversation_not_found"));
        return ticketRepository.listByConversation(conversationId).stream().map(TicketService::toItem).toList();
    }

    public TicketItem resolve(String ticketId, String agentId, String agentName) {
        var existing = ticketRepository.findById(ticketId)
                .orElseThrow(() -> new NotFoundException("ticket_not_found"));
        if (TicketRepository.STATUS_RESOLVED.equals(existing.status())
                || ticketRepository.tryResolve(ticketId, agentId, agentName) == 0) {
            throw new ConflictException("ticket_already_resolved");
        }

        var resolved = ticketRepository.findById(ticketId).orElse(existing);
        log.info("ticket_resolved ticket_id={} conversation_id={} agent_id={}", ticketId, resolved.conversationId(), agentId);
        router.deliver(router.resolveForTicketEvent(), new Notification.TicketResolved(
                resolved.conversationId(), ticketId, agentId, agentName, Instant.now()));
        return toItem(resolved);
    }

    static String normalizePriority(String priority) {
        if (priority == null || priority.isBlank()) return DEFAULT_PRIORITY;
        for (var p : PRIORITIES) {
            if (p.equalsIgnoreCase(priority.trim())) return p;
        }
        throw new IllegalArgumentException("invalid_priority");
    }

    private static TicketItem toItem(TicketRepository.TicketRow r) {
        return new TicketItem(
                r.id(),
                r.conversationId(),
                r.raisedByAgentId(),
                r.raisedByAgentName(),
                r.issueDescription(),
                r.status(),
                r.priority(),
                r.resolvedByAgentId(),
                r.resolvedByAgentName(),
                r.createdAt(),
                r.updatedAt()
        );
    }
}
