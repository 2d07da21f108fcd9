package com.livedesk.support.chat.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livedesk.support.chat.api.ActiveConversationItem;
import com.livedesk.support.chat.api.MessageItem;
import com.livedesk.support.chat.repo.ConversationRepository;
import com.livedesk.support.chat.repo.MessageRepository;
import com.livedesk.support.common.api.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ConversationQueryService {

    private static final Logger log = LoggerFactory.getLogger(ConversationQueryService.class);

    private static final int ACTIVE_LIMIT = 200;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final ObjectMapper objectMapper;

    public ConversationQueryService(
            ConversationRepository conversationRepository,
            MessageRepository messageRepository,
            ObjectMapper objectMapper
    ) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.objectMapper = objectMapper;
    }

    public List<ActiveConversationItem> listActive() {
        return conversationRepository.listOpen(ACTIVE_LIMIT).stream()
                .map(r -> new ActiveConversationItem(
                        r.conversation().id(),
                        r.conversation().customerId(),
                        r.customerName(),
                        r.conversation().source(),
                        r.conversation().assignedAgentId(),
                        r.conversation().assignedAgentName(),
                        preview(r.lastMessage()),
                        r.lastMessageSender(),
                        r.lastMessageAt(),
                        r.conversation().startedAt()
                ))
                .toList();
    }

    public List<MessageItem> historyForConversation(String conversationId) {
        conversationRepository.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("conversation_not_found"));
        return toItems(messageRepository.listByConversation(conversationId));
    }

    /**
     * Messages of the customer's current open conversation; empty when there is none.
     */
    public List<MessageItem> historyForCustomer(String customerId) {
        return conversationRepository.findCurrentOpen(customerId)
                .map(c -> toItems(messageRepository.listByConversation(c.id())))
                .orElseGet(List::of);
    }

    private List<MessageItem> toItems(List<MessageRepository.MessageRow> rows) {
        return rows.stream().map(this::toItem).toList();
    }

    private MessageItem toItem(MessageRepository.MessageRow r) {
        MessageItem.Analysis analysis = null;
        if (r.predictedIntent() != null) {
            analysis = new MessageItem.Analysis(
                    r.predictedIntent(),
                    r.intentConfidence(),
                    r.sentimentLabel(),
                    r.sentimentScore(),
                    readJson(r.id(), r.suggestionsJson()),
                    readJson(r.id(), r.entitiesJson())
            );
        }
        var imageUrl = r.mediaRef() != null && r.mediaRef().startsWith("data:") ? r.mediaRef() : null;
        return new MessageItem(
                r.id(),
                r.conversationId(),
                r.sender(),
                r.senderId(),
                r.senderName(),
                r.text(),
                imageUrl,
                imageUrl == null ? null : r.extractedText(),
                analysis,
                r.createdAt()
        );
    }

    private JsonNode readJson(String messageId, String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            // history must still load when one stored analysis is unreadable
            log.warn("stored_analysis_unreadable message_id={} error={}", messageId, ex.getOriginalMessage());
            return null;
        }
    }

    private static String preview(String s) {
        if (s == null) return null;
        var trimmed = s.replaceAll("\\s+", " ").trim();
        return trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed;
    }
}
