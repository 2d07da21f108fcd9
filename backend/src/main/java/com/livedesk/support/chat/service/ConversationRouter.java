package com.livedesk.support.chat.service;

import com.livedesk.support.chat.notify.Notification;
import com.livedesk.support.chat.repo.ConversationRepository;
import com.livedesk.support.chat.ws.ChannelAudience;
import com.livedesk.support.chat.ws.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides who receives each notification and pushes it through the {@link ConnectionRegistry}.
 * Delivery is best-effort: nothing here throws back into the caller.
 */
@Service
public class ConversationRouter {

    private static final Logger log = LoggerFactory.getLogger(ConversationRouter.class);

    /**
     * A live-channel target. A null identity means every identity of the audience.
     */
    public record Destination(ChannelAudience audience, String identity) {

        public static Destination everyone(ChannelAudience audience) {
            return new Destination(audience, null);
        }

        public static Destination identity(ChannelAudience audience, String identity) {
            return new Destination(audience, identity);
        }

        public boolean isBroadcast() {
            return identity == null;
        }
    }

    private final ConversationRepository conversationRepository;
    private final ConnectionRegistry connectionRegistry;

    public ConversationRouter(ConversationRepository conversationRepository, ConnectionRegistry connectionRegistry) {
        this.conversationRepository = conversationRepository;
        this.connectionRegistry = connectionRegistry;
    }

    public List<Destination> resolveForCustomerMessage(ConversationRepository.ConversationRow conversation) {
        return List.of(Destination.everyone(ChannelAudience.AGENT));
    }

    public List<Destination> resolveForCustomerEcho(ConversationRepository.ConversationRow conversation) {
        return List.of(Destination.identity(ChannelAudience.CUSTOMER, conversation.customerId()));
    }

    /**
     * The owning customer plus every agent dashboard. An unknown conversation resolves to nothing.
     */
    public List<Destination> resolveForAgentMessage(String conversationId) {
        var conversation = conversationRepository.findById(conversationId).orElse(null);
        if (conversation == null) {
            log.warn("route_conversation_missing conversation_id={}", conversationId);
            return List.of();
        }
        return List.of(
                Destination.identity(ChannelAudience.CUSTOMER, conversation.customerId()),
                Destination.everyone(ChannelAudience.AGENT)
        );
    }

    public List<Destination> resolveForAssignmentEvent() {
        return List.of(Destination.everyone(ChannelAudience.AGENT));
    }

    public List<Destination> resolveForTicketEvent() {
        return List.of(Destination.everyone(ChannelAudience.AGENT));
    }

    /**
     * @return total channels written to
     */
    public int deliver(List<Destination> destinations, Notification notification) {
        int delivered = 0;
        for (var d : destinations) {
            try {
                delivered += d.isBroadcast()
                        ? connectionRegistry.broadcast(d.audience(), notification)
                        : connectionRegistry.sendToIdentity(d.audience(), d.identity(), notification);
            } catch (RuntimeException ex) {
                log.warn("notify_failed type={} conversation_id={} audience={} identity={} error={}",
                        notification.type(), notification.conversation_id(), d.audience().wireName(), d.identity(),
                        ex.toString());
            }
        }
        log.debug("notify_delivered type={} conversation_id={} channels={}",
                notification.type(), notification.conversation_id(), delivered);
        return delivered;
    }
}
