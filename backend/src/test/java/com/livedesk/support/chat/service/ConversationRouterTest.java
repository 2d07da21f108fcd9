package com.livedesk.support.chat.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livedesk.support.chat.notify.Notification;
import com.livedesk.support.chat.repo.ConversationRepository;
import com.livedesk.support.chat.ws.ChannelAudience;
import com.livedesk.support.chat.ws.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationRouterTest {

    private ConversationRepository conversationRepository;
    private ConnectionRegistry connectionRegistry;
    private ConversationRouter router;

    private final ConversationRepository.ConversationRow conversation = new ConversationRepository.ConversationRow(
            "c_1", "U1", "open", "live_chat", null, null, Instant.now());

    @BeforeEach
    void setUp() {
        conversationRepository = mock(ConversationRepository.class);
        connectionRegistry = mock(ConnectionRegistry.class);
        router = new ConversationRouter(conversationRepository, connectionRegistry);
    }

    @Test
    void customer_message_goes_to_all_agents_and_echo_to_owner() {
        assertThat(router.resolveForCustomerMessage(conversation))
                .containsExactly(ConversationRouter.Destination.everyone(ChannelAudience.AGENT));
        assertThat(router.resolveForCustomerEcho(conversation))
                .containsExactly(ConversationRouter.Destination.identity(ChannelAudience.CUSTOMER, "U1"));
    }

    @Test
    void agent_message_goes_to_owner_and_agents() {
        when(conversationRepository.findById("c_1")).thenReturn(Optional.of(conversation));

        assertThat(router.resolveForAgentMessage("c_1")).containsExactly(
                ConversationRouter.Destination.identity(ChannelAudience.CUSTOMER, "U1"),
                ConversationRouter.Destination.everyone(ChannelAudience.AGENT)
        );
    }

    @Test
    void agent_message_for_unknown_conversation_has_no_destinations() {
        when(conversationRepository.findById("missing")).thenReturn(Optional.empty());

        assertThat(router.resolveForAgentMessage("missing")).isEmpty();
    }

    @Test
    void deliver_swallows_failures_and_continues() {
        var n = new Notification.ConversationAssigned("c_1", "A1", "Bob", Instant.now());
        when(connectionRegistry.sendToIdentity(ChannelAudience.CUSTOMER, "U1", n))
                .thenThrow(new IllegalStateException("boom"));
        when(connectionRegistry.broadcast(ChannelAudience.AGENT, n)).thenReturn(3);

        var delivered = router.deliver(List.of(
                ConversationRouter.Destination.identity(ChannelAudience.CUSTOMER, "U1"),
                ConversationRouter.Destination.everyone(ChannelAudience.AGENT)
        ), n);

        assertThat(delivered).isEqualTo(3);
        verify(connectionRegistry).broadcast(eq(ChannelAudience.AGENT), any());
    }

    @Test
    void declared_type_matches_the_wire_discriminator() throws Exception {
        var mapper = new ObjectMapper().findAndRegisterModules();
        var all = List.<Notification>of(
                new Notification.CustomerMessageAnalysis("c_1", "m_1", "U1", "Alice", "live_chat", "hi",
                        null, null, null, Instant.now()),
                new Notification.CustomerChatMessage("c_1", "m_1", "customer", "hi", null, null, Instant.now()),
                new Notification.AgentChatMessage("c_1", "m_2", "agent", "A1", "Bob", "hello", Instant.now()),
                new Notification.ConversationAssigned("c_1", "A1", "Bob", Instant.now()),
                new Notification.ConversationUnassigned("c_1", "A1", "Bob", Instant.now()),
                new Notification.TicketResolved("c_1", "t_1", "A1", "Bob", Instant.now())
        );

        for (var n : all) {
            var json = mapper.writerFor(Notification.class).writeValueAsString(n);
            assertThat(mapper.readTree(json).path("type").asText()).isEqualTo(n.type());
            assertThat(json.split("\"type\"", -1)).hasSize(2);
        }
        assertThat(all.get(5).type()).isEqualTo("ticket_resolved");
    }
}
