package com.livedesk.support.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livedesk.support.analysis.AnalysisClient;
import com.livedesk.support.analysis.AnalysisFailure;
import com.livedesk.support.analysis.AnalysisOutcome;
import com.livedesk.support.bootstrap.LiveDeskApplication;
import com.livedesk.support.chat.service.AssignmentService;
import com.livedesk.support.chat.ws.ChannelAudience;
import com.livedesk.support.chat.ws.ConnectionRegistry;
import com.livedesk.support.common.api.ConflictException;
import com.livedesk.support.media.OcrClient;
import com.livedesk.support.media.TranscriptionClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = LiveDeskApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("dev")
class AssignmentFlowTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    ConnectionRegistry registry;

    @Autowired
    AssignmentService assignmentService;

    @MockBean
    AnalysisClient analysisClient;

    @MockBean
    OcrClient ocrClient;

    @MockBean
    TranscriptionClient transcriptionClient;

    private LiveChannels channels;

    @BeforeEach
    void setUp() {
        channels = new LiveChannels(registry, objectMapper);
        when(analysisClient.analyze(any()))
                .thenReturn(AnalysisOutcome.failure(AnalysisFailure.UNAVAILABLE, "api_key_missing"));
    }

    @AfterEach
    void tearDown() {
        channels.closeAll();
    }

    @Test
    void second_agent_cannot_take_an_assigned_conversation() throws Exception {
        var conversationId = openConversation("U-" + UUID.randomUUID());
        var watcher = channels.open(ChannelAudience.AGENT, "W-" + UUID.randomUUID());

        mvc.perform(post("/api/v1/assign-conversation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1", "agent_name", "Bob"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assigned_agent_id").value("A1"))
                .andExpect(jsonPath("$.data.changed").value(true));

        mvc.perform(post("/api/v1/assign-conversation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A2", "agent_name", "Dana"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("conversation_already_assigned"))
                .andExpect(jsonPath("$.data.assigned_agent_id").value("A1"))
                .andExpect(jsonPath("$.data.message").value("Conversation already assigned to Bob"));

        assertThat(jdbcTemplate.queryForObject(
                "select assigned_agent_id from conversation where id = ?", String.class, conversationId))
                .isEqualTo("A1");

        var assigned = channels.frames(watcher, "conversation_assigned");
        assertThat(assigned).hasSize(1);
        assertThat(assigned.get(0).path("assigned_agent_name").asText()).isEqualTo("Bob");
    }

    @Test
    void reassigning_to_the_holder_is_a_no_op() throws Exception {
        var conversationId = openConversation("U-" + UUID.randomUUID());
        var watcher = channels.open(ChannelAudience.AGENT, "W-" + UUID.randomUUID());
        var req = body(Map.of("conversation_id", conversationId, "agent_id", "A1", "agent_name", "Bob"));

        mvc.perform(post("/api/v1/assign-conversation").contentType(MediaType.APPLICATION_JSON).content(req))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.changed").value(true));
        mvc.perform(post("/api/v1/assign-conversation").contentType(MediaType.APPLICATION_JSON).content(req))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.changed").value(false))
                .andExpect(jsonPath("$.data.assigned_agent_id").value("A1"));

        assertThat(channels.frames(watcher, "conversation_assigned")).hasSize(1);
    }

    @Test
    void holder_reclaiming_under_new_name_is_announced() throws Exception {
        var conversationId = openConversation("U-" + UUID.randomUUID());
        var watcher = channels.open(ChannelAudience.AGENT, "W-" + UUID.randomUUID());
        assignmentService.assign(conversationId, "A1", "Bob");

        mvc.perform(post("/api/v1/assign-conversation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1", "agent_name", "Bob Smith"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.changed").value(true))
                .andExpect(jsonPath("$.data.assigned_agent_name").value("Bob Smith"));

        var assigned = channels.frames(watcher, "conversation_assigned");
        assertThat(assigned).hasSize(2);
        assertThat(assigned.get(1).path("assigned_agent_id").asText()).isEqualTo("A1");
        assertThat(assigned.get(1).path("assigned_agent_name").asText()).isEqualTo("Bob Smith");
    }

    @Test
    void closed_conversation_cannot_be_assigned() throws Exception {
        var conversationId = openConversation("U-" + UUID.randomUUID());
        var watcher = channels.open(ChannelAudience.AGENT, "W-" + UUID.randomUUID());
        jdbcTemplate.update("update conversation set status = 'closed' where id = ?", conversationId);

        mvc.perform(post("/api/v1/assign-conversation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1", "agent_name", "Bob"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conversation_closed"));

        assertThat(jdbcTemplate.queryForObject(
                "select assigned_agent_id from conversation where id = ?", String.class, conversationId))
                .isNull();
        assertThat(channels.frames(watcher, "conversation_assigned")).isEmpty();
    }

    @Test
    void unassign_releases_and_then_conflicts() throws Exception {
        var conversationId = openConversation("U-" + UUID.randomUUID());
        var watcher = channels.open(ChannelAudience.AGENT, "W-" + UUID.randomUUID());
        assignmentService.assign(conversationId, "A1", "Bob");

        mvc.perform(post("/api/v1/unassign-conversation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assigned_agent_id").doesNotExist());

        mvc.perform(post("/api/v1/unassign-conversation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conversation_not_assigned"));

        var released = channels.frames(watcher, "conversation_unassigned");
        assertThat(released).hasSize(1);
        assertThat(released.get(0).path("previous_agent_id").asText()).isEqualTo("A1");

        // free again, so another agent can claim it
        assertThat(assignmentService.assign(conversationId, "A2", "Dana").changed()).isTrue();
    }

    @Test
    void unknown_conversation_is_not_found() throws Exception {
        mvc.perform(post("/api/v1/assign-conversation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", "c_missing", "agent_id", "A1", "agent_name", "Bob"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("conversation_not_found"));

        mvc.perform(post("/api/v1/send-agent-message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", "c_missing", "agent_id", "A1",
                                "agent_name", "Bob", "message", "hello"))))
                .andExpect(status().isNotFound());

        mvc.perform(get("/api/v1/chat-history/conversation/{id}", "c_missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void agent_reply_reaches_customer_and_agents() throws Exception {
        var customerId = "U-" + UUID.randomUUID();
        var conversationId = openConversation(customerId);
        var customerTab = channels.open(ChannelAudience.CUSTOMER, customerId);
        var bystander = channels.open(ChannelAudience.CUSTOMER, "U-" + UUID.randomUUID());
        var agent = channels.open(ChannelAudience.AGENT, "A1");
        assignmentService.assign(conversationId, "A1", "Bob");

        mvc.perform(post("/api/v1/send-agent-message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1",
                                "agent_name", "Bob", "message", "Your order ships tomorrow."))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.agent_id").value("A1"))
                .andExpect(jsonPath("$.data.text").value("Your order ships tomorrow."));

        var toCustomer = channels.frames(customerTab, "agent_chat_message");
        assertThat(toCustomer).hasSize(1);
        assertThat(toCustomer.get(0).path("agent_name").asText()).isEqualTo("Bob");
        assertThat(toCustomer.get(0).path("text").asText()).isEqualTo("Your order ships tomorrow.");
        assertThat(channels.frames(agent, "agent_chat_message")).hasSize(1);
        assertThat(channels.frames(bystander, "agent_chat_message")).isEmpty();

        mvc.perform(get("/api/v1/chat-history/conversation/{id}", conversationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].sender").value("customer"))
                .andExpect(jsonPath("$.data[1].sender").value("agent"))
                .andExpect(jsonPath("$.data[1].analysis").doesNotExist());
    }

    @Test
    void agent_reply_to_someone_elses_conversation_is_rejected() throws Exception {
        var customerId = "U-" + UUID.randomUUID();
        var conversationId = openConversation(customerId);
        var customerTab = channels.open(ChannelAudience.CUSTOMER, customerId);
        assignmentService.assign(conversationId, "A1", "Bob");

        mvc.perform(post("/api/v1/send-agent-message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A2",
                                "agent_name", "Dana", "message", "I can help"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conversation_assigned_to_other_agent"))
                .andExpect(jsonPath("$.data.assigned_agent_id").value("A1"));

        assertThat(channels.frames(customerTab, "agent_chat_message")).isEmpty();
        assertThat(jdbcTemplate.queryForObject(
                "select count(1) from message where conversation_id = ? and sender = 'agent'",
                Integer.class, conversationId)).isZero();
    }

    @Test
    void agent_reply_to_closed_conversation_is_rejected() throws Exception {
        var conversationId = openConversation("U-" + UUID.randomUUID());
        jdbcTemplate.update("update conversation set status = 'closed' where id = ?", conversationId);

        mvc.perform(post("/api/v1/send-agent-message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1",
                                "agent_name", "Bob", "message", "hello"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conversation_closed"));
    }

    @Test
    void active_list_shows_assignee_and_last_message() throws Exception {
        var customerId = "U-" + UUID.randomUUID();
        var conversationId = openConversation(customerId);
        assignmentService.assign(conversationId, "A1", "Bob");

        var json = mvc.perform(get("/api/v1/conversations/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andReturn().getResponse().getContentAsString();

        var match = new ArrayList<com.fasterxml.jackson.databind.JsonNode>();
        objectMapper.readTree(json).path("data").forEach(n -> {
            if (conversationId.equals(n.path("conversation_id").asText())) match.add(n);
        });
        assertThat(match).hasSize(1);
        assertThat(match.get(0).path("customer_id").asText()).isEqualTo(customerId);
        assertThat(match.get(0).path("assigned_agent_name").asText()).isEqualTo("Bob");
        assertThat(match.get(0).path("last_message").asText()).isEqualTo("Hello, I need help");
        assertThat(match.get(0).path("last_message_sender").asText()).isEqualTo("customer");
    }

    @Test
    void concurrent_claims_have_exactly_one_winner() throws Exception {
        var conversationId = openConversation("U-" + UUID.randomUUID());
        int agents = 8;
        var pool = Executors.newFixedThreadPool(agents);
        var start = new CountDownLatch(1);
        try {
            var tasks = new ArrayList<Callable<Boolean>>();
            for (int i = 0; i < agents; i++) {
                var agentId = "A" + i;
                tasks.add(() -> {
                    start.await();
                    try {
                        assignmentService.assign(conversationId, agentId, "Agent " + agentId);
                        return true;
                    } catch (ConflictException ex) {
                        return false;
                    }
                });
            }
            var futures = tasks.stream().map(pool::submit).toList();
            start.countDown();
            int winners = 0;
            for (var f : futures) {
                if (f.get(10, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private String openConversation(String customerId) throws Exception {
        var json = mvc.perform(post("/api/v1/analyze-message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("customer_id", customerId, "customer_name", "Alice",
                                "text", "Hello, I need help"))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(json).path("data").path("conversation_id").asText();
    }

    private String body(Map<String, String> fields) throws Exception {
        return objectMapper.writeValueAsString(fields);
    }
}
