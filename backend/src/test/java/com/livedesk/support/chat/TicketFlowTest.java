package com.livedesk.support.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livedesk.support.analysis.AnalysisClient;
import com.livedesk.support.analysis.AnalysisFailure;
import com.livedesk.support.analysis.AnalysisOutcome;
import com.livedesk.support.bootstrap.LiveDeskApplication;
import com.livedesk.support.chat.ws.ChannelAudience;
import com.livedesk.support.chat.ws.ConnectionRegistry;
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
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

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
class TicketFlowTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    ConnectionRegistry registry;

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
    void ticket_is_created_listed_and_resolved_once() throws Exception {
        var conversationId = openConversation();
        var watcher = channels.open(ChannelAudience.AGENT, "W-" + UUID.randomUUID());

        var created = mvc.perform(post("/api/v1/tickets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1",
                                "agent_name", "Bob", "issue_description", "Package lost in transit"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("Open"))
                .andExpect(jsonPath("$.data.priority").value("Medium"))
                .andExpect(jsonPath("$.data.raised_by_agent_id").value("A1"))
                .andReturn().getResponse().getContentAsString();
        var ticketId = objectMapper.readTree(created).path("data").path("id").asText();
        assertThat(ticketId).startsWith("t_");

        mvc.perform(get("/api/v1/conversations/{id}/tickets", conversationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].id").value(ticketId));

        mvc.perform(post("/api/v1/tickets/{id}/resolve", ticketId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("agent_id", "A2", "agent_name", "Dana"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("Resolved"))
                .andExpect(jsonPath("$.data.resolved_by_agent_id").value("A2"));

        mvc.perform(post("/api/v1/tickets/{id}/resolve", ticketId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("agent_id", "A1"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ticket_already_resolved"));

        var resolved = channels.frames(watcher, "ticket_resolved");
        assertThat(resolved).hasSize(1);
        assertThat(resolved.get(0).path("ticket_id").asText()).isEqualTo(ticketId);
        assertThat(resolved.get(0).path("conversation_id").asText()).isEqualTo(conversationId);
    }

    @Test
    void priority_is_normalized() throws Exception {
        var conversationId = openConversation();

        mvc.perform(post("/api/v1/tickets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1",
                                "issue_description", "Card charged twice", "priority", "urgent"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.priority").value("Urgent"));

        mvc.perform(post("/api/v1/tickets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1",
                                "issue_description", "Card charged twice", "priority", "whenever"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_priority"));
    }

    @Test
    void missing_targets_are_not_found() throws Exception {
        mvc.perform(post("/api/v1/tickets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", "c_missing", "agent_id", "A1",
                                "issue_description", "anything"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("conversation_not_found"));

        mvc.perform(post("/api/v1/tickets/{id}/resolve", "t_missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("agent_id", "A1"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ticket_not_found"));
    }

    @Test
    void description_is_required() throws Exception {
        var conversationId = openConversation();

        mvc.perform(post("/api/v1/tickets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("conversation_id", conversationId, "agent_id", "A1"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("issue_description_required"));
    }

    private String openConversation() throws Exception {
        var json = mvc.perform(post("/api/v1/analyze-message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("customer_id", "U-" + UUID.randomUUID(), "customer_name", "Alice",
                                "text", "My package never arrived"))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(json).path("data").path("conversation_id").asText();
    }

    private String body(Map<String, String> fields) throws Exception {
        return objectMapper.writeValueAsString(fields);
    }
}
