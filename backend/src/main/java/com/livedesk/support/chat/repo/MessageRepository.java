package com.livedesk.support.chat.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livedesk.support.analysis.AnalysisResult;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

@Repository
public class MessageRepository {

    public static final String SENDER_CUSTOMER = "customer";
    public static final String SENDER_AGENT = "agent";

    /**
     * A message about to be stored. {@code analysis} is null for agent replies.
     */
    public record NewMessage(
            String conversationId,
            String sender,
            String senderId,
            String senderName,
            String text,
            String mediaRef,
            String extractedText,
            AnalysisResult analysis
    ) {
    }

    public record MessageRow(
            String id,
            String conversationId,
            String sender,
            String senderId,
            String senderName,
            String text,
            String mediaRef,
            String extractedText,
            String predictedIntent,
            Double intentConfidence,
            String sentimentLabel,
            Double sentimentScore,
            String suggestionsJson,
            String entitiesJson,
            Instant createdAt
    ) {
    }

    private static final RowMapper<MessageRow> MESSAGE_MAPPER = (rs, rowNum) -> new MessageRow(
            rs.getString("id"),
            rs.getString("conversation_id"),
            rs.getString("sender"),
            rs.getString("sender_id"),
            rs.getString("sender_name"),
            rs.getString("body"),
            rs.getString("media_ref"),
            rs.getString("extracted_text"),
            rs.getString("predicted_intent"),
            rs.getObject("intent_confidence", Double.class),
            rs.getString("sentiment_label"),
            rs.getObject("sentiment_score", Double.class),
            rs.getString("suggestions_json"),
            rs.getString("entities_json"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public MessageRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Stores the message and assigns its id and timestamp of record.
     */
    public MessageRow save(NewMessage m) {
        var id = "m_" + UUID.randomUUID();
        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var a = m.analysis();

        String intent = null;
        Double confidence = null;
        String sentimentLabel = null;
        Double sentimentScore = null;
        String suggestionsJson = null;
        String entitiesJson = null;
        if (a != null) {
            intent = a.predicted_intent();
            confidence = a.intent_confidence();
            if (a.sentiment() != null) {
                sentimentLabel = a.sentiment().label();
                sentimentScore = a.sentiment().score();
            }
            suggestionsJson = toJson(a.suggestions());
            entitiesJson = toJson(a.detected_entities());
        }

        var sql = """
                insert into message(
                    id, conversation_id, sender, sender_id, sender_name, body, media_ref, extracted_text,
                    predicted_intent, intent_confidence, sentiment_label, sentiment_score,
                    suggestions_json, entities_json, created_at
                ) values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql,
                id, m.conversationId(), m.sender(), m.senderId(), m.senderName(), m.text(), m.mediaRef(), m.extractedText(),
                intent, confidence, sentimentLabel, sentimentScore,
                suggestionsJson, entitiesJson, Timestamp.from(now));

        return new MessageRow(
                id, m.conversationId(), m.sender(), m.senderId(), m.senderName(), m.text(), m.mediaRef(), m.extractedText(),
                intent, confidence, sentimentLabel, sentimentScore,
                suggestionsJson, entitiesJson, now
        );
    }

    /**
     * Oldest first.
     */
    public List<MessageRow> listByConversation(String conversationId) {
        var sql = """
                select id, conversation_id, sender, sender_id, sender_name, body, media_ref, extracted_text,
                       predicted_intent, intent_confidence, sentiment_label, sentiment_score,
                       suggestions_json, entities_json, created_at
                from message
                where conversation_id = ?
                order by created_at asc, seq asc
                """;
        return jdbcTemplate.query(sql, MESSAGE_MAPPER, conversationId);
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("analysis_not_serializable", ex);
        }
    }
}
