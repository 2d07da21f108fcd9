package com.livedesk.support.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class ConversationRepository {

    public static final String STATUS_OPEN = "open";
    public static final String STATUS_CLOSED = "closed";

    public static final String SOURCE_LIVE_CHAT = "live_chat";
    public static final String SOURCE_RECORDED_CALL = "recorded_call";

    public record ConversationRow(
            String id,
            String customerId,
            String status,
            String source,
            String assignedAgentId,
            String assignedAgentName,
            Instant startedAt
    ) {
        public boolean isOpen() {
            return STATUS_OPEN.equals(status);
        }
    }

    public record OpenConversationRow(
            ConversationRow conversation,
            String customerName,
            String lastMessage,
            String lastMessageSender,
            Instant lastMessageAt
    ) {
    }

    private static final RowMapper<ConversationRow> CONVERSATION_MAPPER = (rs, rowNum) -> new ConversationRow(
            rs.getString("id"),
            rs.getString("customer_id"),
            rs.getString("status"),
            rs.getString("source"),
            rs.getString("assigned_agent_id"),
            rs.getString("assigned_agent_name"),
            rs.getTimestamp("started_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public ConversationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ConversationRow> findById(String id) {
        var sql = """
                select id, customer_id, status, source, assigned_agent_id, assigned_agent_name, started_at
                from conversation
                where id = ?
                """;
        return jdbcTemplate.query(sql, CONVERSATION_MAPPER, id).stream().findFirst();
    }

    /**
     * The most recently started open conversation of a customer.
     */
    public Optional<ConversationRow> findCurrentOpen(String customerId) {
        var sql = """
                select id, customer_id, status, source, assigned_agent_id, assigned_agent_name, started_at
                from conversation
                where customer_id = ?
                  and status = 'open'
                order by started_at desc
                limit 1
                """;
        return jdbcTemplate.query(sql, CONVERSATION_MAPPER, customerId).stream().findFirst();
    }

    public ConversationRow getOrCreateOpen(String customerId, String source) {
        return findCurrentOpen(customerId).orElseGet(() -> create(customerId, source));
    }

    public ConversationRow create(String customerId, String source) {
        var id = "c_" + UUID.randomUUID();
        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var sql = """
                insert into conversation(id, customer_id, status, source, started_at)
                values (?, ?, 'open', ?, ?)
                """;
        jdbcTemplate.update(sql, id, customerId, source, Timestamp.from(now));
        return new ConversationRow(id, customerId, STATUS_OPEN, source, null, null, now);
    }

    /**
     * Claims an open conversation for an agent unless another agent holds it. Re-claiming by the holder succeeds.
     *
     * @return rows updated, 0 when held by someone else, closed or missing
     */
    public int tryAssign(String conversationId, String agentId, String agentName) {
        var sql = """
                update conversation
                set assigned_agent_id = ?, assigned_agent_name = ?
                where id = ?
                  and status = ?
                  and (assigned_agent_id is null or assigned_agent_id = ?)
                """;
        return jdbcTemplate.update(sql, agentId, agentName, conversationId, STATUS_OPEN, agentId);
    }

    /**
     * Releases the conversation only if it is still held by {@code currentAgentId}.
     */
    public int tryUnassign(String conversationId, String currentAgentId) {
        var sql = """
                update conversation
                set assigned_agent_id = null, assigned_agent_name = null
                where id = ?
                  and assigned_agent_id = ?
                """;
        return jdbcTemplate.update(sql, conversationId, currentAgentId);
    }

    public List<OpenConversationRow> listOpen(int limit) {
        var sql = """
                select *
                from (
                    select c.id, c.customer_id, c.status, c.source, c.assigned_agent_id, c.assigned_agent_name, c.started_at,
                           cu.full_name as customer_name,
                           (select m.body from message m
                              where m.conversation_id = c.id
                              order by m.created_at desc, m.seq desc
                              limit 1) as last_message,
                           (select m.sender from message m
                              where m.conversation_id = c.id
                              order by m.created_at desc, m.seq desc
                              limit 1) as last_message_sender,
                           (select max(m.created_at) from message m
                              where m.conversation_id = c.id) as last_message_at
                    from conversation c
                    join customer cu on cu.id = c.customer_id
                    where c.status = 'open'
                ) t
                order by coalesce(t.last_message_at, t.started_at) desc
                limit ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            var lastAt = rs.getTimestamp("last_message_at");
            return new OpenConversationRow(
                    CONVERSATION_MAPPER.mapRow(rs, rowNum),
                    rs.getString("customer_name"),
                    rs.getString("last_message"),
                    rs.getString("last_message_sender"),
                    lastAt == null ? null : lastAt.toInstant()
            );
        }, limit);
    }
}
