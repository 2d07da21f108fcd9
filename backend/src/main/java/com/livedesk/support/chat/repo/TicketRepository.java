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
public class TicketRepository {

    public static final String STATUS_OPEN = "Open";
    public static final String STATUS_RESOLVED = "Resolved";

    public record TicketRow(
            String id,
            String conversationId,
            String raisedByAgentId,
            String raisedByAgentName,
            String issueDescription,
            String status,
            String priority,
            String resolvedByAgentId,
            String resolvedByAgentName,
            Instant createdAt,
            Instant updatedAt
    ) {
    }

    private static final String COLUMNS = """
            id, conversation_id, raised_by_agent_id, raised_by_agent_name, issue_description, status, priority,
            resolved_by_agent_id, resolved_by_agent_name, created_at, updated_at
            """;

    private static final RowMapper<TicketRow> TICKET_MAPPER = (rs, rowNum) -> new TicketRow(
            rs.getString("id"),
            rs.getString("conversation_id"),
            rs.getString("raised_by_agent_id"),
            rs.getString("raised_by_agent_name"),
            rs.getString("issue_description"),
            rs.getString("status"),
            rs.getString("priority"),
            rs.getString("resolved_by_agent_id"),
            rs.getString("resolved_by_agent_name"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public TicketRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public TicketRow create(String conversationId, String agentId, String agentName, String issueDescription, String priority) {
        var id = "t_" + UUID.randomUUID();
        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var sql = """
                insert into ticket(
                    id, conversation_id, raised_by_agent_id, raised_by_agent_name, issue_description, status, priority,
                    created_at, updated_at
                ) values (?, ?, ?, ?, ?, 'Open', ?, ?, ?)
                """;
        jdbcTemplate.update(sql, id, conversationId, agentId, agentName, issueDescription, priority,
                Timestamp.from(now), Timestamp.from(now));
        return new TicketRow(id, conversationId, agentId, agentName, issueDescription, STATUS_OPEN, priority,
                null, null, now, now);
    }

    public Optional<TicketRow> findById(String id) {
        var sql = "select " + COLUMNS + " from ticket where id = ?";
        return jdbcTemplate.query(sql, TICKET_MAPPER, id).stream().findFirst();
    }

    /**
     * Newest first.
     */
    public List<TicketRow> listByConversation(String conversationId) {
        var sql = "select " + COLUMNS + " from ticket where conversation_id = ? order by created_at desc, id";
        return jdbcTemplate.query(sql, TICKET_MAPPER, conversationId);
    }

    /**
     * @return rows updated, 0 when the ticket is missing or already resolved
     */
    public int tryResolve(String id, String agentId, String agentName) {
        var sql = """
                update ticket
                set status = 'Resolved', resolved_by_agent_id = ?, resolved_by_agent_name = ?, updated_at = ?
                where id = ?
                  and status <> 'Resolved'
                """;
        return jdbcTemplate.update(sql, agentId, agentName, Timestamp.from(Instant.now().truncatedTo(ChronoUnit.MICROS)), id);
    }
}
