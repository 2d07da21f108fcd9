package com.livedesk.support.chat.repo;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

@Repository
public class CustomerRepository {

    public record CustomerRow(String id, String fullName, Instant createdAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public CustomerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<CustomerRow> findById(String id) {
        var sql = """
                select id, full_name, created_at
                from customer
                where id = ?
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new CustomerRow(
                rs.getString("id"),
                rs.getString("full_name"),
                rs.getTimestamp("created_at").toInstant()
        ), id);
        return list.stream().findFirst();
    }

    /**
     * Customers are created on first contact. A changed display name overwrites the stored one.
     */
    public CustomerRow getOrCreate(String id, String fullName) {
        var existing = findById(id);
        if (existing.isEmpty()) {
            var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
            try {
                jdbcTemplate.update(
                        "insert into customer(id, full_name, created_at) values (?, ?, ?)",
                        id, fullName, Timestamp.from(now)
                );
                return new CustomerRow(id, fullName, now);
            } catch (DuplicateKeyException ignored) {
                // created concurrently by another request for the same customer
                existing = findById(id);
            }
        }

        var row = existing.orElseThrow(() -> new IllegalStateException("customer_missing_after_insert"));
        if (fullName != null && !fullName.isBlank() && !fullName.equals(row.fullName())) {
            jdbcTemplate.update("update customer set full_name = ? where id = ?", fullName, id);
            return new CustomerRow(row.id(), fullName, row.createdAt());
        }
        return row;
    }
}
