package com.delta.ingestion.incremental.persistence;

import com.delta.ingestion.incremental.model.IngestionRecord;
import com.delta.ingestion.incremental.model.IngestionRecordUpdate;
import com.delta.ingestion.incremental.model.IngestionStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class IngestionRecordRepository {
    private static final String SELECT_COLUMNS = """
        SELECT id,
               provider_name,
               status,
               next_action,
               next_action_at,
               ingestion_completed_at,
               last_error,
               attempts,
               last_mark_sequence,
               completion_ticket,
               lease_owner,
               lease_until,
               created_at,
               updated_at
        FROM ingestions
        """;
    private static final String OPEN_STATUSES = "('ingesting', 'canceling', 'resting')";
    private static final int MAX_ERROR_LENGTH = 1000;

    private final NamedParameterJdbcTemplate jdbc;

    public IngestionRecordRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Optional<IngestionRecord> getCurrent(String provider) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("provider", provider)
            .addValue("ticket", IngestionRecord.OPEN_TICKET);
        List<IngestionRecord> rows = jdbc.query(
            SELECT_COLUMNS + """
                WHERE provider_name = :provider
                  AND completion_ticket = :ticket
                """,
            params,
            recordMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<IngestionRecord> findRecord(UUID id) {
        List<IngestionRecord> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            recordMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<IngestionRecord> findByProvider(String provider) {
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE provider_name = :provider
                ORDER BY created_at ASC
                """,
            new MapSqlParameterSource().addValue("provider", provider),
            recordMapper()
        );
    }

    public Optional<Instant> findLatestNextActionAt(String provider) {
        Timestamp latest = jdbc.queryForObject(
            """
                SELECT MAX(next_action_at)
                FROM ingestions
                WHERE provider_name = :provider
                """,
            new MapSqlParameterSource().addValue("provider", provider),
            Timestamp.class
        );
        return Optional.ofNullable(toInstant(latest));
    }

    public boolean hasHistory(String provider) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM ingestions
                WHERE provider_name = :provider
                """,
            new MapSqlParameterSource().addValue("provider", provider),
            Integer.class
        );
        return count != null && count > 0;
    }

    public List<String> listProviders() {
        return jdbc.query(
            """
                SELECT DISTINCT provider_name
                FROM ingestions
                ORDER BY provider_name
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> rs.getString("provider_name")
        );
    }

    public List<IngestionRecord> healthcheck() {
        return jdbc.query(
            SELECT_COLUMNS + " WHERE status IN " + OPEN_STATUSES + " ORDER BY provider_name, created_at",
            new MapSqlParameterSource(),
            recordMapper()
        );
    }

    public List<String> findDuplicateOpenProviders() {
        return jdbc.query(
            """
                SELECT provider_name
                FROM ingestions
                WHERE status IN %s
                GROUP BY provider_name
                HAVING COUNT(*) > 1
                ORDER BY provider_name
                """.formatted(OPEN_STATUSES),
            new MapSqlParameterSource(),
            (rs, rowNum) -> rs.getString("provider_name")
        );
    }

    public IngestionRecord insert(
        String provider,
        IngestionStatus status,
        String nextAction,
        Instant nextActionAt,
        Instant ingestionCompletedAt,
        Instant now
    ) {
        UUID id = UUID.randomUUID();
        String ticket = status.isOpen() ? IngestionRecord.OPEN_TICKET : id.toString();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("provider", provider)
            .addValue("status", status.value())
            .addValue("nextAction", nextAction)
            .addValue("nextActionAt", toTimestamp(nextActionAt))
            .addValue("completedAt", toTimestamp(ingestionCompletedAt))
            .addValue("ticket", ticket)
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                INSERT INTO ingestions (
                    id,
                    provider_name,
                    status,
                    next_action,
                    next_action_at,
                    ingestion_completed_at,
                    attempts,
                    last_mark_sequence,
                    completion_ticket,
                    created_at,
                    updated_at
                )
                VALUES (
                    :id,
                    :provider,
                    :status,
                    :nextAction,
                    :nextActionAt,
                    :completedAt,
                    0,
                    0,
                    :ticket,
                    :now,
                    :now
                )
                """,
            params
        );
        return new IngestionRecord(
            id,
            provider,
            status,
            nextAction,
            nextActionAt,
            ingestionCompletedAt,
            null,
            0,
            0L,
            ticket,
            null,
            null,
            now,
            now
        );
    }

    public boolean compareAndSet(UUID id, IngestionStatus expected, IngestionRecordUpdate update, Instant now) {
        return compareAndSet(id, expected, null, update, now);
    }

    public boolean compareAndSet(
        UUID id,
        IngestionStatus expected,
        String leaseOwner,
        IngestionRecordUpdate update,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("expected", expected.value())
            .addValue("ticket", IngestionRecord.OPEN_TICKET);
        String ownerClause = "";
        if (leaseOwner != null) {
            ownerClause = " AND lease_owner = :leaseOwner";
            params.addValue("leaseOwner", leaseOwner);
        }
        String setClause = setClause(update, id, params, now);
        int updated = jdbc.update(
            "UPDATE ingestions SET " + setClause + """
                 WHERE id = :id
                  AND status = :expected
                  AND completion_ticket = :ticket
                """ + ownerClause,
            params
        );
        return updated == 1;
    }

    public int updateByName(String provider, IngestionStatus expected, IngestionRecordUpdate update, Instant now) {
        Optional<IngestionRecord> current = getCurrent(provider);
        if (current.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("provider", provider)
            .addValue("currentId", current.get().id())
            .addValue("expected", expected.value())
            .addValue("ticket", IngestionRecord.OPEN_TICKET);
        String setClause = setClause(update, current.get().id(), params, now);
        return jdbc.update(
            "UPDATE ingestions SET " + setClause + """
                 WHERE provider_name = :provider
                  AND id = :currentId
                  AND status = :expected
                  AND completion_ticket = :ticket
                """,
            params
        );
    }

    public boolean claimLease(UUID id, String owner, Instant now, Instant leaseUntil, boolean onlyWhenDue) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", owner)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("status", IngestionStatus.INGESTING.value())
            .addValue("ticket", IngestionRecord.OPEN_TICKET);
        String dueClause = onlyWhenDue ? " AND next_action_at <= :now" : "";
        int updated = jdbc.update(
            """
                UPDATE ingestions
                SET lease_owner = :owner,
                    lease_until = :leaseUntil,
                    updated_at = :now
                WHERE id = :id
                  AND status = :status
                  AND completion_ticket = :ticket
                  AND (lease_until IS NULL OR lease_until < :now)
                """ + dueClause,
            params
        );
        return updated == 1;
    }

    public boolean renewLease(UUID id, String owner, Instant now, Instant leaseUntil) {
        int updated = jdbc.update(
            """
                UPDATE ingestions
                SET lease_until = :leaseUntil,
                    updated_at = :now
                WHERE id = :id
                  AND lease_owner = :owner
                  AND status = :status
                  AND completion_ticket = :ticket
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("owner", owner)
                .addValue("now", toTimestamp(now))
                .addValue("leaseUntil", toTimestamp(leaseUntil))
                .addValue("status", IngestionStatus.INGESTING.value())
                .addValue("ticket", IngestionRecord.OPEN_TICKET)
        );
        return updated == 1;
    }

    public void releaseLease(UUID id, String owner, Instant now) {
        jdbc.update(
            """
                UPDATE ingestions
                SET lease_owner = NULL,
                    lease_until = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND lease_owner = :owner
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("owner", owner)
                .addValue("now", toTimestamp(now))
        );
    }

    public int deleteByProvider(String provider) {
        return jdbc.update(
            "DELETE FROM ingestions WHERE provider_name = :provider",
            new MapSqlParameterSource().addValue("provider", provider)
        );
    }

    private String setClause(IngestionRecordUpdate update, UUID id, MapSqlParameterSource params, Instant now) {
        List<String> assignments = new ArrayList<>();
        if (update.status() != null) {
            assignments.add("status = :newStatus");
            params.addValue("newStatus", update.status().value());
            if (!update.status().isOpen()) {
                assignments.add("completion_ticket = :closedTicket");
                params.addValue("closedTicket", id.toString());
            }
        }
        if (update.nextAction() != null) {
            assignments.add("next_action = :nextAction");
            params.addValue("nextAction", update.nextAction());
        }
        if (update.nextActionAt() != null) {
            assignments.add("next_action_at = :nextActionAt");
            params.addValue("nextActionAt", toTimestamp(update.nextActionAt()));
        }
        if (update.ingestionCompletedAt() != null) {
            assignments.add("ingestion_completed_at = :completedAt");
            params.addValue("completedAt", toTimestamp(update.ingestionCompletedAt()));
        }
        if (update.lastError() != null) {
            assignments.add("last_error = :lastError");
            params.addValue("lastError", truncateError(update.lastError()));
        }
        if (update.attempts() != null) {
            assignments.add("attempts = :attempts");
            params.addValue("attempts", Math.max(0, update.attempts()));
        }
        if (update.releaseLease()) {
            assignments.add("lease_owner = NULL");
            assignments.add("lease_until = NULL");
        }
        assignments.add("updated_at = :updatedAt");
        params.addValue("updatedAt", toTimestamp(now));
        return String.join(", ", assignments);
    }

    private RowMapper<IngestionRecord> recordMapper() {
        return (rs, rowNum) -> new IngestionRecord(
            rs.getObject("id", UUID.class),
            rs.getString("provider_name"),
            IngestionStatus.fromValue(rs.getString("status")),
            rs.getString("next_action"),
            toInstant(rs.getTimestamp("next_action_at")),
            toInstant(rs.getTimestamp("ingestion_completed_at")),
            rs.getString("last_error"),
            rs.getInt("attempts"),
            rs.getLong("last_mark_sequence"),
            rs.getString("completion_ticket"),
            rs.getString("lease_owner"),
            toInstant(rs.getTimestamp("lease_until")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String truncateError(String error) {
        String trimmed = error.trim();
        if (trimmed.length() <= MAX_ERROR_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_ERROR_LENGTH);
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
