package com.delta.ingestion.incremental.persistence;

import com.delta.ingestion.incremental.model.IngestionMark;
import com.delta.ingestion.incremental.model.IngestionRecord;
import com.delta.ingestion.incremental.model.IngestionStatus;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.delta.ingestion.incremental.persistence.IngestionRecordRepository.toInstant;
import static com.delta.ingestion.incremental.persistence.IngestionRecordRepository.toTimestamp;

@Repository
public class IngestionMarkRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public IngestionMarkRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Appends a mark to an ingesting cycle whose lease is held by {@code leaseOwner}. The sequence
     * comes from the record's own counter, incremented in the same transaction, so concurrent appends
     * to one record are serialized by its row lock. Empty when the record is gone, closed, no longer
     * ingesting or leased to someone else.
     */
    @Transactional
    public Optional<IngestionMark> append(UUID ingestionId, String leaseOwner, String cursor, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ingestionId", ingestionId)
            .addValue("leaseOwner", leaseOwner)
            .addValue("status", IngestionStatus.INGESTING.value())
            .addValue("ticket", IngestionRecord.OPEN_TICKET);
        int bumped = jdbc.update(
            """
                UPDATE ingestions
                SET last_mark_sequence = last_mark_sequence + 1
                WHERE id = :ingestionId
                  AND status = :status
                  AND completion_ticket = :ticket
                  AND lease_owner = :leaseOwner
                """,
            params
        );
        if (bumped != 1) {
            return Optional.empty();
        }
        Long sequence = jdbc.queryForObject(
            """
                SELECT last_mark_sequence
                FROM ingestions
                WHERE id = :ingestionId
                """,
            params,
            Long.class
        );
        if (sequence == null) {
            throw new IncorrectResultSizeDataAccessException(
                "Mark sequence missing for ingestion: " + ingestionId, 1, 0);
        }

        UUID id = UUID.randomUUID();
        jdbc.update(
            """
                INSERT INTO ingestion_marks (
                    id,
                    ingestion_id,
                    cursor_value,
                    sequence_no,
                    created_at
                )
                VALUES (
                    :id,
                    :ingestionId,
                    :cursor,
                    :sequence,
                    :createdAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("ingestionId", ingestionId)
                .addValue("cursor", cursor)
                .addValue("sequence", sequence)
                .addValue("createdAt", toTimestamp(now))
        );
        return Optional.of(new IngestionMark(id, ingestionId, cursor, sequence, now));
    }

    public List<IngestionMark> getAll(UUID ingestionId) {
        return jdbc.query(
            """
                SELECT id, ingestion_id, cursor_value, sequence_no, created_at
                FROM ingestion_marks
                WHERE ingestion_id = :ingestionId
                ORDER BY sequence_no ASC
                """,
            new MapSqlParameterSource().addValue("ingestionId", ingestionId),
            markMapper()
        );
    }

    public Optional<IngestionMark> getLast(UUID ingestionId) {
        List<IngestionMark> rows = jdbc.query(
            """
                SELECT id, ingestion_id, cursor_value, sequence_no, created_at
                FROM ingestion_marks
                WHERE ingestion_id = :ingestionId
                ORDER BY sequence_no DESC
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("ingestionId", ingestionId),
            markMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int clearFinished(String provider, Instant completedBefore) {
        return jdbc.update(
            """
                DELETE FROM ingestion_marks
                WHERE ingestion_id IN (
                    SELECT id
                    FROM ingestions
                    WHERE provider_name = :provider
                      AND status IN ('complete', 'error')
                      AND ingestion_completed_at IS NOT NULL
                      AND ingestion_completed_at <= :completedBefore
                )
                """,
            new MapSqlParameterSource()
                .addValue("provider", provider)
                .addValue("completedBefore", toTimestamp(completedBefore))
        );
    }

    public int deleteByProvider(String provider) {
        return jdbc.update(
            """
                DELETE FROM ingestion_marks
                WHERE ingestion_id IN (
                    SELECT id
                    FROM ingestions
                    WHERE provider_name = :provider
                )
                """,
            new MapSqlParameterSource().addValue("provider", provider)
        );
    }

    public long countByProvider(String provider) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM ingestion_marks m
                JOIN ingestions i ON i.id = m.ingestion_id
                WHERE i.provider_name = :provider
                """,
            new MapSqlParameterSource().addValue("provider", provider),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private RowMapper<IngestionMark> markMapper() {
        return (rs, rowNum) -> new IngestionMark(
            rs.getObject("id", UUID.class),
            rs.getObject("ingestion_id", UUID.class),
            rs.getString("cursor_value"),
            rs.getLong("sequence_no"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }
}
