package com.regdoc.acquirer.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.model.AcquisitionResult;
import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.service.AcquisitionResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcAcquisitionResultRepository implements AcquisitionResultSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcAcquisitionResultRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public JdbcAcquisitionResultRepository(
        NamedParameterJdbcTemplate jdbc,
        ObjectMapper objectMapper,
        AcquirerProperties properties
    ) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.enabled = properties.getPersistence().isEnabled();
    }

    @Override
    public void accept(AcquisitionResult result) {
        if (!enabled || result == null) {
            return;
        }
        insert(result);
    }

    public int insert(AcquisitionResult result) {
        RawRecord record = result.record();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetName", result.targetName())
            .addValue("found", result.found())
            .addValue("strategyUsed", result.strategyUsed())
            .addValue("elapsedMs", result.elapsedMillis())
            .addValue("errorMessage", result.error())
            .addValue("sourceUrl", record == null ? null : record.sourceUrl())
            .addValue("title", record == null ? null : record.title())
            .addValue("documentNumber", record == null ? null : record.documentNumber())
            .addValue("recordJson", toJson(record))
            .addValue("acquiredAt", toTimestamp(result.acquiredAt() == null ? Instant.now() : result.acquiredAt()));
        int rows = jdbc.update(
            """
                INSERT INTO acquisition_results (
                    target_name,
                    found,
                    strategy_used,
                    elapsed_ms,
                    error_message,
                    source_url,
                    title,
                    document_number,
                    record_json,
                    acquired_at
                )
                VALUES (
                    :targetName,
                    :found,
                    :strategyUsed,
                    :elapsedMs,
                    :errorMessage,
                    :sourceUrl,
                    :title,
                    :documentNumber,
                    :recordJson,
                    :acquiredAt
                )
                """,
            params
        );
        log.debug("Stored result for '{}' (found={})", result.targetName(), result.found());
        return rows;
    }

    public Optional<AcquisitionResult> findLatest(String targetName) {
        List<AcquisitionResult> rows = jdbc.query(
            """
                SELECT target_name, found, strategy_used, elapsed_ms, error_message, record_json, acquired_at
                FROM acquisition_results
                WHERE target_name = :targetName
                ORDER BY acquired_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource("targetName", targetName),
            resultMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public long countFound(boolean found) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM acquisition_results WHERE found = :found",
            new MapSqlParameterSource("found", found),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private RowMapper<AcquisitionResult> resultMapper() {
        return (rs, rowNum) -> new AcquisitionResult(
            rs.getString("target_name"),
            rs.getBoolean("found"),
            fromJson(rs.getString("record_json")),
            rs.getString("strategy_used"),
            Duration.ofMillis(rs.getLong("elapsed_ms")),
            toInstant(rs.getTimestamp("acquired_at")),
            rs.getString("error_message")
        );
    }

    private String toJson(RawRecord record) {
        if (record == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise record for {}", record.sourceUrl(), e);
            return null;
        }
    }

    private RawRecord fromJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, RawRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored record JSON could not be read", e);
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
