package com.storeradar.discovery.store;

import com.storeradar.discovery.model.RetryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcRetryQueue implements RetryQueue {

    private static final RowMapper<RetryEntry> ROW_MAPPER = (rs, rowNum) -> RetryEntry.builder()
            .identityUrl(rs.getString("identity_url"))
            .sourceName(rs.getString("source_name"))
            .retryCount(rs.getInt("retry_count"))
            .nextRetryAt(JdbcStoreRepository.instant(rs, "next_retry_at"))
            .lastError(rs.getString("last_error"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    @Override
    public void ensureSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS discovery_retry_queue
            (
                identity_url    TEXT PRIMARY KEY,
                source_name     TEXT,
                retry_count     INTEGER NOT NULL,
                next_retry_at   TIMESTAMPTZ NOT NULL,
                last_error      TEXT
            )
        """);
        log.info("Retry queue schema ready.");
    }

    @Override
    public void save(RetryEntry entry) {
        namedJdbcTemplate.update("""
                INSERT INTO discovery_retry_queue (identity_url, source_name, retry_count, next_retry_at, last_error)
                VALUES (:url, :source, :count, :next, :error)
                ON CONFLICT (identity_url) DO UPDATE SET
                    retry_count = EXCLUDED.retry_count,
                    next_retry_at = EXCLUDED.next_retry_at,
                    last_error = EXCLUDED.last_error
                """,
                new MapSqlParameterSource()
                        .addValue("url", entry.getIdentityUrl())
                        .addValue("source", entry.getSourceName())
                        .addValue("count", entry.getRetryCount())
                        .addValue("next", Timestamp.from(entry.getNextRetryAt()))
                        .addValue("error", entry.getLastError()));
    }

    @Override
    public void remove(String identityUrl) {
        namedJdbcTemplate.update("DELETE FROM discovery_retry_queue WHERE identity_url = :url",
                Map.of("url", identityUrl));
    }

    @Override
    public Map<String, RetryEntry> findBatch(Collection<String> identityUrls) {
        if (identityUrls.isEmpty()) return Map.of();
        Map<String, RetryEntry> result = new LinkedHashMap<>();
        namedJdbcTemplate.query(
                "SELECT * FROM discovery_retry_queue WHERE identity_url IN (:urls)",
                Map.of("urls", identityUrls), ROW_MAPPER)
                .forEach(e -> result.put(e.getIdentityUrl(), e));
        return result;
    }

    @Override
    public List<RetryEntry> findDue(Instant now, int limit) {
        return namedJdbcTemplate.query("""
                SELECT * FROM discovery_retry_queue
                WHERE next_retry_at <= :now
                ORDER BY next_retry_at
                LIMIT :limit
                """,
                new MapSqlParameterSource()
                        .addValue("now", Timestamp.from(now))
                        .addValue("limit", limit),
                ROW_MAPPER);
    }
}
