package com.storeradar.discovery.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;

/**
 * One row per run in discovery_runs. Per-source and per-stage breakdowns are kept as JSON.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcRunReportWriter {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final ObjectMapper objectMapper;

    public void ensureSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS discovery_runs
            (
                run_id              TEXT PRIMARY KEY,
                cadence             TEXT NOT NULL,
                started_at          TIMESTAMPTZ NOT NULL,
                finished_at         TIMESTAMPTZ,
                outcome             TEXT NOT NULL,
                total_candidates    BIGINT NOT NULL,
                total_new           BIGINT NOT NULL,
                total_refreshed     BIGINT NOT NULL,
                total_rejected      BIGINT NOT NULL,
                total_deferred      BIGINT NOT NULL,
                total_duplicates    BIGINT NOT NULL,
                total_errors        BIGINT NOT NULL,
                per_source_counts   TEXT,
                rejections_by_stage TEXT,
                failure_message     TEXT
            )
        """);
        log.info("Run report schema ready.");
    }

    public void write(RunReport report) {
        namedJdbcTemplate.update("""
                INSERT INTO discovery_runs
                (run_id, cadence, started_at, finished_at, outcome, total_candidates, total_new,
                 total_refreshed, total_rejected, total_deferred, total_duplicates, total_errors,
                 per_source_counts, rejections_by_stage, failure_message)
                VALUES
                (:runId, :cadence, :startedAt, :finishedAt, :outcome, :candidates, :created,
                 :refreshed, :rejected, :deferred, :duplicates, :errors,
                 :perSource, :byStage, :failure)
                ON CONFLICT (run_id) DO NOTHING
                """,
                new MapSqlParameterSource()
                        .addValue("runId", report.getRunId())
                        .addValue("cadence", report.getCadence().name())
                        .addValue("startedAt", Timestamp.from(report.getStartedAt()))
                        .addValue("finishedAt", report.getFinishedAt() == null ? null : Timestamp.from(report.getFinishedAt()))
                        .addValue("outcome", report.getOutcome().name())
                        .addValue("candidates", report.getTotalCandidates())
                        .addValue("created", report.getTotalNew())
                        .addValue("refreshed", report.getTotalRefreshed())
                        .addValue("rejected", report.getTotalRejected())
                        .addValue("deferred", report.getTotalDeferred())
                        .addValue("duplicates", report.getTotalDuplicates())
                        .addValue("errors", report.getTotalErrors())
                        .addValue("perSource", json(report.getPerSourceCounts()))
                        .addValue("byStage", json(report.getRejectionsByStage()))
                        .addValue("failure", report.getFailureMessage()));
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise run report field", e);
        }
    }
}
