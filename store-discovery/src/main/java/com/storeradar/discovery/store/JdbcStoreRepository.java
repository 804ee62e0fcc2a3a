package com.storeradar.discovery.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.error.FatalConfigurationException;
import com.storeradar.discovery.model.BusinessModel;
import com.storeradar.discovery.model.StoreRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL-backed {@link StoreRepository}.
 *
 * Upserts use {@code INSERT ... ON CONFLICT (identity_url) DO UPDATE}; the classification
 * columns keep their stored values when {@code tags_locked} is set.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcStoreRepository implements StoreRepository {

    private static final String COLUMNS = """
            identity_url, display_name, country, theme, business_model, business_model_confidence,
            tags, product_count, is_active, first_seen_at, last_validated_at, retry_count,
            next_retry_at, tags_locked, source_name, classification_attempts, running_ads
            """;

    private static final String UPSERT = """
            INSERT INTO stores (
                identity_url, display_name, country, theme, business_model, business_model_confidence,
                tags, product_count, is_active, first_seen_at, last_validated_at, retry_count,
                next_retry_at, tags_locked, source_name, classification_attempts, running_ads)
            VALUES (
                :identityUrl, :displayName, :country, :theme, :businessModel, :confidence,
                :tags, :productCount, :active, :firstSeenAt, :lastValidatedAt, :retryCount,
                :nextRetryAt, FALSE, :sourceName, :classificationAttempts, :runningAds)
            ON CONFLICT (identity_url) DO UPDATE SET
            """ + UpdateColumns.EXCLUDED + """
            RETURNING (xmax = 0) AS inserted
            """;

    private static final String UPDATE = """
            UPDATE stores SET
            """ + UpdateColumns.PARAMS + """
            WHERE identity_url = :identityUrl
            """;

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void ensureSchema() {
        log.info("Ensuring stores schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS stores
            (
                identity_url                TEXT PRIMARY KEY,
                display_name                TEXT,
                country                     TEXT,
                theme                       TEXT,
                business_model              TEXT,
                business_model_confidence   DOUBLE PRECISION NOT NULL DEFAULT 0,
                tags                        TEXT NOT NULL DEFAULT '[]',
                product_count               INTEGER,
                is_active                   BOOLEAN NOT NULL DEFAULT TRUE,
                first_seen_at               TIMESTAMPTZ NOT NULL,
                last_validated_at           TIMESTAMPTZ,
                retry_count                 INTEGER NOT NULL DEFAULT 0,
                next_retry_at               TIMESTAMPTZ,
                tags_locked                 BOOLEAN NOT NULL DEFAULT FALSE,
                source_name                 TEXT,
                classification_attempts     INTEGER NOT NULL DEFAULT 0,
                running_ads                 BOOLEAN NOT NULL DEFAULT FALSE
            )
        """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_stores_next_retry_at
                ON stores (next_retry_at)
                WHERE next_retry_at IS NOT NULL
        """);

        log.info("Stores schema ready.");
    }

    @Override
    public UpsertResult upsert(StoreRecord record) {
        MapSqlParameterSource params = toParams(record);
        try {
            Boolean inserted = namedJdbcTemplate.queryForObject(UPSERT, params, Boolean.class);
            return Boolean.TRUE.equals(inserted) ? UpsertResult.CREATED : UpsertResult.REFRESHED;
        } catch (DuplicateKeyException e) {
            // a concurrent writer won the insert; apply ours as a refresh
            log.debug("Insert race on {}, refreshing instead", record.getIdentityUrl());
            namedJdbcTemplate.update(UPDATE, params);
            return UpsertResult.REFRESHED;
        }
    }

    @Override
    public Optional<StoreRecord> findByIdentityUrl(String identityUrl) {
        List<StoreRecord> rows = namedJdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM stores WHERE identity_url = :url",
                Map.of("url", identityUrl), rowMapper());
        return rows.stream().findFirst();
    }

    @Override
    public Set<String> existsBatch(Collection<String> identityUrls) {
        if (identityUrls.isEmpty()) return Set.of();
        return new HashSet<>(namedJdbcTemplate.queryForList(
                "SELECT identity_url FROM stores WHERE identity_url IN (:urls)",
                Map.of("urls", identityUrls), String.class));
    }

    @Override
    public Map<String, StoreRecord> findBatch(Collection<String> identityUrls) {
        if (identityUrls.isEmpty()) return Map.of();
        Map<String, StoreRecord> result = new LinkedHashMap<>();
        namedJdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM stores WHERE identity_url IN (:urls)",
                Map.of("urls", identityUrls), rowMapper())
                .forEach(r -> result.put(r.getIdentityUrl(), r));
        return result;
    }

    @Override
    public List<StoreRecord> findDueForRetry(Instant now, int limit) {
        return namedJdbcTemplate.query("""
                SELECT """ + COLUMNS + """
                FROM stores
                WHERE next_retry_at IS NOT NULL AND next_retry_at <= :now
                ORDER BY next_retry_at
                LIMIT :limit
                """,
                new MapSqlParameterSource()
                        .addValue("now", Timestamp.from(now))
                        .addValue("limit", limit),
                rowMapper());
    }

    @Override
    public void markInactive(String identityUrl, Instant validatedAt) {
        namedJdbcTemplate.update("""
                UPDATE stores
                SET is_active = FALSE, last_validated_at = :at, retry_count = 0, next_retry_at = NULL
                WHERE identity_url = :url
                """,
                new MapSqlParameterSource()
                        .addValue("url", identityUrl)
                        .addValue("at", Timestamp.from(validatedAt)));
    }

    @Override
    public void scheduleRetry(String identityUrl, int retryCount, Instant nextRetryAt) {
        namedJdbcTemplate.update(
                "UPDATE stores SET retry_count = :count, next_retry_at = :next WHERE identity_url = :url",
                new MapSqlParameterSource()
                        .addValue("url", identityUrl)
                        .addValue("count", retryCount)
                        .addValue("next", Timestamp.from(nextRetryAt)));
    }

    @Override
    public void ping() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            throw new FatalConfigurationException("Store repository unreachable: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private MapSqlParameterSource toParams(StoreRecord r) {
        return new MapSqlParameterSource()
                .addValue("identityUrl", r.getIdentityUrl())
                .addValue("displayName", r.getDisplayName())
                .addValue("country", r.getCountry())
                .addValue("theme", r.getTheme())
                .addValue("businessModel", r.getBusinessModel() == null ? null : r.getBusinessModel().name())
                .addValue("confidence", r.getBusinessModelConfidence())
                .addValue("tags", writeTags(r.getTags()))
                .addValue("productCount", r.getProductCount())
                .addValue("active", r.isActive())
                .addValue("firstSeenAt", timestamp(r.getFirstSeenAt()))
                .addValue("lastValidatedAt", timestamp(r.getLastValidatedAt()))
                .addValue("retryCount", r.getRetryCount())
                .addValue("nextRetryAt", timestamp(r.getNextRetryAt()))
                .addValue("sourceName", r.getSourceName())
                .addValue("classificationAttempts", r.getClassificationAttempts())
                .addValue("runningAds", r.isRunningAds());
    }

    private RowMapper<StoreRecord> rowMapper() {
        return (rs, rowNum) -> StoreRecord.builder()
                .identityUrl(rs.getString("identity_url"))
                .displayName(rs.getString("display_name"))
                .country(rs.getString("country"))
                .theme(rs.getString("theme"))
                .businessModel(rs.getString("business_model") == null
                        ? null : BusinessModel.valueOf(rs.getString("business_model")))
                .businessModelConfidence(rs.getDouble("business_model_confidence"))
                .tags(readTags(rs.getString("tags")))
                .productCount((Integer) rs.getObject("product_count"))
                .active(rs.getBoolean("is_active"))
                .firstSeenAt(instant(rs, "first_seen_at"))
                .lastValidatedAt(instant(rs, "last_validated_at"))
                .retryCount(rs.getInt("retry_count"))
                .nextRetryAt(instant(rs, "next_retry_at"))
                .tagsLocked(rs.getBoolean("tags_locked"))
                .sourceName(rs.getString("source_name"))
                .classificationAttempts(rs.getInt("classification_attempts"))
                .runningAds(rs.getBoolean("running_ads"))
                .build();
    }

    private String writeTags(List<String> tags) {
        try {
            return objectMapper.writeValueAsString(tags == null ? List.of() : tags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise tags", e);
        }
    }

    private List<String> readTags(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(objectMapper.readValue(json, TAG_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable tags column '{}': {}", json, e.getMessage());
            return new ArrayList<>();
        }
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    /**
     * SET clauses shared by the upsert and the race fallback. Classification columns are
     * guarded by tags_locked; first_seen_at and source_name are never overwritten.
     */
    private static final class UpdateColumns {

        static final String EXCLUDED = """
                display_name = EXCLUDED.display_name,
                country = EXCLUDED.country,
                theme = EXCLUDED.theme,
                product_count = EXCLUDED.product_count,
                is_active = EXCLUDED.is_active,
                last_validated_at = EXCLUDED.last_validated_at,
                retry_count = EXCLUDED.retry_count,
                next_retry_at = EXCLUDED.next_retry_at,
                business_model = CASE WHEN stores.tags_locked THEN stores.business_model ELSE EXCLUDED.business_model END,
                business_model_confidence = CASE WHEN stores.tags_locked THEN stores.business_model_confidence ELSE EXCLUDED.business_model_confidence END,
                tags = CASE WHEN stores.tags_locked THEN stores.tags ELSE EXCLUDED.tags END,
                classification_attempts = CASE WHEN stores.tags_locked THEN stores.classification_attempts ELSE EXCLUDED.classification_attempts END,
                running_ads = CASE WHEN stores.tags_locked THEN stores.running_ads ELSE EXCLUDED.running_ads END
                """;

        static final String PARAMS = """
                display_name = :displayName,
                country = :country,
                theme = :theme,
                product_count = :productCount,
                is_active = :active,
                last_validated_at = :lastValidatedAt,
                retry_count = :retryCount,
                next_retry_at = :nextRetryAt,
                business_model = CASE WHEN tags_locked THEN business_model ELSE :businessModel END,
                business_model_confidence = CASE WHEN tags_locked THEN business_model_confidence ELSE :confidence END,
                tags = CASE WHEN tags_locked THEN tags ELSE :tags END,
                classification_attempts = CASE WHEN tags_locked THEN classification_attempts ELSE :classificationAttempts END,
                running_ads = CASE WHEN tags_locked THEN running_ads ELSE :runningAds END
                """;
    }
}
