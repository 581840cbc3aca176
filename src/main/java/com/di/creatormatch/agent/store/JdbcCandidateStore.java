package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JDBC implementation of {@link CandidateStore} over the {@code creators} table.
 * List-valued columns and metrics are stored as JSON text.
 * Active when {@code creatormatch.store.persistence-enabled=true}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "creatormatch.store.persistence-enabled", havingValue = "true")
public class JdbcCandidateStore implements CandidateStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper json;
    private final RowMapper<CreatorRecord> rowMapper = new CreatorRowMapper();

    public JdbcCandidateStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.json = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<CreatorRecord> findByNiche(String niche, int limit) {
        if (niche == null || niche.isBlank() || limit <= 0) return List.of();
        String n = niche.trim().toLowerCase(Locale.ROOT);
        return query("findByNiche", sql.getCreators().getFindByNiche(), n, like(n), limit);
    }

    @Override
    public List<CreatorRecord> findByKeyword(String keyword, int limit) {
        if (keyword == null || keyword.isBlank() || limit <= 0) return List.of();
        String pattern = like(keyword.trim().toLowerCase(Locale.ROOT));
        return query("findByKeyword", sql.getCreators().getFindByKeyword(), pattern, pattern, pattern, pattern, limit);
    }

    @Override
    public List<CreatorRecord> findFallback(int limit) {
        if (limit <= 0) return List.of();
        return query("findFallback", sql.getCreators().getFindFallback(), limit);
    }

    @Override
    public Optional<CreatorRecord> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        List<CreatorRecord> rows = query("findById", sql.getCreators().getFindById(), id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void save(CreatorRecord record) {
        if (record == null || record.getId() == null) return;
        if (update(record) == 0) {
            jdbc.update(sql.getCreators().getInsert(),
                    record.getId(), platformName(record), record.getUsername(), record.getDisplayName(),
                    record.getFollowers(), record.getBio(), toJson(record.getInterests()), record.getPrimaryNiche(),
                    record.getNicheConfidence(), toJson(record.getBrandMentions()), record.getCountry(),
                    toJson(record.getMetrics()), timestamp(record), record.isMetricsComplete(),
                    record.getExternalId(), record.isActive());
        }
    }

    @Override
    public boolean updateVerified(CreatorRecord verified) {
        if (verified == null || verified.getId() == null) return false;
        try {
            return update(verified) > 0;
        } catch (RuntimeException e) {
            log.warn("[STORE] Failed to persist verified metrics id={}: {}", verified.getId(), e.getMessage());
            return false;
        }
    }

    private int update(CreatorRecord r) {
        return jdbc.update(sql.getCreators().getUpdate(),
                platformName(r), r.getUsername(), r.getDisplayName(), r.getFollowers(), r.getBio(),
                toJson(r.getInterests()), r.getPrimaryNiche(), r.getNicheConfidence(), toJson(r.getBrandMentions()),
                r.getCountry(), toJson(r.getMetrics()), timestamp(r), r.isMetricsComplete(), r.getExternalId(),
                r.isActive(), r.getId());
    }

    private List<CreatorRecord> query(String name, String statement, Object... args) {
        try {
            return jdbc.query(statement, rowMapper, args);
        } catch (RuntimeException e) {
            log.warn("[STORE] Query {} failed: {}", name, e.getMessage());
            return List.of();
        }
    }

    private static String like(String value) {
        return "%" + value.replace("%", "").replace("_", "") + "%";
    }

    private static String platformName(CreatorRecord r) {
        return r.getPlatform() != null ? r.getPlatform().name() : Platform.INSTAGRAM.name();
    }

    private static Timestamp timestamp(CreatorRecord r) {
        return r.getVerifiedAt() != null ? Timestamp.from(r.getVerifiedAt()) : null;
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String text, TypeReference<T> type, T fallback) {
        if (text == null || text.isBlank()) return fallback;
        try {
            return json.readValue(text, type);
        } catch (JsonProcessingException e) {
            log.warn("[STORE] Unreadable JSON column, treating as empty: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    private final class CreatorRowMapper implements RowMapper<CreatorRecord> {
        @Override
        public CreatorRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp verifiedAt = rs.getTimestamp("verified_at");
            long followers = rs.getLong("followers");
            boolean followersNull = rs.wasNull();
            double confidence = rs.getDouble("niche_confidence");
            boolean confidenceNull = rs.wasNull();
            return CreatorRecord.builder()
                    .id(rs.getString("id"))
                    .platform(Platform.fromString(rs.getString("platform")))
                    .username(rs.getString("username"))
                    .displayName(rs.getString("display_name"))
                    .followers(followersNull ? null : followers)
                    .bio(rs.getString("bio"))
                    .interests(fromJson(rs.getString("interests"), STRING_LIST, Collections.emptyList()))
                    .primaryNiche(rs.getString("primary_niche"))
                    .nicheConfidence(confidenceNull ? null : confidence)
                    .brandMentions(fromJson(rs.getString("brand_mentions"), STRING_LIST, Collections.emptyList()))
                    .country(rs.getString("country"))
                    .metrics(fromJson(rs.getString("metrics"), new TypeReference<CreatorMetrics>() {
                    }, null))
                    .verifiedAt(verifiedAt != null ? verifiedAt.toInstant() : null)
                    .metricsComplete(rs.getBoolean("metrics_complete"))
                    .externalId(rs.getString("external_id"))
                    .active(rs.getBoolean("active"))
                    .build();
        }
    }
}
