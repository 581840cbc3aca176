package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.sql.SqlQueriesProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static com.di.creatormatch.agent.store.StoreFixtures.creator;
import static com.di.creatormatch.agent.store.StoreFixtures.metrics;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the named queries from sql-queries.yml against the creators schema on H2.
 */
@DisplayName("JdbcCandidateStore Tests")
class JdbcCandidateStoreTest {

    private EmbeddedDatabase db;
    private JdbcCandidateStore store;

    @BeforeEach
    void setUp() throws IOException {
        db = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/creators-schema.sql")
                .build();
        store = new JdbcCandidateStore(new JdbcTemplate(db), loadQueries());

        store.save(creator("a", "padel_queen", 50_000L, "padel", "padel"));
        store.save(creator("b", "padelmaster", 200_000L, "sports", "padel tips"));
        store.save(creator("c", "unknownreach", null, "padel"));
        store.save(creator("d", "chef_ana", 90_000L, "food", "cooking"));
        store.save(creator("e", "ghost", 70_000L, "padel").toBuilder().active(false).build());
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    static SqlQueriesProperties loadQueries() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("sql-queries", new ClassPathResource("sql-queries.yml"));
        return new Binder(ConfigurationPropertySources.from(sources))
                .bind("creatormatch.sql", SqlQueriesProperties.class)
                .get();
    }

    // ============================================================================
    // Queries
    // ============================================================================

    @Test
    @DisplayName("Niche query orders by reach with unknown followers last and skips inactive rows")
    void testFindByNiche() {
        assertEquals(List.of("b", "a", "c"), ids(store.findByNiche("PADEL", 10)));
        assertEquals(List.of("b"), ids(store.findByNiche("padel", 1)));
    }

    @Test
    @DisplayName("Keyword query searches handle, name, bio and interests")
    void testFindByKeyword() {
        assertEquals(List.of("d"), ids(store.findByKeyword("cook", 10)));
        assertEquals(List.of("b", "a"), ids(store.findByKeyword("padel", 10)));
        assertTrue(store.findByKeyword("", 10).isEmpty());
    }

    @Test
    @DisplayName("Fallback puts complete metrics first")
    void testFindFallback() {
        store.save(creator("f", "small_complete", 1_000L, "travel").toBuilder().metricsComplete(true).build());
        assertEquals(List.of("f", "b", "d"), ids(store.findFallback(3)));
    }

    // ============================================================================
    // Round trip of JSON columns and updates
    // ============================================================================

    @Test
    @DisplayName("Metrics, lists and verification fields survive a save and reload")
    void testSaveAndFindById_RoundTrip() {
        Instant verifiedAt = Instant.parse("2024-03-01T10:15:30Z");
        CreatorRecord full = creator("g", "laurafit", 120_000L, "fitness", "fitness", "running").toBuilder()
                .platform(Platform.TIKTOK)
                .brandMentions(List.of("nike"))
                .nicheConfidence(0.8)
                .metrics(metrics(85.0, 0.05, 72.0))
                .verifiedAt(verifiedAt)
                .metricsComplete(true)
                .externalId("tok-7")
                .build();
        store.save(full);

        CreatorRecord loaded = store.findById("g").orElseThrow();
        assertEquals(Platform.TIKTOK, loaded.getPlatform());
        assertEquals(List.of("fitness", "running"), loaded.getInterests());
        assertEquals(List.of("nike"), loaded.getBrandMentions());
        assertEquals(0.8, loaded.getNicheConfidence());
        assertEquals(72.0, loaded.getMetrics().getSpainAudiencePct());
        assertEquals(0.05, loaded.getMetrics().getEngagementRate());
        assertEquals(verifiedAt, loaded.getVerifiedAt());
        assertTrue(loaded.isMetricsComplete());
        assertEquals("tok-7", loaded.getExternalId());
    }

    @Test
    @DisplayName("Null followers and confidence stay null")
    void testFindById_NullColumns() {
        CreatorRecord c = store.findById("c").orElseThrow();
        assertNull(c.getFollowers());
        assertNull(c.getNicheConfidence());
        assertFalse(c.hasKnownFollowers());
    }

    @Test
    @DisplayName("updateVerified only touches existing rows")
    void testUpdateVerified() {
        assertTrue(store.updateVerified(creator("a", "padel_queen", 55_000L, "padel").toBuilder().metricsComplete(true).build()));
        assertEquals(55_000L, store.findById("a").orElseThrow().getFollowers());
        assertFalse(store.updateVerified(creator("missing", "x", 1L, "none")));
        assertTrue(store.findById("missing").isEmpty());
    }

    private static List<String> ids(List<CreatorRecord> records) {
        return records.stream().map(CreatorRecord::getId).collect(Collectors.toList());
    }
}
