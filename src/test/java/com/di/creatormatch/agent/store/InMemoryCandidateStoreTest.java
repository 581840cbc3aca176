package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.di.creatormatch.agent.store.StoreFixtures.creator;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCandidateStore Tests")
class InMemoryCandidateStoreTest {

    private InMemoryCandidateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        store.saveAll(List.of(
                creator("a", "padel_queen", 50_000L, "padel", "padel"),
                creator("b", "padelmaster", 200_000L, "sports", "padel tips"),
                creator("c", "unknownreach", null, "padel"),
                creator("d", "chef_ana", 90_000L, "food", "cooking"),
                creator("e", "ghost", 70_000L, "padel").toBuilder().active(false).build()));
    }

    // ============================================================================
    // Queries
    // ============================================================================

    @Test
    @DisplayName("Niche query matches primary niche or interests, by reach with unknown last")
    void testFindByNiche_OrderAndMatch() {
        List<String> ids = ids(store.findByNiche("Padel", 10));
        assertEquals(List.of("b", "a", "c"), ids);
    }

    @Test
    @DisplayName("Inactive records are never returned")
    void testQueries_SkipInactive() {
        assertFalse(ids(store.findByNiche("padel", 10)).contains("e"));
        assertFalse(ids(store.findFallback(10)).contains("e"));
        assertTrue(store.findById("e").isPresent(), "lookup by id still sees it");
    }

    @Test
    @DisplayName("Keyword query searches handle, name, bio and interests")
    void testFindByKeyword() {
        assertEquals(List.of("d"), ids(store.findByKeyword("cooking", 10)));
        assertEquals(List.of("b", "a"), ids(store.findByKeyword("PADEL", 10)));
        assertEquals(List.of("b"), ids(store.findByKeyword("padel", 1)));
        assertTrue(store.findByKeyword(" ", 10).isEmpty());
    }

    @Test
    @DisplayName("Fallback puts complete metrics first and honours the limit")
    void testFindFallback_CompleteFirst() {
        store.save(creator("f", "small_complete", 1_000L, "travel").toBuilder().metricsComplete(true).build());
        List<String> ids = ids(store.findFallback(2));
        assertEquals(List.of("f", "b"), ids);
        assertTrue(store.findFallback(0).isEmpty());
    }

    // ============================================================================
    // Writes
    // ============================================================================

    @Test
    @DisplayName("updateVerified replaces existing records only")
    void testUpdateVerified() {
        CreatorRecord updated = creator("a", "padel_queen", 51_000L, "padel").toBuilder().metricsComplete(true).build();
        assertTrue(store.updateVerified(updated));
        assertEquals(51_000L, store.findById("a").orElseThrow().getFollowers());

        assertFalse(store.updateVerified(creator("zz", "nobody", 1L, "none")));
        assertFalse(store.findById("zz").isPresent());
    }

    @Test
    @DisplayName("Seed resource loads the bundled creators")
    void testLoadSeed() {
        StoreProperties properties = new StoreProperties();
        properties.setSeedResource("data/creators.yaml");
        InMemoryCandidateStore seeded = new InMemoryCandidateStore(properties);
        seeded.loadSeed();

        assertEquals(20, seeded.size());
        CreatorRecord marta = seeded.findById("ig-001").orElseThrow();
        assertEquals("martapadel", marta.getUsername());
        assertEquals(74.0, marta.getMetrics().getSpainAudiencePct());
        assertEquals(List.of("ig-020", "ig-002", "ig-001", "ig-013"), ids(seeded.findByNiche("padel", 10)));
    }

    private static List<String> ids(List<CreatorRecord> records) {
        return records.stream().map(CreatorRecord::getId).collect(Collectors.toList());
    }
}
