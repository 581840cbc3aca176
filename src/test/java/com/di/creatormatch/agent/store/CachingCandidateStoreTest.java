package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.di.creatormatch.agent.store.StoreFixtures.creator;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CachingCandidateStore Tests")
class CachingCandidateStoreTest {

    private CountingStore delegate;
    private CachingCandidateStore store;

    @BeforeEach
    void setUp() {
        delegate = new CountingStore();
        delegate.save(creator("a", "padel_queen", 50_000L, "padel", "padel"));
        store = new CachingCandidateStore(delegate, new StoreProperties.Cache());
    }

    @Test
    @DisplayName("Repeated queries are served from cache")
    void testFindByNiche_Cached() {
        store.findByNiche("padel", 10);
        store.findByNiche("padel", 10);
        store.findByNiche("padel", 5);
        assertEquals(2, delegate.queries, "different limit is a different entry");

        store.findById("a");
        store.findById("a");
        assertEquals(1, delegate.byIdLookups);
    }

    @Test
    @DisplayName("A verified update invalidates cached queries and the record")
    void testUpdateVerified_Invalidates() {
        store.findById("a");
        store.findFallback(10);

        assertTrue(store.updateVerified(creator("a", "padel_queen", 60_000L, "padel")));

        assertEquals(60_000L, store.findById("a").orElseThrow().getFollowers());
        store.findFallback(10);
        assertEquals(2, delegate.byIdLookups);
        assertEquals(2, delegate.queries);
    }

    @Test
    @DisplayName("Blank ids never reach the delegate")
    void testFindById_Blank() {
        assertTrue(store.findById(" ").isEmpty());
        assertEquals(0, delegate.byIdLookups);
    }

    static class CountingStore extends InMemoryCandidateStore {
        int queries;
        int byIdLookups;

        @Override
        public List<CreatorRecord> findByNiche(String niche, int limit) {
            queries++;
            return super.findByNiche(niche, limit);
        }

        @Override
        public List<CreatorRecord> findFallback(int limit) {
            queries++;
            return super.findFallback(limit);
        }

        @Override
        public Optional<CreatorRecord> findById(String id) {
            byIdLookups++;
            return super.findById(id);
        }
    }
}
