package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Cache-in-front of {@link JdbcCandidateStore} when persistence and the store cache are enabled.
 * Any write clears the query cache so freshly verified metrics are visible to the next search.
 */
@Service
@Primary
@ConditionalOnProperty(prefix = "creatormatch.store", name = {"persistence-enabled", "cache-enabled"}, havingValue = "true")
public class CachingCandidateStore implements CandidateStore {

    private final CandidateStore delegate;
    private final Cache<String, CreatorRecord> byId;
    private final Cache<String, List<CreatorRecord>> queries;

    @Autowired
    public CachingCandidateStore(JdbcCandidateStore delegate, StoreProperties properties) {
        this(delegate, properties.getCache());
    }

    CachingCandidateStore(CandidateStore delegate, StoreProperties.Cache cache) {
        this.delegate = delegate;
        this.byId = Caffeine.newBuilder()
                .maximumSize(cache.getByIdMaxSize())
                .expireAfterWrite(cache.getByIdExpireAfterWriteMinutes(), TimeUnit.MINUTES)
                .build();
        this.queries = Caffeine.newBuilder()
                .maximumSize(cache.getQueryMaxSize())
                .expireAfterWrite(cache.getQueryExpireAfterWriteMinutes(), TimeUnit.MINUTES)
                .build();
    }

    @Override
    public List<CreatorRecord> findByNiche(String niche, int limit) {
        return queries.get("niche|" + niche + "|" + limit, k -> delegate.findByNiche(niche, limit));
    }

    @Override
    public List<CreatorRecord> findByKeyword(String keyword, int limit) {
        return queries.get("keyword|" + keyword + "|" + limit, k -> delegate.findByKeyword(keyword, limit));
    }

    @Override
    public List<CreatorRecord> findFallback(int limit) {
        return queries.get("fallback|" + limit, k -> delegate.findFallback(limit));
    }

    @Override
    public Optional<CreatorRecord> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        CreatorRecord cached = byId.getIfPresent(id);
        if (cached != null) return Optional.of(cached);
        Optional<CreatorRecord> fromDb = delegate.findById(id);
        fromDb.ifPresent(r -> byId.put(id, r));
        return fromDb;
    }

    @Override
    public void save(CreatorRecord record) {
        delegate.save(record);
        invalidate(record);
    }

    @Override
    public boolean updateVerified(CreatorRecord verified) {
        boolean updated = delegate.updateVerified(verified);
        if (updated) invalidate(verified);
        return updated;
    }

    private void invalidate(CreatorRecord record) {
        if (record != null && record.getId() != null) byId.invalidate(record.getId());
        queries.invalidateAll();
    }
}
