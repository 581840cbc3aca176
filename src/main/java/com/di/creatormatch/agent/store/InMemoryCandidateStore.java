package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link CandidateStore}. Suitable for single-node and testing.
 * When {@code creatormatch.store.persistence-enabled=true}, {@link JdbcCandidateStore} is used instead.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "creatormatch.store.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryCandidateStore implements CandidateStore {

    private final Map<String, CreatorRecord> byId = new ConcurrentHashMap<>();
    private final String seedResource;

    @Autowired
    public InMemoryCandidateStore(StoreProperties properties) {
        this.seedResource = properties.getSeedResource();
    }

    public InMemoryCandidateStore() {
        this.seedResource = "";
    }

    @PostConstruct
    void loadSeed() {
        if (seedResource == null || seedResource.isBlank()) return;
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream in = new ClassPathResource(seedResource).getInputStream()) {
            Map<String, List<CreatorRecord>> root = yaml.readValue(in, new TypeReference<>() {
            });
            List<CreatorRecord> creators = root.getOrDefault("creators", List.of());
            creators.forEach(this::save);
            log.info("[STORE] Seeded {} creators from {}", creators.size(), seedResource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load creator seed " + seedResource, e);
        }
    }

    @Override
    public List<CreatorRecord> findByNiche(String niche, int limit) {
        return query(r -> CandidateOrdering.matchesNiche(r, niche), limit);
    }

    @Override
    public List<CreatorRecord> findByKeyword(String keyword, int limit) {
        return query(r -> CandidateOrdering.matchesKeyword(r, keyword), limit);
    }

    @Override
    public List<CreatorRecord> findFallback(int limit) {
        if (limit <= 0) return List.of();
        return byId.values().stream()
                .filter(CreatorRecord::isActive)
                .sorted(CandidateOrdering.FALLBACK)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<CreatorRecord> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public void save(CreatorRecord record) {
        if (record == null || record.getId() == null) return;
        byId.put(record.getId(), record);
    }

    @Override
    public boolean updateVerified(CreatorRecord verified) {
        if (verified == null || verified.getId() == null) return false;
        return byId.computeIfPresent(verified.getId(), (id, old) -> verified) != null;
    }

    public void saveAll(Collection<CreatorRecord> records) {
        records.forEach(this::save);
    }

    public int size() {
        return byId.size();
    }

    private List<CreatorRecord> query(Predicate<CreatorRecord> match, int limit) {
        if (limit <= 0) return List.of();
        List<CreatorRecord> out = new ArrayList<>();
        byId.values().stream()
                .filter(CreatorRecord::isActive)
                .filter(match)
                .sorted(CandidateOrdering.BY_REACH)
                .limit(limit)
                .forEach(out::add);
        return out;
    }
}
