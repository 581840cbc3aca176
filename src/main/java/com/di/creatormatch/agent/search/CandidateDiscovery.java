package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.store.CandidateStore;
import com.di.creatormatch.aspect.LogStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the candidate pool from the store: campaign niche first, then search and topic keywords,
 * then the generic fallback, deduplicated by id, capped at the pool size.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateDiscovery {

    private final CandidateStore store;

    @LogStage("DISCOVERY")
    public List<CreatorRecord> discover(CampaignQuery query, int poolSize) {
        Map<String, CreatorRecord> pool = new LinkedHashMap<>();
        if (poolSize <= 0) return List.of();

        int fromNiche = 0;
        if (query.hasCampaignNiche()) {
            fromNiche = addAll(pool, store.findByNiche(query.getCampaignNiche().trim(), poolSize), poolSize);
        }
        int fromKeywords = 0;
        for (String keyword : keywords(query)) {
            if (pool.size() >= poolSize) break;
            fromKeywords += addAll(pool, store.findByKeyword(keyword, poolSize - pool.size()), poolSize);
        }
        int fromFallback = 0;
        if (pool.size() < poolSize) {
            fromFallback = addAll(pool, store.findFallback(poolSize), poolSize);
        }
        log.info("[SEARCH] Discovered {} candidates (niche={}, keywords={}, fallback={}, poolSize={})",
                pool.size(), fromNiche, fromKeywords, fromFallback, poolSize);
        return new ArrayList<>(pool.values());
    }

    private static Set<String> keywords(CampaignQuery query) {
        Set<String> out = new LinkedHashSet<>();
        for (String k : query.getSearchKeywords()) {
            if (k != null && !k.isBlank()) out.add(k.trim());
        }
        for (String k : query.getTopicKeywords()) {
            if (k != null && !k.isBlank()) out.add(k.trim());
        }
        return out;
    }

    private static int addAll(Map<String, CreatorRecord> pool, List<CreatorRecord> records, int poolSize) {
        int added = 0;
        for (CreatorRecord r : records) {
            if (pool.size() >= poolSize) break;
            if (r.getId() != null && pool.putIfAbsent(r.getId(), r) == null) added++;
        }
        return added;
    }
}
