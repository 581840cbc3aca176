package com.di.creatormatch.agent.prefilter;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.intelligence.BrandIntelligenceService;
import com.di.creatormatch.agent.verification.VerificationProperties;
import com.di.creatormatch.aspect.LogStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ranks a candidate pool using only locally known fields and keeps the top K, which caps the
 * verification spend regardless of pool size. No I/O.
 * <p>Metrics older than the verification freshness window count as missing.
 */
@Slf4j
@Service
public class PreFilterScorer {

    private final BrandIntelligenceService intelligence;
    private final PreFilterProperties properties;
    private final Clock clock;
    private final Duration freshness;

    @Autowired
    public PreFilterScorer(BrandIntelligenceService intelligence, PreFilterProperties properties,
                           VerificationProperties verification, Clock clock) {
        this(intelligence, properties, clock, Duration.ofHours(verification.getFreshnessHours()));
    }

    public PreFilterScorer(BrandIntelligenceService intelligence, PreFilterProperties properties,
                           Clock clock, Duration freshness) {
        this.intelligence = intelligence;
        this.properties = properties;
        this.clock = clock;
        this.freshness = freshness;
    }

    /** A pool entry with its heuristic score. */
    public static final class Scored {
        private final CreatorRecord record;
        private final double score;

        Scored(CreatorRecord record, double score) {
            this.record = record;
            this.score = score;
        }

        public CreatorRecord getRecord() {
            return record;
        }

        public double getScore() {
            return score;
        }
    }

    private static final Comparator<Scored> ORDER = Comparator
            .comparingDouble(Scored::getScore).reversed()
            .thenComparing(Comparator.comparingLong((Scored s) -> s.getRecord().followersOrZero()).reversed())
            .thenComparing(s -> s.getRecord().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Top {@code k} of {@code pool}, ordered by heuristic score desc, followers desc, id asc.
     */
    @LogStage("PREFILTER")
    public List<CreatorRecord> selectTopK(List<CreatorRecord> pool, CampaignQuery query, int k) {
        if (pool == null || pool.isEmpty() || k <= 0) return List.of();
        List<Scored> scored = new ArrayList<>(pool.size());
        for (CreatorRecord r : pool) {
            scored.add(new Scored(r, score(r, query)));
        }
        scored.sort(ORDER);
        List<CreatorRecord> top = new ArrayList<>(Math.min(k, scored.size()));
        for (int i = 0; i < scored.size() && top.size() < k; i++) {
            top.add(scored.get(i).getRecord());
        }
        log.info("[PREFILTER] Selected {} of {} candidates (k={})", top.size(), pool.size(), k);
        return top;
    }

    public double score(CreatorRecord r, CampaignQuery query) {
        double score = 0.0;
        if (!hasUsableMetrics(r, clock.instant(), freshness)) {
            score += properties.getMetricsMissingBonus();
        } else if (clearsThresholds(r, query)) {
            score += properties.getMetricsPassBonus();
        }
        if (matchesNiche(r, query)) {
            score += properties.getNicheMatchBonus();
        }
        if (intelligence.matchedExclusion(r, query.getExcludeNiches()).isPresent()) {
            score -= properties.getExcludePenalty();
        }
        if (query.isExcludeCompetitorAmbassadors() && intelligence.competitorAmbassadorOf(r, query).isPresent()) {
            score -= properties.getExcludePenalty();
        }
        if (r.hasKnownFollowers() && inPreferredRange(r.getFollowers(), query)) {
            score += properties.getSizeRangeBonus();
        }
        return score;
    }

    /** Complete for the platform and verified inside the freshness window. */
    static boolean hasUsableMetrics(CreatorRecord r, Instant now, Duration freshness) {
        return r.isFresh(now, freshness) && r.getMetrics() != null && r.getMetrics().isCompleteFor(r.getPlatform());
    }

    static boolean clearsThresholds(CreatorRecord r, CampaignQuery query) {
        CreatorMetrics m = r.getMetrics();
        if (query.getMinCredibilityScore() != null && r.getPlatform() != null && r.getPlatform().reportsCredibility()) {
            if (m.getCredibilityScore() == null || m.getCredibilityScore() < query.getMinCredibilityScore()) return false;
        }
        if (query.getMinSpainAudiencePct() != null) {
            Double es = m.getSpainAudiencePct();
            if (es == null || es < query.getMinSpainAudiencePct()) return false;
        }
        Double minEr = query.normalizedMinEngagement();
        if (minEr != null) {
            Double er = m.getEngagementRate();
            if (er == null) return false;
            // stored rates of 1 or more are percentages
            if ((er >= 1.0 ? er / 100.0 : er) < minEr) return false;
        }
        return true;
    }

    private boolean matchesNiche(CreatorRecord r, CampaignQuery query) {
        Set<String> wanted = new LinkedHashSet<>();
        if (query.hasCampaignNiche()) {
            String niche = query.getCampaignNiche().trim().toLowerCase(Locale.ROOT);
            wanted.add(niche);
            intelligence.getTaxonomy().resolve(niche).ifPresent(wanted::add);
            intelligence.getTaxonomy().find(niche).ifPresent(def ->
                    def.getAliases().forEach(a -> wanted.add(a.toLowerCase(Locale.ROOT))));
        }
        for (String topic : query.getTopicKeywords()) {
            if (topic != null && !topic.isBlank()) wanted.add(topic.trim().toLowerCase(Locale.ROOT));
        }
        if (wanted.isEmpty()) return false;
        for (String tag : intelligence.creatorTags(r)) {
            if (wanted.contains(tag)) return true;
        }
        return false;
    }

    static boolean inPreferredRange(long followers, CampaignQuery query) {
        Long min = query.getPreferredFollowerMin();
        Long max = query.getPreferredFollowerMax();
        return (min == null || followers >= min) && (max == null || followers <= max);
    }
}
