package com.di.creatormatch.agent.intelligence;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.creator.CreatorRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Brand conflict, saturation and niche relevance checks over the static reference graphs.
 * Consulted by the pre-filter, the filter engine and the ranking engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrandIntelligenceService {

    static final double COMPETITOR_AMBASSADOR_SCORE = 0.05;
    static final double PRIOR_MENTION_SCORE = 0.75;

    private final NicheTaxonomy taxonomy;
    private final BrandIntelligenceGraph brands;
    private final IntelligenceProperties properties;

    public NicheTaxonomy getTaxonomy() {
        return taxonomy;
    }

    // ------------------------------------------------------------------ //
    // Brand                                                               //
    // ------------------------------------------------------------------ //

    /** Brand key for the campaign: handle first, then name. Empty when the brand is not in the graph. */
    public Optional<String> targetBrandKey(CampaignQuery query) {
        Optional<String> byHandle = brands.resolveKey(query.getBrandHandle());
        if (byHandle.isPresent()) return byHandle;
        return brands.resolveKey(query.getBrandName());
    }

    /** Active ambassador of one of the target brand's competitors. */
    public Optional<String> competitorAmbassadorOf(CreatorRecord record, CampaignQuery query) {
        Optional<String> target = targetBrandKey(query);
        if (target.isEmpty()) return Optional.empty();
        Set<String> competitors = brands.competitorKeys(target.get());
        for (BrandIntelligenceGraph.Ambassadorship a : brands.ambassadorships(record.getUsername())) {
            if (a.isActive() && competitors.contains(a.getBrandKey())) return Optional.of(a.getBrandKey());
        }
        return Optional.empty();
    }

    /**
     * Brand affinity: 0.5 without brand context or signal; competitor ambassador and competitor mentions
     * push it down by conflict severity; existing ambassadors of the target brand are "saturated";
     * a prior mention of the target brand lifts it to 0.75.
     */
    public BrandAffinity brandAffinity(CreatorRecord record, CampaignQuery query) {
        if (!query.hasBrandContext()) return BrandAffinity.neutral(BrandAffinity.Signal.NO_BRAND_CONTEXT);
        Optional<String> targetKey = targetBrandKey(query);
        Set<String> mentions = normalizedMentions(record);

        if (targetKey.isEmpty()) {
            // Unknown brand: only a direct mention of the given handle or name counts.
            Set<String> own = new LinkedHashSet<>();
            if (query.getBrandHandle() != null) own.add(BrandIntelligenceGraph.normalize(query.getBrandHandle()));
            if (query.getBrandName() != null) own.add(BrandIntelligenceGraph.normalize(query.getBrandName()));
            return intersects(mentions, own)
                    ? new BrandAffinity(PRIOR_MENTION_SCORE, BrandAffinity.Signal.PRIOR_MENTION, null)
                    : BrandAffinity.neutral(BrandAffinity.Signal.NEUTRAL);
        }

        String target = targetKey.get();
        BrandDefinition def = brands.find(target).orElseGet(BrandDefinition::new);

        Optional<String> rival = competitorAmbassadorOf(record, query);
        if (rival.isPresent()) {
            return new BrandAffinity(COMPETITOR_AMBASSADOR_SCORE, BrandAffinity.Signal.COMPETITOR_AMBASSADOR,
                    "Known ambassador for competitor " + brands.displayName(rival.get()));
        }

        Set<String> competitorMarks = new LinkedHashSet<>(brands.competitorHandles(target));
        competitorMarks.addAll(brands.competitorKeys(target));
        List<String> mentioned = new ArrayList<>();
        for (String m : mentions) {
            if (competitorMarks.contains(m)) mentioned.add(m);
        }
        if (!mentioned.isEmpty()) {
            return new BrandAffinity(competitorMentionScore(def.getConflictSeverity()),
                    BrandAffinity.Signal.COMPETITOR_MENTION,
                    "Has mentioned competitor brand(s): " + String.join(", ", mentioned));
        }

        for (BrandIntelligenceGraph.Ambassadorship a : brands.ambassadorships(record.getUsername())) {
            if (a.getBrandKey().equals(target) && a.isActive()) {
                String since = a.getSince() != null ? " since " + a.getSince() : "";
                return new BrandAffinity(saturationScore(a.getRelationship()), BrandAffinity.Signal.SATURATION,
                        "Already " + brands.displayName(target) + " " + a.getRelationship() + since);
            }
        }

        if (intersects(mentions, brands.ownHandles(target))) {
            return new BrandAffinity(PRIOR_MENTION_SCORE, BrandAffinity.Signal.PRIOR_MENTION, null);
        }
        return BrandAffinity.neutral(BrandAffinity.Signal.NEUTRAL);
    }

    /** Prior brand campaign experience: the creator has tagged at least one brand. */
    public boolean hasBrandCampaignExperience(CreatorRecord record) {
        return !record.getBrandMentions().isEmpty();
    }

    static double competitorMentionScore(String severity) {
        String s = severity != null ? severity.toLowerCase(Locale.ROOT) : "medium";
        switch (s) {
            case "high":
                return 0.25;
            case "low":
                return 0.45;
            default:
                return 0.35;
        }
    }

    static double saturationScore(String relationship) {
        if ("lifetime_deal".equalsIgnoreCase(relationship)) return 0.35;
        if ("ambassador".equalsIgnoreCase(relationship)) return 0.40;
        return 0.45;
    }

    // ------------------------------------------------------------------ //
    // Niche                                                               //
    // ------------------------------------------------------------------ //

    /**
     * Niche the creator belongs to: the stored primary niche when the taxonomy knows it and its confidence
     * is high enough, otherwise keyword detection over bio and interests.
     */
    public Optional<NicheTaxonomy.Detection> classify(CreatorRecord record) {
        String stored = record.getPrimaryNiche();
        if (stored != null && !stored.isBlank()) {
            Double confidence = record.getNicheConfidence();
            Optional<String> key = taxonomy.resolve(stored);
            if (key.isPresent() && (confidence == null || confidence >= properties.getMinNicheConfidence())) {
                return Optional.of(new NicheTaxonomy.Detection(key.get(), List.of(stored)));
            }
        }
        return taxonomy.detect(record.getInterests(), record.getBio());
    }

    /** Tags of the creator (primary niche, detected niche, interests), lowercased. */
    public Set<String> creatorTags(CreatorRecord record) {
        Set<String> tags = new LinkedHashSet<>();
        if (record.getPrimaryNiche() != null && !record.getPrimaryNiche().isBlank()) {
            tags.add(record.getPrimaryNiche().trim().toLowerCase(Locale.ROOT));
        }
        classify(record).ifPresent(d -> tags.add(d.getNiche()));
        for (String i : record.getInterests()) {
            if (i != null && !i.isBlank()) tags.add(i.trim().toLowerCase(Locale.ROOT));
        }
        return tags;
    }

    /**
     * Whether any creator tag names one of the excluded niches (directly or through a taxonomy alias).
     */
    public Optional<String> matchedExclusion(CreatorRecord record, List<String> excludeNiches) {
        if (excludeNiches == null || excludeNiches.isEmpty()) return Optional.empty();
        Set<String> tags = creatorTags(record);
        Set<String> resolvedTags = new LinkedHashSet<>();
        for (String t : tags) resolvedTags.add(taxonomy.resolve(t).orElse(t));
        for (String excluded : excludeNiches) {
            if (excluded == null || excluded.isBlank()) continue;
            String e = excluded.trim().toLowerCase(Locale.ROOT);
            String resolved = taxonomy.resolve(e).orElse(e);
            if (tags.contains(e) || resolvedTags.contains(resolved)) return Optional.of(e);
        }
        return Optional.empty();
    }

    /**
     * Taxonomy-aware niche relevance of a creator for {@code campaignNiche}.
     * Unknown campaign niches score neutral.
     */
    public NicheRelevance nicheRelevance(CreatorRecord record, String campaignNiche) {
        NicheRules rules = taxonomy.getRules();
        Optional<String> campaignKey = taxonomy.resolve(campaignNiche);
        if (campaignKey.isEmpty()) {
            return new NicheRelevance(rules.getNeutralScore(), NicheRelevance.MatchType.NEUTRAL, null, List.of(), false);
        }
        String key = campaignKey.get();
        long followers = record.followersOrZero();
        boolean celebrity = followers > rules.getCelebrityThreshold();

        Optional<NicheTaxonomy.Detection> detection = classify(record);
        String creatorNiche = detection.map(NicheTaxonomy.Detection::getNiche).orElse(null);
        List<String> matched = detection.map(NicheTaxonomy.Detection::getMatchedKeywords).orElse(List.of());

        if (creatorNiche != null) {
            if (creatorNiche.equals(key) || taxonomy.isAlias(key, creatorNiche)) {
                return new NicheRelevance(rules.getExactMatchScore(), NicheRelevance.MatchType.EXACT, creatorNiche, matched, false);
            }
            if (taxonomy.relatedOf(key).contains(creatorNiche)) {
                return new NicheRelevance(rules.getRelatedNicheScore(), NicheRelevance.MatchType.RELATED, creatorNiche, matched, false);
            }
            if (taxonomy.conflictingOf(key).contains(creatorNiche)) {
                double score = celebrity ? rules.getCelebrityMismatchPenalty() : rules.getConflictingNichePenalty();
                return new NicheRelevance(score, NicheRelevance.MatchType.CONFLICTING, creatorNiche, matched, celebrity);
            }
        }

        List<String> campaignKeywords = taxonomy.keywordsOf(key);
        if (!campaignKeywords.isEmpty()) {
            String searchable = NicheTaxonomy.searchable(record.getInterests(), record.getBio());
            List<String> direct = new ArrayList<>();
            for (String kw : campaignKeywords) {
                if (kw != null && searchable.contains(kw.toLowerCase(Locale.ROOT))) direct.add(kw);
            }
            if (!direct.isEmpty()) {
                double ratio = (double) direct.size() / campaignKeywords.size();
                return new NicheRelevance(rules.getPartialBase() + ratio * rules.getPartialSpan(),
                        NicheRelevance.MatchType.PARTIAL, creatorNiche, direct, false);
            }
        }

        if (celebrity) {
            return new NicheRelevance(rules.getGenericCelebrityScore(), NicheRelevance.MatchType.NEUTRAL, creatorNiche, List.of(), true);
        }
        return new NicheRelevance(rules.getNeutralScore(), NicheRelevance.MatchType.NEUTRAL, creatorNiche, List.of(), false);
    }

    private static Set<String> normalizedMentions(CreatorRecord record) {
        Set<String> out = new LinkedHashSet<>();
        for (String m : record.getBrandMentions()) {
            if (m != null && !m.isBlank()) out.add(BrandIntelligenceGraph.normalize(m));
        }
        return out;
    }

    private static boolean intersects(Set<String> a, Set<String> b) {
        for (String x : a) {
            if (b.contains(x)) return true;
        }
        return false;
    }
}
