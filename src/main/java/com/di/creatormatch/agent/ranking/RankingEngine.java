package com.di.creatormatch.agent.ranking;

import com.di.creatormatch.agent.campaign.AgeBand;
import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.campaign.GenderFilter;
import com.di.creatormatch.agent.creator.Candidate;
import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.intelligence.BrandAffinity;
import com.di.creatormatch.agent.intelligence.BrandIntelligenceService;
import com.di.creatormatch.agent.intelligence.NicheRelevance;
import com.di.creatormatch.agent.intelligence.NicheTaxonomy;
import com.di.creatormatch.aspect.LogStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores filtered candidates on eight factors, applies the size multiplier and sorts.
 * <p>
 * Order: relevance descending, then followers descending, then creator id ascending. Scores are rounded to
 * four decimals before sorting so that repeated runs over the same data order identically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankingEngine {

    static final double NEUTRAL = 0.5;
    static final double EXCLUDED_KEYWORD_SCORE = 0.10;

    static final double THEME_SHARE = 0.4;
    static final double TONE_SHARE = 0.3;
    static final double EXPERIENCE_SHARE = 0.3;

    private static final Comparator<RankedResult> ORDER = Comparator
            .comparingDouble(RankedResult::getRelevanceScore).reversed()
            .thenComparing(Comparator.comparingLong((RankedResult r) -> r.getCreator().followersOrZero()).reversed())
            .thenComparing(r -> r.getCreator().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final BrandIntelligenceService intelligence;
    private final WeightSuggestionResolver weightResolver;
    private final ScoringProperties properties;

    /** Ranks with weights resolved from the query's suggestions. */
    @LogStage("RANK")
    public List<RankedResult> rank(List<Candidate> candidates, CampaignQuery query) {
        return rank(candidates, query, weightResolver.resolve(query.getSuggestedWeights()));
    }

    public List<RankedResult> rank(List<Candidate> candidates, CampaignQuery query, RankingWeights weights) {
        List<RankedResult> scored = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            scored.add(score(c, query, weights));
        }
        scored.sort(ORDER);
        List<RankedResult> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            ranked.add(scored.get(i).toBuilder().rankPosition(i + 1).build());
        }
        if (!ranked.isEmpty()) {
            log.info("[RANK] Ranked {} candidates, top={} ({}), weights={}", ranked.size(),
                    ranked.get(0).getCreator().getId(), ranked.get(0).getRelevanceScore(), weights);
        }
        return ranked;
    }

    RankedResult score(Candidate candidate, CampaignQuery query, RankingWeights weights) {
        CreatorRecord r = candidate.getRecord();
        CreatorMetrics m = r.getMetrics();
        List<String> warnings = new ArrayList<>();

        BrandAffinity affinity = intelligence.brandAffinity(r, query);
        if (affinity.getWarning() != null) warnings.add(affinity.getWarning());

        NicheRelevance niche = null;
        double nicheScore;
        if (query.hasCampaignNiche()) {
            niche = intelligence.nicheRelevance(r, query.getCampaignNiche());
            nicheScore = niche.getScore();
            if (niche.isCelebrityMismatch()) {
                warnings.add("Mega-reach account outside the campaign niche (" + niche.getCreatorNiche() + ")");
            }
        } else {
            nicheScore = keywordNicheScore(r, query);
        }

        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .credibility(credibility(m))
                .engagement(engagement(m.getEngagementRate(), properties.getEngagementCeiling()))
                .audienceMatch(audienceMatch(m, query))
                .growth(growth(m.getFollowerGrowthRate6m(), properties.getGrowthOffset(), properties.getGrowthSpan()))
                .geography(geography(m))
                .brandAffinity(clamp(affinity.getScore()))
                .creativeFit(creativeFit(r, query))
                .nicheMatch(clamp(nicheScore))
                .build();

        double weighted = breakdown.weightedSum(weights);
        double multiplier = SizeMultiplier.of(r.getFollowers(), query.getPreferredFollowerMin(),
                query.getPreferredFollowerMax(), properties);
        if (!r.hasKnownFollowers()) {
            warnings.add("Follower count unknown");
        } else if (multiplier < 1.0) {
            warnings.add("Follower count outside the preferred range");
        }
        if (!candidate.isVerified()) {
            warnings.add("Metrics not verified");
        }

        return RankedResult.builder()
                .candidate(candidate)
                .relevanceScore(round4(clamp(weighted * multiplier)))
                .weightedScore(round4(weighted))
                .sizeMultiplier(multiplier)
                .scores(breakdown)
                .tier(r.getTier())
                .nicheMatchType(niche != null ? niche.getMatchType() : null)
                .brandSignal(affinity.getSignal())
                .warnings(warnings)
                .build();
    }

    // ------------------------------------------------------------------ //
    // Sub-scores                                                          //
    // ------------------------------------------------------------------ //

    static double credibility(CreatorMetrics m) {
        return m.getCredibilityScore() == null ? 0.0 : clamp(m.getCredibilityScore() / 100.0);
    }

    static double engagement(Double rate, double ceiling) {
        if (rate == null) return 0.0;
        double fraction = rate >= 1.0 ? rate / 100.0 : rate;
        return clamp(fraction / ceiling);
    }

    static double growth(Double rate, double offset, double span) {
        if (rate == null) return NEUTRAL;
        return clamp((rate + offset) / span);
    }

    static double geography(CreatorMetrics m) {
        Double es = m.getSpainAudiencePct();
        return es == null ? 0.0 : clamp(es / 100.0);
    }

    /** Mean of gender fit and age overlap over whichever targets the query sets; neutral otherwise. */
    static double audienceMatch(CreatorMetrics m, CampaignQuery query) {
        double total = 0.0;
        int parts = 0;
        GenderFilter target = query.getTargetAudienceGender();
        if (target != null && target.isSpecified()) {
            Double pct = m.getGenderPct(target.getValue());
            total += pct == null ? NEUTRAL : clamp(pct / 100.0);
            parts++;
        }
        List<AgeBand> bands = query.getTargetAgeRanges();
        if (!bands.isEmpty()) {
            Map<String, Double> ages = m.getAudienceAgeDistribution();
            if (ages.isEmpty()) {
                total += NEUTRAL;
            } else {
                double overlap = 0.0;
                for (AgeBand band : bands) {
                    Double v = ages.get(band.getLabel());
                    if (v != null) overlap += v;
                }
                total += clamp(overlap / 100.0);
            }
            parts++;
        }
        return parts == 0 ? NEUTRAL : total / parts;
    }

    /**
     * 40 % theme overlap, 30 % tone overlap, 30 % prior brand work. A brief component the query leaves
     * empty counts as neutral; no brief at all is neutral.
     */
    double creativeFit(CreatorRecord r, CampaignQuery query) {
        if (!query.hasCreativeBrief()) return NEUTRAL;
        String text = contentText(r);
        double theme = query.getThemeKeywords().isEmpty() ? NEUTRAL : overlap(query.getThemeKeywords(), text);
        double tone = query.getToneKeywords().isEmpty() ? NEUTRAL : overlap(query.getToneKeywords(), text);
        double experience = intelligence.hasBrandCampaignExperience(r) ? 1.0 : 0.0;
        return clamp(THEME_SHARE * theme + TONE_SHARE * tone + EXPERIENCE_SHARE * experience);
    }

    /**
     * Niche score without a campaign niche: an excluded niche scores {@link #EXCLUDED_KEYWORD_SCORE};
     * otherwise topic keyword overlap lifts the score from neutral.
     */
    double keywordNicheScore(CreatorRecord r, CampaignQuery query) {
        if (intelligence.matchedExclusion(r, query.getExcludeNiches()).isPresent()) {
            return EXCLUDED_KEYWORD_SCORE;
        }
        if (query.getTopicKeywords().isEmpty()) return NEUTRAL;
        double ratio = overlap(query.getTopicKeywords(), contentText(r));
        return NEUTRAL + NEUTRAL * ratio;
    }

    private static String contentText(CreatorRecord r) {
        String text = NicheTaxonomy.searchable(r.getInterests(), r.getBio());
        if (r.getPrimaryNiche() != null) text += " " + r.getPrimaryNiche().toLowerCase(Locale.ROOT);
        return text;
    }

    /** Share of {@code keywords} appearing in {@code text}. */
    static double overlap(List<String> keywords, String text) {
        int considered = 0;
        int hits = 0;
        for (String k : keywords) {
            if (k == null || k.isBlank()) continue;
            considered++;
            if (text.contains(k.trim().toLowerCase(Locale.ROOT))) hits++;
        }
        return considered == 0 ? 0.0 : (double) hits / considered;
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
