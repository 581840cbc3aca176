package com.di.creatormatch.agent.filter;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.campaign.GenderFilter;
import com.di.creatormatch.agent.creator.Candidate;
import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.intelligence.BrandIntelligenceService;
import com.di.creatormatch.aspect.LogStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Threshold and hard filters over verified and unverified candidates.
 * <p>
 * Threshold rules (credibility, Spain audience, engagement, growth, audience gender) run in
 * {@link FilterMode#STRICT} for verified candidates and {@link FilterMode#LENIENT} otherwise.
 * Hard rules (excluded niche, competitor ambassador, creator gender, follower range) apply in both modes.
 * The follower range is dropped when it would leave nothing; ranking's size multiplier then takes over.
 * Never reorders.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FilterEngine {

    static final String SPAIN = "ES";

    private final BrandIntelligenceService intelligence;
    private final CreatorGenderInference genderInference;

    @LogStage("FILTER")
    public FilterResult apply(List<Candidate> candidates, CampaignQuery query) {
        Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);
        List<Candidate> survivors = new ArrayList<>();
        int strict = 0;

        for (Candidate c : candidates) {
            FilterMode mode = FilterMode.forCandidate(c);
            if (mode == FilterMode.STRICT) strict++;
            Optional<RejectionReason> reason = check(c.getRecord(), query, mode);
            if (reason.isPresent()) {
                rejections.merge(reason.get(), 1, Integer::sum);
                log.debug("[FILTER] Rejected {} ({}): {}", c.getId(), mode, reason.get());
            } else {
                survivors.add(c);
            }
        }

        List<Candidate> inRange = new ArrayList<>();
        for (Candidate c : survivors) {
            if (inFollowerRange(c.getRecord(), query)) inRange.add(c);
        }
        boolean relaxed = false;
        List<Candidate> passed;
        if (inRange.isEmpty() && !survivors.isEmpty() && hasFollowerRange(query)) {
            relaxed = true;
            passed = survivors;
            log.info("[FILTER] Follower range [{}, {}] would remove all {} survivors; relaxing it",
                    query.getPreferredFollowerMin(), query.getPreferredFollowerMax(), survivors.size());
        } else {
            int outOfRange = survivors.size() - inRange.size();
            if (outOfRange > 0) rejections.merge(RejectionReason.FOLLOWER_RANGE, outOfRange, Integer::sum);
            passed = inRange;
        }

        log.info("[FILTER] in={} strict={} lenient={} passed={} rejections={} followerRangeRelaxed={}",
                candidates.size(), strict, candidates.size() - strict, passed.size(), rejections, relaxed);
        return FilterResult.builder()
                .passed(passed)
                .rejections(rejections)
                .followerRangeRelaxed(relaxed)
                .build();
    }

    /** First rule {@code record} fails under {@code mode}, or empty when it passes everything but the follower range. */
    Optional<RejectionReason> check(CreatorRecord record, CampaignQuery query, FilterMode mode) {
        if (intelligence.matchedExclusion(record, query.getExcludeNiches()).isPresent()) {
            return Optional.of(RejectionReason.EXCLUDED_NICHE);
        }
        if (query.isExcludeCompetitorAmbassadors() && intelligence.competitorAmbassadorOf(record, query).isPresent()) {
            return Optional.of(RejectionReason.COMPETITOR_AMBASSADOR);
        }
        if (!genderInference.matches(record, query.getCreatorGender())) {
            return Optional.of(RejectionReason.CREATOR_GENDER);
        }

        CreatorMetrics m = record.getMetrics();
        boolean credibilityRequired = record.getPlatform() == null || record.getPlatform().reportsCredibility();
        if (query.getMinCredibilityScore() != null
                && failsMinimum(m.getCredibilityScore(), query.getMinCredibilityScore(), mode.rejectsMissing() && credibilityRequired)) {
            return Optional.of(RejectionReason.CREDIBILITY);
        }
        if (query.getMinSpainAudiencePct() != null && !passesSpain(record, query.getMinSpainAudiencePct(), mode)) {
            return Optional.of(RejectionReason.SPAIN_AUDIENCE);
        }
        Double minEngagement = query.normalizedMinEngagement();
        if (minEngagement != null && failsMinimum(engagementFraction(m.getEngagementRate()), minEngagement, mode.rejectsMissing())) {
            return Optional.of(RejectionReason.ENGAGEMENT);
        }
        if (query.getMinFollowerGrowthRate() != null
                && failsMinimum(m.getFollowerGrowthRate6m(), query.getMinFollowerGrowthRate(), mode.rejectsMissing())) {
            return Optional.of(RejectionReason.FOLLOWER_GROWTH);
        }
        GenderFilter audience = query.getTargetAudienceGender();
        if (audience != null && audience.isSpecified()
                && failsMinimum(m.getGenderPct(audience.getValue()), 50.0, mode.rejectsMissing())) {
            return Optional.of(RejectionReason.AUDIENCE_GENDER);
        }
        return Optional.empty();
    }

    /** Spain share from the geography breakdown, else the coarse home country. */
    static boolean passesSpain(CreatorRecord record, double minPct, FilterMode mode) {
        Double pct = record.getMetrics().getSpainAudiencePct();
        if (pct != null) return pct >= minPct;
        String country = record.getCountry();
        if (country != null && !country.isBlank()) return SPAIN.equalsIgnoreCase(country.trim());
        return !mode.rejectsMissing();
    }

    static boolean inFollowerRange(CreatorRecord record, CampaignQuery query) {
        if (!record.hasKnownFollowers()) return true;
        long f = record.getFollowers();
        if (query.getPreferredFollowerMin() != null && f < query.getPreferredFollowerMin()) return false;
        return query.getPreferredFollowerMax() == null || f <= query.getPreferredFollowerMax();
    }

    private static boolean hasFollowerRange(CampaignQuery query) {
        return query.getPreferredFollowerMin() != null || query.getPreferredFollowerMax() != null;
    }

    private static boolean failsMinimum(Double value, double minimum, boolean rejectMissing) {
        if (value == null) return rejectMissing;
        return value < minimum;
    }

    /** Stored rates of 1 or more are percentages. */
    static Double engagementFraction(Double rate) {
        if (rate == null) return null;
        return rate >= 1.0 ? rate / 100.0 : rate;
    }
}
