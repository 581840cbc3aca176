package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.campaign.GenderFilter;
import com.di.creatormatch.agent.intelligence.BrandIntelligenceGraph;
import com.di.creatormatch.agent.intelligence.NicheTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort brief reader used when no richer parser is available or it fails. Picks up a niche from the
 * taxonomy keywords, a brand from known handles and keys, a result count, a creator gender and a few
 * search keywords. Everything else keeps its default; confidence is reported as low.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordBriefParser implements BriefParser {

    static final double KEYWORD_CONFIDENCE = 0.3;
    static final int MAX_SEARCH_KEYWORDS = 5;

    private static final Pattern COUNT = Pattern.compile(
            "\\b(\\d{1,2})\\s+(?:influencers?|creators?|creadore?s?|perfiles|profiles)\\b");
    private static final Pattern HANDLE = Pattern.compile("@([a-z0-9._]{2,30})");
    private static final Pattern WORDS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> FEMALE_WORDS = Set.of("female", "women", "woman", "mujeres", "mujer", "chicas", "femeninas");
    private static final Set<String> MALE_WORDS = Set.of("male", "men", "man", "hombres", "hombre", "chicos", "masculinos");
    private static final Set<String> STOPWORDS = Set.of(
            "para", "with", "that", "this", "from", "campaign", "campana", "campaña", "brand", "marca",
            "influencer", "influencers", "creator", "creators", "creadores", "perfiles", "profiles", "want",
            "need", "buscamos", "queremos", "necesitamos", "looking", "find", "some", "spain", "espana", "españa",
            "como", "sobre", "their", "they", "have", "should", "muy", "more", "than", "entre");

    private final NicheTaxonomy taxonomy;
    private final BrandIntelligenceGraph brands;

    @Override
    public CampaignQuery parse(String briefText) throws BriefParseException {
        if (briefText == null || briefText.isBlank()) {
            throw new BriefParseException("Brief text is empty");
        }
        String text = briefText.toLowerCase(Locale.ROOT);
        CampaignQuery.CampaignQueryBuilder b = CampaignQuery.builder()
                .parseConfidence(KEYWORD_CONFIDENCE)
                .fallbackReasoning("Keyword extraction only");

        Matcher count = COUNT.matcher(text);
        if (count.find()) {
            int n = Integer.parseInt(count.group(1));
            b.targetCount(Math.max(1, Math.min(50, n)));
        }

        Optional<String> brandKey = brandFrom(text);
        brandKey.ifPresent(key -> b.brandName(brands.displayName(key)).brandHandle(key));

        taxonomy.detect(List.of(), text).ifPresent(d -> b.campaignNiche(d.getNiche()));

        String[] words = WORDS.split(text);
        GenderFilter gender = genderFrom(words);
        b.creatorGender(gender);

        Set<String> keywords = new LinkedHashSet<>();
        for (String w : words) {
            if (keywords.size() >= MAX_SEARCH_KEYWORDS) break;
            if (w.length() < 4 || STOPWORDS.contains(w) || FEMALE_WORDS.contains(w) || MALE_WORDS.contains(w)) continue;
            if (w.chars().allMatch(Character::isDigit)) continue;
            if (brandKey.isPresent() && brandKey.get().equals(w)) continue;
            keywords.add(w);
        }
        keywords.forEach(b::searchKeyword);

        CampaignQuery query = b.build();
        log.info("[SEARCH] Keyword brief parse: niche={} brand={} targetCount={} creatorGender={} keywords={}",
                query.getCampaignNiche(), query.getBrandName(), query.getTargetCount(), gender, keywords);
        return query;
    }

    /** Query used when every parser failed: defaults plus the raw words as search keywords. */
    public CampaignQuery fallback(String briefText, String reason) {
        try {
            return parse(briefText).toBuilder().fallbackReasoning(reason).build();
        } catch (BriefParseException | RuntimeException e) {
            log.warn("[SEARCH] Keyword brief parse failed ({}); using default query", e.getMessage());
            return CampaignQuery.builder()
                    .parseConfidence(0.0)
                    .fallbackReasoning(reason)
                    .build();
        }
    }

    private Optional<String> brandFrom(String text) {
        Matcher handle = HANDLE.matcher(text);
        while (handle.find()) {
            Optional<String> key = brands.resolveKey(handle.group(1));
            if (key.isPresent()) return key;
        }
        for (String w : WORDS.split(text)) {
            if (w.length() < 3) continue;
            Optional<String> key = brands.resolveKey(w);
            if (key.isPresent()) return key;
        }
        return Optional.empty();
    }

    private static GenderFilter genderFrom(String[] words) {
        boolean female = false;
        boolean male = false;
        for (String w : words) {
            if (FEMALE_WORDS.contains(w)) female = true;
            if (MALE_WORDS.contains(w)) male = true;
        }
        if (female == male) return GenderFilter.ANY;
        return female ? GenderFilter.FEMALE : GenderFilter.MALE;
    }
}
