package com.di.creatormatch.agent.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only graph of niches: related, conflicting and parent category per niche, plus keyword and alias
 * indexes. Built once from YAML at start; no mutators after {@link #index()}.
 */
public class NicheTaxonomy {

    /** YAML root: {@code niches:} and {@code rules:}. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Document {
        private Map<String, NicheDefinition> niches = new LinkedHashMap<>();
        private NicheRules rules = new NicheRules();
    }

    /** Niche detected from free text, with the keywords that matched. */
    public static final class Detection {
        private final String niche;
        private final List<String> matchedKeywords;

        Detection(String niche, List<String> matchedKeywords) {
            this.niche = niche;
            this.matchedKeywords = matchedKeywords;
        }

        public String getNiche() {
            return niche;
        }

        public List<String> getMatchedKeywords() {
            return matchedKeywords;
        }
    }

    private final Map<String, NicheDefinition> niches;
    private final NicheRules rules;
    private final Map<String, String> aliasToKey = new LinkedHashMap<>();
    private final Map<String, String> keywordToKey = new LinkedHashMap<>();

    public NicheTaxonomy(Document document) {
        Map<String, NicheDefinition> lowered = new LinkedHashMap<>();
        if (document != null && document.getNiches() != null) {
            document.getNiches().forEach((k, v) -> lowered.put(lower(k), v != null ? v : new NicheDefinition()));
        }
        this.niches = Collections.unmodifiableMap(lowered);
        this.rules = document != null && document.getRules() != null ? document.getRules() : new NicheRules();
        index();
    }

    public static NicheTaxonomy empty() {
        return new NicheTaxonomy(new Document());
    }

    private void index() {
        niches.forEach((key, def) -> {
            for (String alias : def.getAliases()) {
                if (alias != null) aliasToKey.putIfAbsent(lower(alias), key);
            }
            for (String keyword : def.getKeywords()) {
                if (keyword != null) keywordToKey.putIfAbsent(lower(keyword), key);
            }
        });
    }

    public NicheRules getRules() {
        return rules;
    }

    public int size() {
        return niches.size();
    }

    /** Resolves a niche name or alias to its canonical key. */
    public Optional<String> resolve(String nicheOrAlias) {
        if (nicheOrAlias == null || nicheOrAlias.isBlank()) return Optional.empty();
        String n = lower(nicheOrAlias);
        if (niches.containsKey(n)) return Optional.of(n);
        return Optional.ofNullable(aliasToKey.get(n));
    }

    public Optional<NicheDefinition> find(String nicheOrAlias) {
        return resolve(nicheOrAlias).map(niches::get);
    }

    public boolean isAlias(String campaignNiche, String candidate) {
        return find(campaignNiche)
                .map(def -> def.getAliases().stream().anyMatch(a -> a.equalsIgnoreCase(candidate)))
                .orElse(false);
    }

    public Set<String> relatedOf(String niche) {
        return lowerSet(find(niche).map(NicheDefinition::getRelatedNiches).orElse(List.of()));
    }

    public Set<String> conflictingOf(String niche) {
        return lowerSet(find(niche).map(NicheDefinition::getConflictingNiches).orElse(List.of()));
    }

    public List<String> keywordsOf(String niche) {
        return find(niche).map(NicheDefinition::getKeywords).orElse(List.of());
    }

    /**
     * Niche with the most keyword hits in bio plus interests; ties go to the niche declared first.
     * Returns empty when nothing matches.
     */
    public Optional<Detection> detect(List<String> interests, String bio) {
        String searchable = searchable(interests, bio);
        if (searchable.isBlank()) return Optional.empty();
        Map<String, List<String>> hits = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : keywordToKey.entrySet()) {
            if (searchable.contains(e.getKey())) {
                hits.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
            }
        }
        String best = null;
        for (String key : niches.keySet()) {
            List<String> matched = hits.get(key);
            if (matched == null) continue;
            if (best == null || matched.size() > hits.get(best).size()) best = key;
        }
        return best == null ? Optional.empty() : Optional.of(new Detection(best, List.copyOf(hits.get(best))));
    }

    /** Lowercased bio plus interests, space separated, for substring keyword checks. */
    public static String searchable(List<String> interests, String bio) {
        StringBuilder sb = new StringBuilder(bio != null ? bio.toLowerCase(Locale.ROOT) : "");
        if (interests != null) {
            for (String i : interests) {
                if (i != null) sb.append(' ').append(i.toLowerCase(Locale.ROOT));
            }
        }
        return sb.toString();
    }

    private static Set<String> lowerSet(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null) out.add(lower(v));
        }
        return out;
    }

    private static String lower(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
