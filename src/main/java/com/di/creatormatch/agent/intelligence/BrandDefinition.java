package com.di.creatormatch.agent.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** One entry of {@code brands} in the brand intelligence YAML. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrandDefinition {

    private String name;
    private String category = "unknown";
    @JsonProperty("instagram_handles")
    private List<String> instagramHandles = new ArrayList<>();
    /** Brand keys of competitors. */
    private List<String> competitors = new ArrayList<>();
    private List<Ambassador> ambassadors = new ArrayList<>();
    /** high / medium / low: how strongly a competitor mention hurts affinity. */
    @JsonProperty("conflict_severity")
    private String conflictSeverity = "medium";

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ambassador {
        private String username;
        /** e.g. active, former. */
        private String status = "active";
        /** lifetime_deal, ambassador, sponsored. */
        private String relationship = "ambassador";
        private String niche;
        private String since;
    }
}
