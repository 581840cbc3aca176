package com.di.creatormatch.agent.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** One entry of {@code niches} in the niche taxonomy YAML. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NicheDefinition {
    private List<String> keywords = new ArrayList<>();
    private List<String> aliases = new ArrayList<>();
    @JsonProperty("related_niches")
    private List<String> relatedNiches = new ArrayList<>();
    @JsonProperty("conflicting_niches")
    private List<String> conflictingNiches = new ArrayList<>();
    @JsonProperty("parent_category")
    private String parentCategory;
}
