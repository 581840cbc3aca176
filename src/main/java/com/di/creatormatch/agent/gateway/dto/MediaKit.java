package com.di.creatormatch.agent.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Full media kit of one profile as returned by the provider's detail endpoint.
 * Only the fields the normalizer reads are mapped; everything else is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MediaKit {

    @JsonProperty("platform_type")
    private Integer platformType;
    private String username;
    private String fullname;
    private String description;
    private List<String> interests;
    private Long followers;
    @JsonProperty("followers_last_6_month_evolution")
    private Double followersLast6MonthEvolution;
    @JsonProperty("avg_engagement_rate")
    private Double avgEngagementRate;
    @JsonProperty("brand_mentions")
    private List<BrandMention> brandMentions;
    @JsonProperty("audience_data")
    private AudienceData audienceData;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BrandMention {
        @JsonProperty("user_id")
        private String userId;
        private String username;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AudienceData {
        private AudienceSection followers;
        private AudienceSection likes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AudienceSection {
        @JsonProperty("audience_credibility_percentage")
        private Double audienceCredibilityPercentage;
        private Map<String, Double> genders;
        @JsonProperty("average_age")
        private List<AgeBucket> averageAge;
        @JsonProperty("location_by_country")
        private List<CountryShare> locationByCountry;
    }

    /** Age band with female and male share; band total is their sum. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AgeBucket {
        private String label;
        private Double female;
        private Double male;
    }

    /** Country share; the provider sends either {@code percentage} or {@code value}. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CountryShare {
        private String name;
        private Double percentage;
        private Double value;

        public Double share() {
            return percentage != null ? percentage : value;
        }
    }
}
