package com.di.creatormatch.agent.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One hit of the provider's text lookup. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MediaKitSummary {
    @JsonProperty("external_social_profile_id")
    private String externalSocialProfileId;
    private String username;
    @JsonProperty("display_name")
    private String displayName;
    private String avatar;
    @JsonProperty("audience_size")
    private Long audienceSize;
    @JsonProperty("is_verified")
    private Boolean verified;
    @JsonProperty("platform_type")
    private Integer platformType;
    @JsonProperty("mediakit_url")
    private String mediakitUrl;
}
