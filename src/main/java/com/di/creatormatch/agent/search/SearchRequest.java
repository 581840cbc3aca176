package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/search}: a structured {@code query}, or raw {@code briefText} to be parsed.
 * When both are present the structured query wins.
 */
@Data
@NoArgsConstructor
public class SearchRequest {

    @Valid
    private CampaignQuery query;

    private String briefText;

    @Min(1)
    @Max(1000)
    private Integer poolSize;

    @Min(0)
    @Max(100)
    private Integer verifyCap;
}
