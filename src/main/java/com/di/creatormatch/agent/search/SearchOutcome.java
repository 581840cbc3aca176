package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.ranking.RankedResult;
import lombok.Value;

import java.util.List;

/** Ranked results of one search and the funnel that produced them. */
@Value
public class SearchOutcome {
    String searchId;
    CampaignQuery query;
    List<RankedResult> results;
    VerificationStats stats;
    long durationMs;
}
