package com.di.creatormatch.agent.gateway;

import com.di.creatormatch.agent.creator.CreatorMetrics;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Profile fields and metrics extracted from one media kit, ready to merge into a creator record.
 */
@Value
@Builder
public class NormalizedProfile {
    String externalId;
    String username;
    String displayName;
    String bio;
    Long followers;
    List<String> interests;
    List<String> brandMentions;
    CreatorMetrics metrics;
}
