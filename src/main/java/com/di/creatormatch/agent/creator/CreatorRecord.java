package com.di.creatormatch.agent.creator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A creator as known to the local candidate store: identity, reach, content signals,
 * last-known metrics and provenance of those metrics.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreatorRecord {

    String id;
    Platform platform;
    String username;
    String displayName;

    /** Follower count; null or 0 means unknown. */
    Long followers;

    String bio;
    List<String> interests;
    String primaryNiche;
    Double nicheConfidence;
    /** Handles of brands the creator has mentioned in content. */
    List<String> brandMentions;
    /** Coarse home country (ISO code) used when no audience geography is known. */
    String country;

    CreatorMetrics metrics;

    Instant verifiedAt;
    boolean metricsComplete;
    /** Direct re-fetch token at the metrics provider. */
    String externalId;

    @Builder.Default
    boolean active = true;

    public List<String> getInterests() {
        return interests != null ? interests : Collections.emptyList();
    }

    public List<String> getBrandMentions() {
        return brandMentions != null ? brandMentions : Collections.emptyList();
    }

    public CreatorMetrics getMetrics() {
        return metrics != null ? metrics : CreatorMetrics.empty();
    }

    public boolean hasKnownFollowers() {
        return followers != null && followers > 0;
    }

    public long followersOrZero() {
        return followers != null ? followers : 0L;
    }

    /** Identity used to dedupe verification work: platform plus lowercased username. */
    public String identityKey() {
        String handle = username != null ? username.toLowerCase(Locale.ROOT) : String.valueOf(id);
        return (platform != null ? platform.name() : "UNKNOWN") + ":" + handle;
    }

    /**
     * True when metrics are complete and were verified within {@code freshness} of {@code now}.
     */
    public boolean isFresh(Instant now, Duration freshness) {
        if (!metricsComplete || verifiedAt == null) return false;
        return !verifiedAt.plus(freshness).isBefore(now);
    }

    public CreatorTier getTier() {
        return CreatorTier.of(followers);
    }
}
