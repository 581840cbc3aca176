package com.di.creatormatch.agent.verification;

import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.gateway.NormalizedProfile;

import java.time.Instant;

/**
 * Folds a freshly fetched profile into the stored record. Provider values win where present;
 * local content signals are kept where the provider returned nothing.
 */
final class ProfileMerger {

    private ProfileMerger() {
    }

    static CreatorRecord merge(CreatorRecord record, NormalizedProfile profile, Instant now) {
        CreatorMetrics metrics = profile.getMetrics() != null ? profile.getMetrics() : CreatorMetrics.empty();
        CreatorRecord.CreatorRecordBuilder b = record.toBuilder()
                .metrics(metrics)
                .verifiedAt(now)
                .metricsComplete(metrics.isCompleteFor(record.getPlatform()));

        if (profile.getFollowers() != null && profile.getFollowers() > 0) b.followers(profile.getFollowers());
        if (notBlank(profile.getDisplayName())) b.displayName(profile.getDisplayName());
        if (notBlank(profile.getBio())) b.bio(profile.getBio());
        if (profile.getInterests() != null && !profile.getInterests().isEmpty()) b.interests(profile.getInterests());
        if (profile.getBrandMentions() != null && !profile.getBrandMentions().isEmpty()) {
            b.brandMentions(profile.getBrandMentions());
        }
        if (notBlank(profile.getExternalId())) b.externalId(profile.getExternalId());
        return b.build();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
