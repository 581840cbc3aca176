package com.di.creatormatch.agent.filter;

import com.di.creatormatch.agent.creator.Candidate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Survivors of the filter engine, in input order, with rejection counts. */
@Value
@Builder
public class FilterResult {

    List<Candidate> passed;

    @Singular
    Map<RejectionReason, Integer> rejections;

    /** True when the follower range would have removed every survivor and was therefore not applied. */
    boolean followerRangeRelaxed;

    public int rejectionCount(RejectionReason reason) {
        return rejections.getOrDefault(reason, 0);
    }
}
