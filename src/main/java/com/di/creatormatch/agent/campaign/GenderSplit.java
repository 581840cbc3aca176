package com.di.creatormatch.agent.campaign;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Requested split of creators by gender, e.g. 3 female + 2 male.
 */
@Value
@Builder
@Jacksonized
public class GenderSplit {
    int femaleCount;
    int maleCount;

    public int total() {
        return femaleCount + maleCount;
    }
}
