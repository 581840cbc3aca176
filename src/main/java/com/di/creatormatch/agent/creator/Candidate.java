package com.di.creatormatch.agent.creator;

import lombok.Value;

/**
 * A creator record under consideration in one search, tagged with its verification state.
 */
@Value
public class Candidate {

    CreatorRecord record;
    VerificationState state;

    public static Candidate verified(CreatorRecord record) {
        return new Candidate(record, VerificationState.VERIFIED);
    }

    public static Candidate unverified(CreatorRecord record) {
        return new Candidate(record, VerificationState.UNVERIFIED);
    }

    public static Candidate failed(CreatorRecord record) {
        return new Candidate(record, VerificationState.FAILED_VERIFICATION);
    }

    public boolean isVerified() {
        return state.isVerified();
    }

    public String getId() {
        return record.getId();
    }

    public Candidate withState(VerificationState newState) {
        return new Candidate(record, newState);
    }
}
