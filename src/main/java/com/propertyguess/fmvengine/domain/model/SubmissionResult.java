package com.propertyguess.fmvengine.domain.model;

public record SubmissionResult(
        PriceGuess guess,
        Outcome outcome,
        long editableAtEpochMs,
        ConsensusAlignment consensus
) {

    public enum Outcome {
        CREATED, UPDATED
    }

    public boolean created() {
        return outcome == Outcome.CREATED;
    }
}
