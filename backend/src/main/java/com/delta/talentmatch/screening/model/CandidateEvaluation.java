package com.delta.talentmatch.screening.model;

public record CandidateEvaluation(
    IdentifiedFields fields,
    NormalizedDocument document,
    ScoreBreakdown breakdown
) {
}
