package com.delta.talentmatch.screening.model;

public record SubmissionReceipt(
    long candidateId,
    long jobId,
    ScoringState scoringState,
    boolean duplicate,
    Integer totalScore,
    Grade grade
) {
}
