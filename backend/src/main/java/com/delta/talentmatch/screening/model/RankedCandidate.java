package com.delta.talentmatch.screening.model;

import java.time.Instant;

public record RankedCandidate(
    int rank,
    long candidateId,
    String name,
    String email,
    int totalScore,
    Grade grade,
    boolean parsingFailed,
    CandidateStatus status,
    Instant submittedAt
) {
}
