package com.delta.talentmatch.screening.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CandidateProfile(
    long id,
    long jobId,
    String name,
    String email,
    String phone,
    String resumeReference,
    String resumeText,
    boolean parsingFailed,
    String parseErrorCode,
    Map<String, String> answers,
    List<String> tags,
    String notes,
    CandidateStatus status,
    ScoringState scoringState,
    ScoreBreakdown breakdown,
    Instant submittedAt,
    Instant scoredAt
) {
    public boolean hasResumeText() {
        return resumeText != null && !resumeText.isBlank();
    }

    public Integer totalScore() {
        return breakdown == null ? null : breakdown.totalScore();
    }

    public Grade grade() {
        return breakdown == null ? null : breakdown.grade();
    }
}
