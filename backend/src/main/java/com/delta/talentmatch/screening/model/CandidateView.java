package com.delta.talentmatch.screening.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * API shape of a stored candidate. The extracted résumé text stays server-side; only its presence is exposed.
 */
public record CandidateView(
    long id,
    long jobId,
    String name,
    String email,
    String phone,
    String resumeReference,
    boolean resumeTextPresent,
    boolean parsingFailed,
    String parseErrorCode,
    Map<String, String> answers,
    List<String> tags,
    String notes,
    CandidateStatus status,
    ScoringState scoringState,
    Integer totalScore,
    Grade grade,
    ScoreBreakdown breakdown,
    Instant submittedAt,
    Instant scoredAt
) {
    public static CandidateView from(CandidateProfile candidate) {
        return new CandidateView(
            candidate.id(),
            candidate.jobId(),
            candidate.name(),
            candidate.email(),
            candidate.phone(),
            candidate.resumeReference(),
            candidate.hasResumeText(),
            candidate.parsingFailed(),
            candidate.parseErrorCode(),
            candidate.answers(),
            candidate.tags(),
            candidate.notes(),
            candidate.status(),
            candidate.scoringState(),
            candidate.totalScore(),
            candidate.grade(),
            candidate.breakdown(),
            candidate.submittedAt(),
            candidate.scoredAt()
        );
    }
}
