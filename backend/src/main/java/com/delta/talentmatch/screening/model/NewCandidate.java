package com.delta.talentmatch.screening.model;

import java.time.Instant;
import java.util.Map;

public record NewCandidate(
    long jobId,
    String name,
    String email,
    String phone,
    String resumeReference,
    Map<String, String> answers,
    String submissionFingerprint,
    Instant submittedAt
) {
}
