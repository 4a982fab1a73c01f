package com.delta.talentmatch.screening.model;

import java.util.Map;

public record ScoringInput(
    String resumeText,
    JobRequirement job,
    Map<String, String> answers
) {
    public ScoringInput {
        answers = answers == null ? Map.of() : answers;
    }

    public boolean hasResumeText() {
        return resumeText != null && !resumeText.isBlank();
    }
}
