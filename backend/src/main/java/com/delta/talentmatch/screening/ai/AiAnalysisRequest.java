package com.delta.talentmatch.screening.ai;

import java.util.Map;

public record AiAnalysisRequest(
    String jobRequirementText,
    String resumeText,
    Map<String, String> answers
) {
    public AiAnalysisRequest {
        jobRequirementText = jobRequirementText == null ? "" : jobRequirementText;
        resumeText = resumeText == null ? "" : resumeText;
        answers = answers == null ? Map.of() : answers;
    }
}
