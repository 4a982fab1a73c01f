package com.delta.talentmatch.screening.ai;

/**
 * External text-analysis capability. Implementations may block on the network and throw
 * {@link AiServiceException}; callers own the timeout.
 */
public interface CandidateAnalyzer {
    AiAnalysisResponse analyze(AiAnalysisRequest request);

    default boolean isAvailable() {
        return true;
    }
}
