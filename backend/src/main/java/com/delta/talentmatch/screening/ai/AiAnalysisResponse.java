package com.delta.talentmatch.screening.ai;

import java.util.List;

/**
 * Provider output after lenient parsing. Fields may be null or out of range; validation happens in
 * {@link AiAdjustmentAdapter}.
 */
public record AiAnalysisResponse(
    String summary,
    List<String> pros,
    List<String> cons,
    Integer scoreAdjustment
) {
}
