package com.delta.talentmatch.screening.model;

import java.util.List;
import java.util.Map;

/**
 * Full, explainable scoring result for one candidate. Replaced as a whole on re-score.
 *
 * @param dimensionScores dimension key to 0..100 sub-score, in {@link Dimension} declaration order
 * @param weights dimension key to weight, summing to exactly 1.0
 */
public record ScoreBreakdown(
    Map<String, Integer> dimensionScores,
    Map<String, Double> weights,
    int weightedSum,
    int aiAdjustment,
    AiAdjustment aiAnalysis,
    List<ModifierApplication> modifiersApplied,
    int totalScore,
    Grade grade,
    List<String> feedback
) {
    public int score(Dimension dimension) {
        Integer value = dimensionScores == null ? null : dimensionScores.get(dimension.key());
        return value == null ? 0 : value;
    }

    public int modifierTotal() {
        if (modifiersApplied == null) {
            return 0;
        }
        int total = 0;
        for (ModifierApplication modifier : modifiersApplied) {
            total += modifier.delta();
        }
        return total;
    }
}
