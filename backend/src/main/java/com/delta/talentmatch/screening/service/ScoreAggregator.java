package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.screening.model.AiAdjustment;
import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.Grade;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import com.delta.talentmatch.screening.scoring.TextSignals;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds dimension scores, the AI adjustment and modifier deltas into one {@link ScoreBreakdown}.
 *
 * <p>Feedback order is fixed: parse warning, one line per dimension in {@link Dimension} order, modifier reasons,
 * then the AI summary with its pros and cons.
 */
@Component
public class ScoreAggregator {
    public static final String PARSE_FAILED_FEEDBACK = "⚠ Resume parsing failed - Manual review required";

    private static final int STRONG_THRESHOLD = 80;
    private static final int ADEQUATE_THRESHOLD = 50;

    public ScoreBreakdown aggregate(
        Map<String, Integer> dimensionScores,
        Map<String, Double> weights,
        int weightedSum,
        AiAdjustment ai,
        List<ModifierApplication> modifiers,
        boolean parsingFailed
    ) {
        AiAdjustment aiAnalysis = ai == null ? AiAdjustment.neutral() : ai;
        List<ModifierApplication> applied = modifiers == null ? List.of() : List.copyOf(modifiers);
        long raw = (long) weightedSum + aiAnalysis.delta();
        for (ModifierApplication modifier : applied) {
            raw += modifier.delta();
        }
        int total = TextSignals.clampScore(raw);
        return new ScoreBreakdown(
            new LinkedHashMap<>(dimensionScores),
            new LinkedHashMap<>(weights),
            weightedSum,
            aiAnalysis.delta(),
            aiAnalysis,
            applied,
            total,
            Grade.forScore(total),
            feedback(dimensionScores, aiAnalysis, applied, parsingFailed)
        );
    }

    List<String> feedback(
        Map<String, Integer> dimensionScores,
        AiAdjustment ai,
        List<ModifierApplication> modifiers,
        boolean parsingFailed
    ) {
        List<String> lines = new ArrayList<>();
        if (parsingFailed) {
            lines.add(PARSE_FAILED_FEEDBACK);
        }
        for (Dimension dimension : Dimension.values()) {
            Integer score = dimensionScores.get(dimension.key());
            if (score == null) {
                continue;
            }
            lines.add(dimensionComment(dimension, score));
        }
        for (ModifierApplication modifier : modifiers) {
            lines.add(String.format("%+d %s", modifier.delta(), modifier.reason()));
        }
        if (!ai.available()) {
            lines.add(AiAdjustment.UNAVAILABLE_SUMMARY);
            return lines;
        }
        if (!ai.summary().isBlank()) {
            lines.add(ai.summary());
        }
        for (String pro : ai.pros()) {
            lines.add("Pro: " + pro);
        }
        for (String con : ai.cons()) {
            lines.add("Con: " + con);
        }
        return lines;
    }

    private String dimensionComment(Dimension dimension, int score) {
        if (score >= STRONG_THRESHOLD) {
            return "✓ Strong " + dimension.label() + " (" + score + "/100)";
        }
        if (score >= ADEQUATE_THRESHOLD) {
            return "• Adequate " + dimension.label() + " (" + score + "/100)";
        }
        return "⚠ Low " + dimension.label() + " (" + score + "/100)";
    }
}
