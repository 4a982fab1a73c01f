package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Counts quantified achievements: sentences that pair a figure with an impact verb.
 */
@Component
public class ProjectComplexityScorer implements DimensionScorer {
    private static final Pattern FIGURE = Pattern.compile("\\d|%|\\$");
    private static final List<String> IMPACT_VERBS = List.of(
        "increased", "reduced", "improved", "grew", "saved", "delivered", "launched", "built", "scaled", "cut",
        "boosted", "accelerated", "migrated", "optimized", "generated", "decreased", "achieved", "shipped",
        "handled", "processed", "served", "lowered"
    );
    private static final Set<String> IMPACT_STEMS = TextSignals.stemAll(IMPACT_VERBS);

    @Override
    public Dimension dimension() {
        return Dimension.PROJECT_COMPLEXITY;
    }

    @Override
    public int score(ScoringInput input) {
        if (!input.hasResumeText()) {
            return MIN_SCORE;
        }
        int quantified = 0;
        for (String sentence : TextSignals.sentences(input.resumeText())) {
            if (!FIGURE.matcher(sentence).find()) {
                continue;
            }
            for (String stem : TextSignals.stems(sentence)) {
                if (IMPACT_STEMS.contains(stem)) {
                    quantified++;
                    break;
                }
            }
        }
        return TextSignals.clampScore(15L + 17L * quantified);
    }
}
