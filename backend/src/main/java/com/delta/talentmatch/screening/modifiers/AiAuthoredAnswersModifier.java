package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.scoring.TextSignals;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags free-text answers that look machine-written: stock template phrasing, or several long answers
 * of near-identical length.
 */
@Component
@Order(3)
public class AiAuthoredAnswersModifier implements ScoreModifier {
    static final String NAME = "ai_authored_answers";
    static final int UNIFORM_MIN_ANSWERS = 3;
    static final int UNIFORM_MIN_WORDS = 40;
    static final double UNIFORM_MAX_VARIATION = 0.1;

    private final ScreeningProperties properties;

    public AiAuthoredAnswersModifier(ScreeningProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ModifierApplication> evaluate(ModifierContext context) {
        List<String> answers = context.freeTextAnswers();
        if (answers.isEmpty()) {
            return List.of();
        }
        String joined = TextSignals.lower(String.join("\n", answers));
        int templateHits = TextSignals.countDistinctTerms(joined, properties.getModifiers().getAiTemplatePhrases());
        int penalty = -properties.getModifiers().getAiAuthoredPenalty();
        if (templateHits >= properties.getModifiers().getAiTemplatePhraseMatches()) {
            return List.of(new ModifierApplication(
                NAME,
                penalty,
                "Answers contain " + templateHits + " stock AI phrasings"
            ));
        }
        if (uniform(answers)) {
            return List.of(new ModifierApplication(
                NAME,
                penalty,
                "Answers are suspiciously uniform in length and structure"
            ));
        }
        return List.of();
    }

    private boolean uniform(List<String> answers) {
        if (answers.size() < UNIFORM_MIN_ANSWERS) {
            return false;
        }
        double sum = 0;
        int[] counts = new int[answers.size()];
        for (int i = 0; i < answers.size(); i++) {
            counts[i] = TextSignals.wordCount(answers.get(i));
            if (counts[i] < UNIFORM_MIN_WORDS) {
                return false;
            }
            sum += counts[i];
        }
        double mean = sum / counts.length;
        double variance = 0;
        for (int count : counts) {
            variance += (count - mean) * (count - mean);
        }
        double deviation = Math.sqrt(variance / counts.length);
        return deviation / mean < UNIFORM_MAX_VARIATION;
    }
}
