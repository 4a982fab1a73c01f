package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.scoring.TextSignals;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a modifier may look at. Built once per scoring run.
 *
 * @param referenceTime resolves open-ended date ranges; the job's creation time
 * @param requiredSkills the job's must-have skills as stored, possibly empty
 */
public record ModifierContext(
    String resumeText,
    Map<String, String> answers,
    Map<String, Integer> dimensionScores,
    Instant referenceTime,
    List<String> requiredSkills
) {
    public ModifierContext {
        answers = answers == null ? Map.of() : answers;
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        dimensionScores = dimensionScores == null ? Map.of() : dimensionScores;
    }

    public boolean hasResumeText() {
        return resumeText != null && !resumeText.isBlank();
    }

    public int score(Dimension dimension) {
        Integer value = dimensionScores.get(dimension.key());
        return value == null ? 0 : value;
    }

    /** Lower-cased résumé text followed by every answer value. */
    public String lowerCombinedText() {
        StringBuilder out = new StringBuilder(TextSignals.lower(resumeText));
        for (String value : answers.values()) {
            out.append('\n').append(TextSignals.lower(value));
        }
        return out.toString();
    }

    public List<String> freeTextAnswers() {
        return TextSignals.freeTextAnswers(answers);
    }
}
