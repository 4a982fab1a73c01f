package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
public class SkillsMatchScorer implements DimensionScorer {
    private final SkillCatalog skillCatalog;

    public SkillsMatchScorer(SkillCatalog skillCatalog) {
        this.skillCatalog = skillCatalog;
    }

    @Override
    public Dimension dimension() {
        return Dimension.SKILLS_MATCH;
    }

    @Override
    public int score(ScoringInput input) {
        if (!input.hasResumeText()) {
            return MIN_SCORE;
        }
        List<String> required = requiredSkills(input);
        if (required.isEmpty()) {
            return 50;
        }
        String resumeLower = TextSignals.lower(input.resumeText());
        Set<String> resumeStems = TextSignals.stems(input.resumeText());
        int matched = 0;
        for (String skill : required) {
            if (skillCatalog.mentions(resumeLower, skill) || resumeStems.contains(TextSignals.stem(skill))) {
                matched++;
            }
        }
        long score = Math.round(100.0 * matched / required.size());
        return Math.max(MIN_SCORE, TextSignals.clampScore(score));
    }

    private List<String> requiredSkills(ScoringInput input) {
        if (input.job() == null) {
            return List.of();
        }
        if (!input.job().requiredSkills().isEmpty()) {
            return skillCatalog.canonicalizeAll(input.job().requiredSkills());
        }
        return List.copyOf(skillCatalog.extractSkills(input.job().requirementText()));
    }
}
