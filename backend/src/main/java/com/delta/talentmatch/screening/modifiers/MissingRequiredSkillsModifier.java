package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.scoring.SkillCatalog;
import com.delta.talentmatch.screening.scoring.TextSignals;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Penalizes each must-have skill the résumé never mentions, up to a cap. A skill counts as mentioned on the same
 * terms the skills-match dimension uses: a catalog variant or a shared stem.
 */
@Component
@Order(7)
public class MissingRequiredSkillsModifier implements ScoreModifier {
    static final String NAME = "missing_required_skills";

    private final ScreeningProperties properties;
    private final SkillCatalog skillCatalog;

    public MissingRequiredSkillsModifier(ScreeningProperties properties, SkillCatalog skillCatalog) {
        this.properties = properties;
        this.skillCatalog = skillCatalog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ModifierApplication> evaluate(ModifierContext context) {
        if (!context.hasResumeText() || context.requiredSkills().isEmpty()) {
            return List.of();
        }
        String resumeLower = TextSignals.lower(context.resumeText());
        Set<String> resumeStems = TextSignals.stems(context.resumeText());
        List<String> missing = new ArrayList<>();
        for (String skill : skillCatalog.canonicalizeAll(context.requiredSkills())) {
            if (!skillCatalog.mentions(resumeLower, skill) && !resumeStems.contains(TextSignals.stem(skill))) {
                missing.add(skill);
            }
        }
        if (missing.isEmpty()) {
            return List.of();
        }
        ScreeningProperties.Modifiers config = properties.getModifiers();
        long penalty = Math.min((long) missing.size() * config.getMissingRequiredSkillPenalty(),
            config.getMissingRequiredSkillCap());
        if (penalty == 0) {
            return List.of();
        }
        return List.of(new ModifierApplication(
            NAME,
            -(int) penalty,
            "Missing required skills: " + String.join(", ", missing)
        ));
    }
}
