package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ModifierApplication;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(4)
public class UnicornModifier implements ScoreModifier {
    static final String NAME = "unicorn";

    private final ScreeningProperties properties;

    public UnicornModifier(ScreeningProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ModifierApplication> evaluate(ModifierContext context) {
        ScreeningProperties.Modifiers config = properties.getModifiers();
        int skills = context.score(Dimension.SKILLS_MATCH);
        int experience = context.score(Dimension.EXPERIENCE);
        if (skills >= config.getUnicornSkillsThreshold() && experience >= config.getUnicornExperienceThreshold()) {
            return List.of(new ModifierApplication(
                NAME,
                config.getUnicornBonus(),
                "Exceptional match: skills " + skills + "/100 and experience " + experience + "/100"
            ));
        }
        return List.of();
    }
}
