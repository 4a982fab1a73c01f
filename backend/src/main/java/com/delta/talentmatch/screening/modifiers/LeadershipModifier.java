package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.scoring.TextSignals;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(5)
public class LeadershipModifier implements ScoreModifier {
    static final String NAME = "leadership";

    private final ScreeningProperties properties;

    public LeadershipModifier(ScreeningProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ModifierApplication> evaluate(ModifierContext context) {
        String combined = context.lowerCombinedText();
        for (String term : properties.getModifiers().getLeadershipTerms()) {
            if (TextSignals.containsTerm(combined, term)) {
                return List.of(new ModifierApplication(
                    NAME,
                    properties.getModifiers().getLeadershipBonus(),
                    "Leadership experience (\"" + term + "\")"
                ));
            }
        }
        return List.of();
    }
}
