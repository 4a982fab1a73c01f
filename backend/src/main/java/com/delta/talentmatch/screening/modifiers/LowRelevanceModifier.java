package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ModifierApplication;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies only to readable résumés; an unreadable one already carries degraded dimension scores.
 */
@Component
@Order(6)
public class LowRelevanceModifier implements ScoreModifier {
    static final String NAME = "low_relevance";

    private final ScreeningProperties properties;

    public LowRelevanceModifier(ScreeningProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ModifierApplication> evaluate(ModifierContext context) {
        if (!context.hasResumeText()) {
            return List.of();
        }
        if (context.score(Dimension.JOB_RELEVANCE) < properties.getModifiers().getLowRelevanceThreshold()) {
            return List.of(new ModifierApplication(
                NAME,
                -properties.getModifiers().getLowRelevancePenalty(),
                "Experience context does not match the role"
            ));
        }
        return List.of();
    }
}
