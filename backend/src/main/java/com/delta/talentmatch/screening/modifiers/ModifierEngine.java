package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.scoring.ScoringInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evaluates every modifier in its declared order and records each application separately.
 */
@Component
public class ModifierEngine {
    private static final Logger log = LoggerFactory.getLogger(ModifierEngine.class);

    private final List<ScoreModifier> modifiers;

    public ModifierEngine(List<ScoreModifier> modifiers) {
        this.modifiers = List.copyOf(modifiers);
    }

    public List<ModifierApplication> apply(ModifierContext context) {
        List<ModifierApplication> applied = new ArrayList<>();
        for (ScoreModifier modifier : modifiers) {
            List<ModifierApplication> result;
            try {
                result = modifier.evaluate(context);
            } catch (RuntimeException e) {
                throw new ScoringInvariantViolationException("Modifier " + modifier.name() + " threw", e);
            }
            if (result != null) {
                applied.addAll(result);
            }
        }
        log.debug("Modifiers applied: {}", applied);
        return Collections.unmodifiableList(applied);
    }
}
