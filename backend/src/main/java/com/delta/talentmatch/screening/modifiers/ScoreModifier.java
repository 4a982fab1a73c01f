package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.screening.model.ModifierApplication;

import java.util.List;

/**
 * An additive bonus or penalty rule. Returns an empty list when it does not fire; a rule that can fire
 * several times (one entry per red flag) returns one application per hit.
 */
public interface ScoreModifier {
    String name();

    List<ModifierApplication> evaluate(ModifierContext context);
}
