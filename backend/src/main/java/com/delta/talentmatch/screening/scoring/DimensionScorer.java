package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;

/**
 * One scoring axis. Implementations are pure: identical input gives an identical score in {@code [0, 100]},
 * and a null or empty résumé gives a low but non-zero score instead of an exception.
 */
public interface DimensionScorer {
    int MIN_SCORE = 5;

    Dimension dimension();

    int score(ScoringInput input);
}
