package com.delta.talentmatch.screening.model;

/**
 * Scoring lifecycle of a candidate. {@code SCORED} is terminal; only an explicit re-score re-enters
 * {@code SCORING_IN_PROGRESS}.
 */
public enum ScoringState {
    UNSCORED,
    SCORING_IN_PROGRESS,
    SCORED
}
