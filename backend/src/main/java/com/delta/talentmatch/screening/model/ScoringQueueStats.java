package com.delta.talentmatch.screening.model;

/**
 * @param parked unscored candidates that used up their attempts and are no longer claimed automatically
 */
public record ScoringQueueStats(
    long unscored,
    long inProgress,
    long scored,
    long parked
) {
}
