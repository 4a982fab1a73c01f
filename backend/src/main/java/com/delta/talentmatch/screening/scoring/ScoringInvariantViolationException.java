package com.delta.talentmatch.screening.scoring;

/**
 * A defect in the scoring logic itself, as opposed to bad candidate input. Never converted into a degraded score.
 */
public class ScoringInvariantViolationException extends RuntimeException {
    public ScoringInvariantViolationException(String message) {
        super(message);
    }

    public ScoringInvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
