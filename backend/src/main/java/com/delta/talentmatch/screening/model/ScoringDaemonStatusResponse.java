package com.delta.talentmatch.screening.model;

public record ScoringDaemonStatusResponse(
    boolean running,
    int workerCount,
    ScoringQueueStats queue
) {
}
