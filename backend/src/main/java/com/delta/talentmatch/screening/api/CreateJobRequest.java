package com.delta.talentmatch.screening.api;

public record CreateJobRequest(
    String title,
    String description
) {
}
