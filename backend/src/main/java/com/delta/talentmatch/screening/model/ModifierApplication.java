package com.delta.talentmatch.screening.model;

public record ModifierApplication(
    String name,
    int delta,
    String reason
) {
}
