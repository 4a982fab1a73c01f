package com.delta.talentmatch.screening.model;

import java.time.Instant;
import java.util.List;

public record JobRequirement(
    long id,
    String title,
    String description,
    List<String> requiredSkills,
    Instant createdAt
) {
    public JobRequirement {
        title = title == null ? "" : title.trim();
        description = description == null ? "" : description;
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
    }

    public String requirementText() {
        if (title.isBlank()) {
            return description;
        }
        return title + "\n" + description;
    }
}
