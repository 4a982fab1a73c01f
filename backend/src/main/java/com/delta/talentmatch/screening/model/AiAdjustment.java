package com.delta.talentmatch.screening.model;

import java.util.List;

/**
 * Validated result of the external AI analysis. {@link #neutral()} stands in whenever the call fails.
 */
public record AiAdjustment(
    String summary,
    List<String> pros,
    List<String> cons,
    int delta,
    boolean available
) {
    public static final String UNAVAILABLE_SUMMARY = "AI analysis unavailable";

    public AiAdjustment {
        summary = summary == null ? "" : summary;
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
    }

    public static AiAdjustment neutral() {
        return new AiAdjustment(UNAVAILABLE_SUMMARY, List.of(), List.of(), 0, false);
    }
}
