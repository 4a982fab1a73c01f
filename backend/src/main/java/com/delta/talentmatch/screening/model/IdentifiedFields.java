package com.delta.talentmatch.screening.model;

import java.util.Map;

/**
 * Outcome of field identification for one submission.
 *
 * @param assignments every submitted label mapped to the role it won, {@link SemanticRole#UNASSIGNED} otherwise
 * @param remainingAnswers unmatched fields, verbatim and in declaration order
 */
public record IdentifiedFields(
    String name,
    String email,
    String phone,
    String resumeReference,
    Map<String, String> remainingAnswers,
    Map<String, SemanticRole> assignments
) {
    public boolean hasResumeReference() {
        return resumeReference != null && !resumeReference.isBlank();
    }
}
