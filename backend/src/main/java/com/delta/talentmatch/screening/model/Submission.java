package com.delta.talentmatch.screening.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.List;

public record Submission(
    @JsonAlias("job_id") Long jobId,
    @JsonAlias("respondent_email") String respondentEmail,
    List<FormField> fields
) {
    public List<FormField> normalizedFields() {
        if (fields == null) {
            return List.of();
        }
        List<FormField> out = new ArrayList<>();
        for (FormField field : fields) {
            if (field != null) {
                out.add(field);
            }
        }
        return out;
    }

    public String normalizedRespondentEmail() {
        if (respondentEmail == null || respondentEmail.isBlank()) {
            return null;
        }
        return respondentEmail.trim();
    }
}
