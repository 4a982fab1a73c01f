package com.delta.talentmatch.screening.fields;

import com.delta.talentmatch.screening.model.FieldKind;
import com.delta.talentmatch.screening.model.FormField;
import com.delta.talentmatch.screening.model.IdentifiedFields;
import com.delta.talentmatch.screening.model.SemanticRole;
import com.delta.talentmatch.screening.model.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the name, phone and résumé roles from admin-labelled form fields.
 *
 * <p>Each role runs its own competition over every field: labels earn fixed weights for keyword hits
 * (substring match on the lower-cased label) and the field with the strictly highest positive score wins.
 * Ties keep the field declared first. Fields that win no role are kept verbatim as remaining answers.
 */
@Component
public class FieldIdentifier {
    private static final Logger log = LoggerFactory.getLogger(FieldIdentifier.class);

    private static final int NAME_PENALTY = 10;
    private static final List<String> NAME_NEGATIVE_TERMS = List.of("company", "reference", "manager", "file");

    public IdentifiedFields identify(Submission submission) {
        if (submission == null) {
            return identify(List.of(), null);
        }
        return identify(submission.normalizedFields(), submission.normalizedRespondentEmail());
    }

    public IdentifiedFields identify(List<FormField> fields, String collectedEmail) {
        List<FormField> safeFields = fields == null ? List.of() : fields;

        Winner name = new Winner();
        Winner phone = new Winner();
        Winner resume = new Winner();
        String email = collectedEmail == null || collectedEmail.isBlank() ? null : collectedEmail.trim();

        for (int i = 0; i < safeFields.size(); i++) {
            FormField field = safeFields.get(i);
            String label = field.normalizedLabel();
            name.offer(i, nameScore(label));
            phone.offer(i, phoneScore(label));
            resume.offer(i, resumeScore(label, field.declaredKind()));
            if (email == null && label.contains("email") && field.hasValue()) {
                email = field.value().trim();
            }
        }

        Map<String, SemanticRole> assignments = new LinkedHashMap<>();
        Map<String, String> remaining = new LinkedHashMap<>();
        for (int i = 0; i < safeFields.size(); i++) {
            FormField field = safeFields.get(i);
            String key = uniqueLabel(field.label(), i, assignments);
            SemanticRole role = roleFor(i, name, phone, resume);
            assignments.put(key, role);
            if (role == SemanticRole.UNASSIGNED) {
                remaining.put(key, field.value() == null ? "" : field.value());
            }
        }

        String resumeReference = resume.valueOf(safeFields);
        if (resumeReference == null) {
            log.debug("No résumé field identified among {} fields", safeFields.size());
        }
        return new IdentifiedFields(
            trimToNull(name.valueOf(safeFields)),
            email,
            trimToNull(phone.valueOf(safeFields)),
            trimToNull(resumeReference),
            Collections.unmodifiableMap(remaining),
            Collections.unmodifiableMap(assignments)
        );
    }

    static int nameScore(String label) {
        int score = 0;
        if (label.contains("full name")) {
            score += 10;
        } else if (label.contains("candidate name")) {
            score += 10;
        } else if (label.contains("your name")) {
            score += 8;
        } else if (label.equals("name")) {
            score += 5;
        } else if (label.contains("name")) {
            score += 2;
        }
        for (String term : NAME_NEGATIVE_TERMS) {
            if (label.contains(term)) {
                score -= NAME_PENALTY;
            }
        }
        return score;
    }

    static int phoneScore(String label) {
        int score = 0;
        if (label.contains("phone")) {
            score += 10;
        }
        if (label.contains("mobile")) {
            score += 10;
        }
        if (label.contains("cell")) {
            score += 10;
        }
        if (label.contains("contact number")) {
            score += 8;
        }
        return score;
    }

    static int resumeScore(String label, FieldKind kind) {
        int score = 0;
        if (kind == FieldKind.FILE) {
            score += 20;
        }
        if (label.contains("resume") || label.contains("résumé")) {
            score += 10;
        }
        if (label.contains("cv")) {
            score += 10;
        }
        if (label.contains("curriculum vitae")) {
            score += 10;
        }
        if (label.contains("upload")) {
            score += 5;
        }
        if (label.contains("attach")) {
            score += 5;
        }
        return score;
    }

    private SemanticRole roleFor(int index, Winner name, Winner phone, Winner resume) {
        if (resume.index == index) {
            return SemanticRole.RESUME;
        }
        if (name.index == index) {
            return SemanticRole.NAME;
        }
        if (phone.index == index) {
            return SemanticRole.PHONE;
        }
        return SemanticRole.UNASSIGNED;
    }

    private String uniqueLabel(String label, int index, Map<String, SemanticRole> taken) {
        String base = label.isBlank() ? "Field " + (index + 1) : label;
        if (!taken.containsKey(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.containsKey(base + " (" + suffix + ")")) {
            suffix++;
        }
        return base + " (" + suffix + ")";
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static final class Winner {
        private int index = -1;
        private int score = 0;

        void offer(int candidateIndex, int candidateScore) {
            if (candidateScore > score) {
                score = candidateScore;
                index = candidateIndex;
            }
        }

        String valueOf(List<FormField> fields) {
            return index < 0 ? null : fields.get(index).value();
        }
    }
}
