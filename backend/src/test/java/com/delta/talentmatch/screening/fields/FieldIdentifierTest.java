package com.delta.talentmatch.screening.fields;

import com.delta.talentmatch.screening.model.FieldKind;
import com.delta.talentmatch.screening.model.FormField;
import com.delta.talentmatch.screening.model.IdentifiedFields;
import com.delta.talentmatch.screening.model.SemanticRole;
import com.delta.talentmatch.screening.model.Submission;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FieldIdentifierTest {
    private final FieldIdentifier identifier = new FieldIdentifier();

    @Test
    void resolvesRenamedUploadFieldAsResume() {
        IdentifiedFields fields = identifier.identify(new Submission(1L, "ada@example.com", List.of(
            new FormField("Full Name", FieldKind.TEXT, "Ada Lovelace"),
            new FormField("Upload CV", FieldKind.FILE, "https://drive.google.com/open?id=abc123"),
            new FormField("Why this role?", FieldKind.PARAGRAPH, "I like engines.")
        )));

        assertThat(fields.resumeReference()).isEqualTo("https://drive.google.com/open?id=abc123");
        assertThat(fields.assignments().get("Upload CV")).isEqualTo(SemanticRole.RESUME);
        assertThat(fields.name()).isEqualTo("Ada Lovelace");
        assertThat(fields.email()).isEqualTo("ada@example.com");
    }

    @Test
    void referenceNameNeverBeatsFullName() {
        IdentifiedFields fields = identifier.identify(List.of(
            new FormField("Reference Name", FieldKind.TEXT, "Charles Babbage"),
            new FormField("Full Name", FieldKind.TEXT, "Ada Lovelace")
        ), null);

        assertThat(fields.name()).isEqualTo("Ada Lovelace");
        assertThat(fields.assignments().get("Reference Name")).isEqualTo(SemanticRole.UNASSIGNED);
        assertThat(fields.remainingAnswers()).containsEntry("Reference Name", "Charles Babbage");
    }

    @Test
    void referenceNameAloneIsNotTreatedAsName() {
        IdentifiedFields fields = identifier.identify(List.of(
            new FormField("Reference Name", FieldKind.TEXT, "Charles Babbage")
        ), null);

        assertThat(fields.name()).isNull();
    }

    @Test
    void firstFieldWinsTies() {
        IdentifiedFields fields = identifier.identify(List.of(
            new FormField("Phone", FieldKind.PHONE, "111"),
            new FormField("Phone", FieldKind.PHONE, "222")
        ), null);

        assertThat(fields.phone()).isEqualTo("111");
        assertThat(fields.assignments()).containsKeys("Phone", "Phone (2)");
        assertThat(fields.remainingAnswers()).containsEntry("Phone (2)", "222");
    }

    @Test
    void fallsBackToEmailFieldAndKeepsItAsAnAnswer() {
        IdentifiedFields fields = identifier.identify(List.of(
            new FormField("Email address", FieldKind.EMAIL, " grace@example.com "),
            new FormField("Mobile", FieldKind.PHONE, "+1 555 0100")
        ), null);

        assertThat(fields.email()).isEqualTo("grace@example.com");
        assertThat(fields.phone()).isEqualTo("+1 555 0100");
        assertThat(fields.remainingAnswers()).containsKey("Email address");
    }

    @Test
    void submissionWithoutResumeFieldHasNoReference() {
        IdentifiedFields fields = identifier.identify(new Submission(1L, null, List.of(
            new FormField("Your name", FieldKind.TEXT, "Linus"),
            new FormField("", FieldKind.TEXT, "blank label")
        )));

        assertThat(fields.hasResumeReference()).isFalse();
        assertThat(fields.name()).isEqualTo("Linus");
        assertThat(fields.remainingAnswers()).containsEntry("Field 2", "blank label");
    }

    @Test
    void nameScoringPenalizesCompanyAndManagerLabels() {
        assertThat(FieldIdentifier.nameScore("company name")).isNegative();
        assertThat(FieldIdentifier.nameScore("hiring manager name")).isNegative();
        assertThat(FieldIdentifier.nameScore("name")).isEqualTo(5);
    }
}
