package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.config.ScreeningConfig;
import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.document.DocumentNormalizer;
import com.delta.talentmatch.screening.model.DocumentFormat;
import com.delta.talentmatch.screening.model.FieldKind;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.NormalizedDocument;
import com.delta.talentmatch.screening.model.Submission;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScreeningCliRunnerTest {
    private final ScreeningProperties properties = new ScreeningProperties();
    private final JobRequirementService jobRequirementService = Mockito.mock(JobRequirementService.class);
    private final CandidateScoringService scoringService = Mockito.mock(CandidateScoringService.class);
    private final DocumentNormalizer documentNormalizer = Mockito.mock(DocumentNormalizer.class);
    private final ScreeningCliRunner runner = new ScreeningCliRunner(
        properties,
        jobRequirementService,
        scoringService,
        documentNormalizer,
        new ScreeningConfig().objectMapper(),
        Mockito.mock(ConfigurableApplicationContext.class)
    );

    @TempDir
    Path tempDir;

    @Test
    void doesNothingUnlessEnabled() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(jobRequirementService, scoringService, documentNormalizer);
    }

    @Test
    void readsArrayOrSingleSubmission() throws Exception {
        Path array = write("array.json", """
            [
              {"job_id": 1, "respondent_email": "a@example.com",
               "fields": [{"label": "Resume", "kind": "paragraph", "value": "Python developer"}]},
              {"jobId": 1, "fields": [{"label": "Upload CV", "type": "file_upload", "value": "https://cv.example.com/b.pdf"}]}
            ]
            """);
        Path single = write("single.json", "{\"job_id\": 2, \"fields\": []}");

        List<Submission> many = runner.readSubmissions(array.toString());
        List<Submission> one = runner.readSubmissions(single.toString());

        assertThat(many).hasSize(2);
        assertThat(many.get(0).respondentEmail()).isEqualTo("a@example.com");
        assertThat(many.get(1).fields().get(0).declaredKind()).isEqualTo(FieldKind.FILE);
        assertThat(one).extracting(Submission::jobId).containsExactly(2L);
    }

    @Test
    void scoresFileBatchWithoutExiting() throws Exception {
        Path submissions = write("subs.json", "[{\"job_id\": 1, \"fields\": []}, {\"job_id\": 1, \"fields\": []}]");
        Path description = write("job.txt", "Senior Python engineer with PostgreSQL.");
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getCli().setJobTitle("Python Engineer");
        properties.getCli().setSubmissionFile(submissions.toString());
        properties.getCli().setJobDescriptionFile(description.toString());
        JobRequirement job = new JobRequirement(0L, "Python Engineer", "Senior Python engineer with PostgreSQL.",
            List.of("python", "postgres"), Instant.now());
        when(documentNormalizer.normalizeBytes(any(), any(), eq("job.txt")))
            .thenReturn(NormalizedDocument.success("Senior Python engineer with PostgreSQL.", DocumentFormat.PLAIN_TEXT));
        when(jobRequirementService.draft("Python Engineer", "Senior Python engineer with PostgreSQL.")).thenReturn(job);
        when(scoringService.scoreBatch(anyList(), eq(job))).thenReturn(List.of());

        runner.run(new DefaultApplicationArguments());

        verify(scoringService).scoreBatch(Mockito.argThat(list -> list.size() == 2), eq(job));
    }

    @Test
    void missingFileIsRejected() {
        properties.getCli().setRun(true);
        properties.getCli().setJobDescriptionFile(tempDir.resolve("nope.txt").toString());

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("File not found");
    }

    private Path write(String name, String content) throws Exception {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }
}
