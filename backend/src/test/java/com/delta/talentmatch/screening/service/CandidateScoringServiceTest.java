package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.ScreeningFixtures;
import com.delta.talentmatch.screening.ai.AiAdjustmentAdapter;
import com.delta.talentmatch.screening.ai.AiAnalysisRequest;
import com.delta.talentmatch.screening.ai.AiAnalysisResponse;
import com.delta.talentmatch.screening.ai.AiServiceException;
import com.delta.talentmatch.screening.ai.CandidateAnalyzer;
import com.delta.talentmatch.screening.document.DocumentNormalizer;
import com.delta.talentmatch.screening.fields.FieldIdentifier;
import com.delta.talentmatch.screening.model.AiAdjustment;
import com.delta.talentmatch.screening.model.CandidateEvaluation;
import com.delta.talentmatch.screening.model.CandidateProfile;
import com.delta.talentmatch.screening.model.CandidateStatus;
import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.DocumentFormat;
import com.delta.talentmatch.screening.model.FieldKind;
import com.delta.talentmatch.screening.model.FormField;
import com.delta.talentmatch.screening.model.Grade;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.model.NormalizedDocument;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import com.delta.talentmatch.screening.model.ScoringInput;
import com.delta.talentmatch.screening.model.ScoringState;
import com.delta.talentmatch.screening.model.Submission;
import com.delta.talentmatch.screening.persistence.ScreeningJdbcRepository;
import com.delta.talentmatch.screening.scoring.TextSignals;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CandidateScoringServiceTest {
    private ExecutorService aiExecutor;
    private ExecutorService scoringExecutor;
    private ScreeningProperties properties;
    private DocumentNormalizer documentNormalizer;

    @BeforeEach
    void setUp() {
        aiExecutor = Executors.newFixedThreadPool(2);
        scoringExecutor = Executors.newFixedThreadPool(2);
        properties = new ScreeningProperties();
        documentNormalizer = Mockito.mock(DocumentNormalizer.class);
    }

    @AfterEach
    void tearDown() {
        aiExecutor.shutdownNow();
        scoringExecutor.shutdownNow();
    }

    @Test
    void exactSkillsMatchEarnsUnicornBonusAndGradeA() {
        properties.getAi().setEnabled(false);
        CandidateScoringService service = service(request -> {
            throw new AssertionError("analyzer must not be called when disabled");
        });

        ScoreBreakdown breakdown = service.score(
            new ScoringInput(ScreeningFixtures.SENIOR_PYTHON_RESUME, ScreeningFixtures.pythonJob(), ScreeningFixtures.teamAnswers()),
            false,
            "c-1"
        );

        assertThat(breakdown.score(Dimension.SKILLS_MATCH)).isEqualTo(100);
        assertThat(breakdown.score(Dimension.EXPERIENCE)).isEqualTo(100);
        assertThat(breakdown.score(Dimension.JOB_RELEVANCE)).isEqualTo(100);
        assertThat(breakdown.score(Dimension.PROJECT_COMPLEXITY)).isEqualTo(66);
        assertThat(breakdown.score(Dimension.COMMUNICATION)).isEqualTo(68);
        assertThat(breakdown.score(Dimension.EDUCATION)).isEqualTo(80);
        assertThat(breakdown.weightedSum()).isEqualTo(94);
        assertThat(breakdown.modifiersApplied())
            .extracting(ModifierApplication::name)
            .containsExactly("unicorn", "leadership");
        assertThat(breakdown.totalScore()).isEqualTo(100);
        assertThat(breakdown.grade()).isEqualTo(Grade.A);
        assertThat(breakdown.weights().values().stream().mapToDouble(Double::doubleValue).sum())
            .isCloseTo(1.0, Offset.offset(1e-9));
    }

    @Test
    void scoringTheSameInputTwiceIsIdentical() {
        properties.getAi().setEnabled(false);
        CandidateScoringService service = service(request -> null);
        ScoringInput input = new ScoringInput(
            ScreeningFixtures.SENIOR_PYTHON_RESUME,
            ScreeningFixtures.pythonJob(),
            ScreeningFixtures.teamAnswers()
        );

        ScoreBreakdown first = service.score(input, false, "c-1");
        ScoreBreakdown second = service.score(input, false, "c-1");

        assertThat(second).isEqualTo(first);
    }

    @Test
    void aiTimeoutFallsBackToNeutralAdjustment() {
        properties.getAi().setApiKey("test-key");
        properties.getAi().setTimeoutSeconds(1);
        CandidateScoringService service = service(request -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new AiAnalysisResponse("late", List.of(), List.of(), 10);
        });

        ScoreBreakdown breakdown = service.score(
            new ScoringInput("Python developer. 2 years of experience.", ScreeningFixtures.pythonJob(), null),
            false,
            "c-2"
        );

        assertThat(breakdown.aiAdjustment()).isZero();
        assertThat(breakdown.aiAnalysis().available()).isFalse();
        assertThat(breakdown.feedback()).contains(AiAdjustment.UNAVAILABLE_SUMMARY);
        assertThat(breakdown.totalScore())
            .isEqualTo(TextSignals.clampScore((long) breakdown.weightedSum() + breakdown.modifierTotal()));
    }

    @Test
    void aiErrorFallsBackToNeutralAdjustment() {
        properties.getAi().setApiKey("test-key");
        CandidateScoringService service = service(request -> {
            throw new AiServiceException("quota exceeded");
        });

        ScoreBreakdown breakdown = service.score(
            new ScoringInput(ScreeningFixtures.SENIOR_PYTHON_RESUME, ScreeningFixtures.pythonJob(), null),
            false,
            "c-3"
        );

        assertThat(breakdown.aiAdjustment()).isZero();
        assertThat(breakdown.feedback()).contains(AiAdjustment.UNAVAILABLE_SUMMARY);
    }

    @Test
    void aiAdjustmentIsClampedAndExplained() {
        properties.getAi().setApiKey("test-key");
        CandidateScoringService service = service(request -> new AiAnalysisResponse(
            "Solid backend profile",
            List.of("Deep PostgreSQL work"),
            List.of("No frontend exposure"),
            -40
        ));

        ScoreBreakdown breakdown = service.score(
            new ScoringInput("Python developer. 2 years of experience.", ScreeningFixtures.pythonJob(), null),
            false,
            "c-4"
        );

        assertThat(breakdown.aiAdjustment()).isEqualTo(-15);
        assertThat(breakdown.feedback()).contains(
            "Solid backend profile",
            "Pro: Deep PostgreSQL work",
            "Con: No frontend exposure"
        );
        assertThat(breakdown.totalScore()).isBetween(0, 100);
    }

    @Test
    void unreadableResumeStillGetsAFullBreakdown() {
        properties.getAi().setEnabled(false);
        when(documentNormalizer.normalize(anyString()))
            .thenReturn(NormalizedDocument.failed(DocumentFormat.UNKNOWN, "HTTP_404"));
        CandidateScoringService service = service(request -> null);

        CandidateEvaluation evaluation = service.evaluate(new Submission(7L, "ada@example.com", List.of(
            new FormField("Full Name", FieldKind.TEXT, "Ada Lovelace"),
            new FormField("Resume", FieldKind.FILE, "https://files.example.com/missing.pdf")
        )), ScreeningFixtures.pythonJob());

        ScoreBreakdown breakdown = evaluation.breakdown();
        assertThat(evaluation.document().parsingFailed()).isTrue();
        assertThat(evaluation.document().text()).isNull();
        assertThat(breakdown.dimensionScores()).hasSize(9);
        assertThat(breakdown.score(Dimension.JOB_RELEVANCE)).isEqualTo(5);
        assertThat(breakdown.feedback().get(0)).isEqualTo(ScoreAggregator.PARSE_FAILED_FEEDBACK);
        assertThat(breakdown.modifiersApplied())
            .extracting(ModifierApplication::name)
            .containsExactly("missing_profile_link");
    }

    @Test
    void batchScoringKeepsSubmissionOrder() {
        properties.getAi().setEnabled(false);
        when(documentNormalizer.normalize(anyString()))
            .thenReturn(NormalizedDocument.success(ScreeningFixtures.SENIOR_PYTHON_RESUME, DocumentFormat.PLAIN_TEXT));
        CandidateScoringService service = service(request -> null);

        List<CandidateEvaluation> results = service.scoreBatch(List.of(
            new Submission(7L, "first@example.com", List.of(new FormField("CV", FieldKind.FILE, "resume-a"))),
            new Submission(7L, "second@example.com", List.of(new FormField("CV", FieldKind.FILE, "resume-b")))
        ), ScreeningFixtures.pythonJob());

        assertThat(results).extracting(result -> result.fields().email())
            .containsExactly("first@example.com", "second@example.com");
        assertThat(results.get(0).breakdown()).isEqualTo(results.get(1).breakdown());
    }

    @Test
    void unreadableResumeDoesNotAffectOtherCandidatesInTheBatch() {
        properties.getAi().setEnabled(false);
        when(documentNormalizer.normalize("resume-good"))
            .thenReturn(NormalizedDocument.success(ScreeningFixtures.SENIOR_PYTHON_RESUME, DocumentFormat.PLAIN_TEXT));
        when(documentNormalizer.normalize("resume-broken"))
            .thenReturn(NormalizedDocument.failed(DocumentFormat.PDF, "EXTRACTION_FAILED"));
        CandidateScoringService service = service(request -> null);

        List<CandidateEvaluation> results = service.scoreBatch(List.of(
            new Submission(7L, "broken@example.com", List.of(new FormField("CV", FieldKind.FILE, "resume-broken"))),
            new Submission(7L, "good@example.com", List.of(new FormField("CV", FieldKind.FILE, "resume-good")))
        ), ScreeningFixtures.pythonJob());

        assertThat(results).hasSize(2);
        assertThat(results.get(0).document().parsingFailed()).isTrue();
        assertThat(results.get(1).document().parsingFailed()).isFalse();
        assertThat(results.get(1).breakdown().totalScore()).isGreaterThan(results.get(0).breakdown().totalScore());
    }

    @Test
    void rescoreOfUnreadableResumeReusesTheStoredFailure() {
        properties.getAi().setEnabled(false);
        ScreeningJdbcRepository repository = Mockito.mock(ScreeningJdbcRepository.class);
        CandidateScoringService service = service(request -> null, repository);
        ScoreBreakdown previous = service.score(
            new ScoringInput(null, ScreeningFixtures.pythonJob(), Map.of()), true, "c-9");
        when(repository.findCandidate(9L)).thenReturn(storedCandidate(9L, previous));
        when(repository.findJobRequirement(7L)).thenReturn(ScreeningFixtures.pythonJob());
        when(repository.claimForRescore(eq(9L), any(Instant.class))).thenReturn(true);
        when(repository.saveScore(eq(9L), isNull(), eq(true), eq("HTTP_404"), any(ScoreBreakdown.class), any(Instant.class)))
            .thenReturn(true);

        ScoreBreakdown rescored = service.rescore(9L);

        assertThat(rescored).isEqualTo(previous);
        verify(documentNormalizer, never()).normalize(any());
    }

    @Test
    void lostClaimIsReportedWithoutReleasingTheNewOwner() {
        properties.getAi().setEnabled(false);
        ScreeningJdbcRepository repository = Mockito.mock(ScreeningJdbcRepository.class);
        CandidateScoringService service = service(request -> null, repository);
        ScoreBreakdown previous = service.score(
            new ScoringInput(null, ScreeningFixtures.pythonJob(), Map.of()), true, "c-9");
        when(repository.findCandidate(9L)).thenReturn(storedCandidate(9L, previous));
        when(repository.findJobRequirement(7L)).thenReturn(ScreeningFixtures.pythonJob());
        when(repository.saveScore(anyLong(), any(), anyBoolean(), any(), any(ScoreBreakdown.class), any(Instant.class)))
            .thenReturn(false);

        assertThatThrownBy(() -> service.scoreClaimed(9L)).isInstanceOf(ScoringInProgressException.class);
        verify(repository, never()).releaseClaim(anyLong(), anyString());
    }

    private CandidateProfile storedCandidate(long id, ScoreBreakdown breakdown) {
        return new CandidateProfile(
            id,
            7L,
            "Ada Lovelace",
            "ada@example.com",
            null,
            "https://files.example.com/missing.pdf",
            null,
            true,
            "HTTP_404",
            Map.of(),
            List.of(),
            "",
            CandidateStatus.APPLIED,
            ScoringState.SCORING_IN_PROGRESS,
            breakdown,
            Instant.parse("2024-06-02T00:00:00Z"),
            Instant.parse("2024-06-02T00:05:00Z")
        );
    }

    private CandidateScoringService service(CandidateAnalyzer analyzer) {
        return service(analyzer, Mockito.mock(ScreeningJdbcRepository.class));
    }

    private CandidateScoringService service(CandidateAnalyzer analyzer, ScreeningJdbcRepository repository) {
        CandidateAnalyzer available = new CandidateAnalyzer() {
            @Override
            public AiAnalysisResponse analyze(AiAnalysisRequest request) {
                return analyzer.analyze(request);
            }

            @Override
            public boolean isAvailable() {
                return properties.getAi().hasApiKey();
            }
        };
        return new CandidateScoringService(
            new FieldIdentifier(),
            documentNormalizer,
            ScreeningFixtures.scoringEngine(),
            new AiAdjustmentAdapter(available, properties, aiExecutor),
            ScreeningFixtures.modifierEngine(properties),
            new ScoreAggregator(),
            repository,
            scoringExecutor
        );
    }
}
