package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.screening.ai.AiAdjustmentAdapter;
import com.delta.talentmatch.screening.ai.AiAnalysisRequest;
import com.delta.talentmatch.screening.document.DocumentNormalizer;
import com.delta.talentmatch.screening.fields.FieldIdentifier;
import com.delta.talentmatch.screening.model.AiAdjustment;
import com.delta.talentmatch.screening.model.CandidateEvaluation;
import com.delta.talentmatch.screening.model.CandidateProfile;
import com.delta.talentmatch.screening.model.IdentifiedFields;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.model.NormalizedDocument;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import com.delta.talentmatch.screening.model.ScoringInput;
import com.delta.talentmatch.screening.model.Submission;
import com.delta.talentmatch.screening.modifiers.ModifierContext;
import com.delta.talentmatch.screening.modifiers.ModifierEngine;
import com.delta.talentmatch.screening.persistence.ScreeningJdbcRepository;
import com.delta.talentmatch.screening.scoring.DimensionScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs the scoring pipeline: identify fields, normalize the résumé, score dimensions while the AI call is in
 * flight, apply modifiers, aggregate.
 *
 * <p>{@link #score(ScoringInput, boolean, String)} depends only on its arguments and the AI result, so re-scoring
 * unchanged data with a deterministic analyzer yields an identical breakdown.
 */
@Service
public class CandidateScoringService {
    private static final Logger log = LoggerFactory.getLogger(CandidateScoringService.class);

    private final FieldIdentifier fieldIdentifier;
    private final DocumentNormalizer documentNormalizer;
    private final DimensionScoringEngine scoringEngine;
    private final AiAdjustmentAdapter aiAdjustmentAdapter;
    private final ModifierEngine modifierEngine;
    private final ScoreAggregator aggregator;
    private final ScreeningJdbcRepository repository;
    private final ExecutorService scoringExecutor;

    public CandidateScoringService(
        FieldIdentifier fieldIdentifier,
        DocumentNormalizer documentNormalizer,
        DimensionScoringEngine scoringEngine,
        AiAdjustmentAdapter aiAdjustmentAdapter,
        ModifierEngine modifierEngine,
        ScoreAggregator aggregator,
        ScreeningJdbcRepository repository,
        @Qualifier("scoringExecutor") ExecutorService scoringExecutor
    ) {
        this.fieldIdentifier = fieldIdentifier;
        this.documentNormalizer = documentNormalizer;
        this.scoringEngine = scoringEngine;
        this.aiAdjustmentAdapter = aiAdjustmentAdapter;
        this.modifierEngine = modifierEngine;
        this.aggregator = aggregator;
        this.repository = repository;
        this.scoringExecutor = scoringExecutor;
    }

    public CandidateEvaluation evaluate(Submission submission, JobRequirement job) {
        IdentifiedFields fields = fieldIdentifier.identify(submission);
        String candidateRef = fields.email() == null ? "(no email)" : fields.email();
        if (!fields.hasResumeReference()) {
            log.warn("No résumé field identified for candidate {}", candidateRef);
        }
        NormalizedDocument document = documentNormalizer.normalize(fields.resumeReference());
        ScoringInput input = new ScoringInput(document.text(), job, fields.remainingAnswers());
        ScoreBreakdown breakdown = score(input, document.parsingFailed(), candidateRef);
        return new CandidateEvaluation(fields, document, breakdown);
    }

    public ScoreBreakdown score(ScoringInput input, boolean parsingFailed, String candidateRef) {
        JobRequirement job = input.job();
        CompletableFuture<AiAdjustment> ai = aiAdjustmentAdapter.adjustAsync(
            new AiAnalysisRequest(job == null ? "" : job.requirementText(), input.resumeText(), input.answers()),
            candidateRef
        );
        Map<String, Integer> dimensionScores = scoringEngine.scoreAll(input);
        int weightedSum = scoringEngine.weightedSum(dimensionScores);
        List<ModifierApplication> modifiers = modifierEngine.apply(new ModifierContext(
            input.resumeText(),
            input.answers(),
            dimensionScores,
            job == null ? null : job.createdAt(),
            job == null ? List.of() : job.requiredSkills()
        ));
        return aggregator.aggregate(
            dimensionScores,
            scoringEngine.weights(),
            weightedSum,
            ai.join(),
            modifiers,
            parsingFailed
        );
    }

    /**
     * Scores submissions in parallel on the scoring pool. Results keep the input order.
     */
    public List<CandidateEvaluation> scoreBatch(List<Submission> submissions, JobRequirement job) {
        List<CompletableFuture<CandidateEvaluation>> futures = new ArrayList<>();
        for (Submission submission : submissions) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(submission, job), scoringExecutor));
        }
        List<CandidateEvaluation> results = new ArrayList<>(futures.size());
        for (CompletableFuture<CandidateEvaluation> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw e;
            }
        }
        log.info("Batch scoring finished for job {}: {} candidates", job == null ? null : job.id(), results.size());
        return results;
    }

    /**
     * Scores a candidate that the caller has already moved to scoring-in-progress, and stores the result.
     * The claim is released if anything goes wrong. A candidate that already has a breakdown is scored from
     * its stored résumé text or stored parse failure; only a first scoring fetches the document.
     */
    public ScoreBreakdown scoreClaimed(long candidateId) {
        try {
            CandidateProfile candidate = repository.findCandidate(candidateId);
            if (candidate == null) {
                throw new CandidateNotFoundException(candidateId);
            }
            JobRequirement job = repository.findJobRequirement(candidate.jobId());
            if (job == null) {
                throw new JobNotFoundException(candidate.jobId());
            }
            String resumeText = candidate.resumeText();
            boolean parsingFailed = candidate.parsingFailed();
            String parseErrorCode = candidate.parseErrorCode();
            if (!candidate.hasResumeText() && candidate.breakdown() == null) {
                NormalizedDocument document = documentNormalizer.normalize(candidate.resumeReference());
                resumeText = document.text();
                parsingFailed = document.parsingFailed();
                parseErrorCode = document.failureCode();
                if (parsingFailed) {
                    log.warn("Candidate {} scored in degraded mode ({})", candidateId, parseErrorCode);
                }
            }
            ScoreBreakdown breakdown = score(
                new ScoringInput(resumeText, job, candidate.answers()),
                parsingFailed,
                String.valueOf(candidateId)
            );
            if (!repository.saveScore(candidateId, resumeText, parsingFailed, parseErrorCode, breakdown, Instant.now())) {
                log.warn("Scoring claim for candidate {} was lost before the result was stored", candidateId);
                throw new ScoringInProgressException(candidateId);
            }
            log.info("Scored candidate {} for job {}: total={} grade={}",
                candidateId, job.id(), breakdown.totalScore(), breakdown.grade());
            return breakdown;
        } catch (ScoringInProgressException e) {
            throw e;
        } catch (RuntimeException e) {
            repository.releaseClaim(candidateId, "exception=" + e.getClass().getSimpleName());
            throw e;
        }
    }

    /** Explicit re-score: replaces the stored breakdown as a whole. */
    public ScoreBreakdown rescore(long candidateId) {
        CandidateProfile candidate = repository.findCandidate(candidateId);
        if (candidate == null) {
            throw new CandidateNotFoundException(candidateId);
        }
        if (!repository.claimForRescore(candidateId, Instant.now())) {
            throw new ScoringInProgressException(candidateId);
        }
        return scoreClaimed(candidateId);
    }
}
