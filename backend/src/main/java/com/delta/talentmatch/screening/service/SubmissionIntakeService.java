package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.screening.fields.FieldIdentifier;
import com.delta.talentmatch.screening.model.CandidateProfile;
import com.delta.talentmatch.screening.model.FormField;
import com.delta.talentmatch.screening.model.IdentifiedFields;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.NewCandidate;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import com.delta.talentmatch.screening.model.ScoringState;
import com.delta.talentmatch.screening.model.Submission;
import com.delta.talentmatch.screening.model.SubmissionReceipt;
import com.delta.talentmatch.screening.persistence.ScreeningJdbcRepository;
import com.delta.talentmatch.screening.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Submission ingress. Persists the identified candidate as unscored and either scores it inline or leaves it
 * for the scoring daemon. Identical resubmissions resolve to the existing candidate.
 */
@Service
public class SubmissionIntakeService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionIntakeService.class);

    private final ScreeningJdbcRepository repository;
    private final FieldIdentifier fieldIdentifier;
    private final CandidateScoringService scoringService;

    public SubmissionIntakeService(
        ScreeningJdbcRepository repository,
        FieldIdentifier fieldIdentifier,
        CandidateScoringService scoringService
    ) {
        this.repository = repository;
        this.fieldIdentifier = fieldIdentifier;
        this.scoringService = scoringService;
    }

    public SubmissionReceipt submit(Submission submission, boolean scoreNow) {
        if (submission == null || submission.jobId() == null) {
            throw new IllegalArgumentException("jobId is required");
        }
        long jobId = submission.jobId();
        JobRequirement job = repository.findJobRequirement(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }

        String fingerprint = fingerprint(submission);
        Long existingId = repository.findCandidateIdByFingerprint(fingerprint);
        if (existingId != null) {
            log.info("Duplicate submission for job {} resolved to candidate {}", jobId, existingId);
            return receipt(existingId, true);
        }

        IdentifiedFields fields = fieldIdentifier.identify(submission);
        NewCandidate candidate = new NewCandidate(
            jobId,
            fields.name(),
            fields.email(),
            fields.phone(),
            fields.resumeReference(),
            fields.remainingAnswers(),
            fingerprint,
            Instant.now().truncatedTo(ChronoUnit.MILLIS)
        );
        long candidateId;
        try {
            candidateId = repository.insertCandidate(candidate);
        } catch (DuplicateKeyException e) {
            Long racedId = repository.findCandidateIdByFingerprint(fingerprint);
            if (racedId == null) {
                throw e;
            }
            return receipt(racedId, true);
        }
        if (!fields.hasResumeReference()) {
            log.warn("No résumé field identified for candidate {}", candidateId);
        }
        log.info("Accepted submission for job {} as candidate {}", jobId, candidateId);

        if (scoreNow && repository.claimUnscored(candidateId, Instant.now())) {
            ScoreBreakdown breakdown = scoringService.scoreClaimed(candidateId);
            return new SubmissionReceipt(
                candidateId, jobId, ScoringState.SCORED, false, breakdown.totalScore(), breakdown.grade()
            );
        }
        return receipt(candidateId, false);
    }

    static String fingerprint(Submission submission) {
        List<String> parts = new ArrayList<>();
        parts.add(String.valueOf(submission.jobId()));
        String email = submission.normalizedRespondentEmail();
        parts.add(email == null ? "" : email.toLowerCase(Locale.ROOT));
        for (FormField field : submission.normalizedFields()) {
            parts.add(field.label());
            parts.add(field.declaredKind().name());
            parts.add(field.value());
        }
        return HashUtils.fingerprint(parts);
    }

    private SubmissionReceipt receipt(long candidateId, boolean duplicate) {
        CandidateProfile candidate = repository.findCandidate(candidateId);
        if (candidate == null) {
            throw new CandidateNotFoundException(candidateId);
        }
        return new SubmissionReceipt(
            candidateId,
            candidate.jobId(),
            candidate.scoringState(),
            duplicate,
            candidate.totalScore(),
            candidate.grade()
        );
    }
}
