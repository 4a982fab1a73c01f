package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.screening.model.CandidateProfile;
import com.delta.talentmatch.screening.model.CandidateStatus;
import com.delta.talentmatch.screening.model.RankedCandidate;
import com.delta.talentmatch.screening.persistence.ScreeningJdbcRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recruiter-facing operations: lookups, status/tags/notes edits and rankings. None of these touch scoring fields.
 */
@Service
public class CandidateReviewService {
    private static final Logger log = LoggerFactory.getLogger(CandidateReviewService.class);
    private static final int MAX_TAG_LENGTH = 64;
    private static final String[] CSV_HEADER = {
        "rank", "candidate_id", "name", "email", "total_score", "grade", "parsing_failed", "status", "submitted_at"
    };

    private final ScreeningJdbcRepository repository;
    private final CandidateRanker ranker;
    private final JobRequirementService jobRequirementService;

    public CandidateReviewService(
        ScreeningJdbcRepository repository,
        CandidateRanker ranker,
        JobRequirementService jobRequirementService
    ) {
        this.repository = repository;
        this.ranker = ranker;
        this.jobRequirementService = jobRequirementService;
    }

    public CandidateProfile get(long candidateId) {
        CandidateProfile candidate = repository.findCandidate(candidateId);
        if (candidate == null) {
            throw new CandidateNotFoundException(candidateId);
        }
        return candidate;
    }

    public CandidateProfile updateStatus(long candidateId, String status) {
        CandidateStatus parsed = CandidateStatus.fromValue(status);
        if (parsed == null) {
            throw new IllegalArgumentException("status is required");
        }
        requireUpdated(candidateId, repository.updateStatus(candidateId, parsed));
        log.info("Candidate {} moved to status {}", candidateId, parsed);
        return get(candidateId);
    }

    public CandidateProfile updateTags(long candidateId, List<String> tags) {
        requireUpdated(candidateId, repository.updateTags(candidateId, cleanTags(tags)));
        return get(candidateId);
    }

    public CandidateProfile updateNotes(long candidateId, String notes) {
        requireUpdated(candidateId, repository.updateNotes(candidateId, notes == null ? "" : notes.strip()));
        return get(candidateId);
    }

    public List<RankedCandidate> ranking(long jobId) {
        jobRequirementService.get(jobId);
        return ranker.rank(repository.findScoredCandidates(jobId));
    }

    public void writeRankingCsv(long jobId, Writer writer) {
        List<RankedCandidate> ranked = ranking(jobId);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADER)
            .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (RankedCandidate candidate : ranked) {
                printer.printRecord(
                    candidate.rank(),
                    candidate.candidateId(),
                    candidate.name(),
                    candidate.email(),
                    candidate.totalScore(),
                    candidate.grade(),
                    candidate.parsingFailed(),
                    candidate.status().value(),
                    candidate.submittedAt()
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ranking CSV for job " + jobId, e);
        }
    }

    static List<String> cleanTags(List<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag == null || tag.isBlank()) {
                    continue;
                }
                String trimmed = tag.strip();
                out.add(trimmed.length() > MAX_TAG_LENGTH ? trimmed.substring(0, MAX_TAG_LENGTH) : trimmed);
            }
        }
        return new ArrayList<>(out);
    }

    private void requireUpdated(long candidateId, int updated) {
        if (updated == 0) {
            throw new CandidateNotFoundException(candidateId);
        }
    }
}
