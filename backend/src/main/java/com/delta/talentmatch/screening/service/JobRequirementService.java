package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.screening.document.DocumentNormalizer;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.NormalizedDocument;
import com.delta.talentmatch.screening.persistence.ScreeningJdbcRepository;
import com.delta.talentmatch.screening.scoring.SkillCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@Service
public class JobRequirementService {
    private static final Logger log = LoggerFactory.getLogger(JobRequirementService.class);
    private static final String DEFAULT_TITLE = "Untitled role";

    private final ScreeningJdbcRepository repository;
    private final SkillCatalog skillCatalog;
    private final DocumentNormalizer documentNormalizer;

    public JobRequirementService(
        ScreeningJdbcRepository repository,
        SkillCatalog skillCatalog,
        DocumentNormalizer documentNormalizer
    ) {
        this.repository = repository;
        this.skillCatalog = skillCatalog;
        this.documentNormalizer = documentNormalizer;
    }

    public JobRequirement create(String title, String description) {
        JobRequirement draft = draft(title, description);
        long id = repository.insertJobRequirement(
            draft.title(), draft.description(), draft.requiredSkills(), draft.createdAt()
        );
        log.info("Created job requirement {} '{}' with {} required skills", id, draft.title(), draft.requiredSkills().size());
        return new JobRequirement(id, draft.title(), draft.description(), draft.requiredSkills(), draft.createdAt());
    }

    /** Validates and derives required skills without storing anything. The returned job has id 0. */
    public JobRequirement draft(String title, String description) {
        if (description == null || description.isBlank()) {
            throw new InvalidJobRequirementException("Job description must not be empty");
        }
        String safeTitle = title == null || title.isBlank() ? DEFAULT_TITLE : title.trim();
        String safeDescription = description.strip();
        List<String> skills = new ArrayList<>(skillCatalog.extractSkills(safeTitle + "\n" + safeDescription));
        return new JobRequirement(0L, safeTitle, safeDescription, skills, Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * Creates a job from an uploaded PDF, DOCX, HTML or text file. An unreadable upload is rejected the same way
     * as an empty description.
     */
    public JobRequirement createFromUpload(String title, byte[] content, String contentType, String fileName) {
        if (content == null || content.length == 0) {
            throw new InvalidJobRequirementException("Uploaded job description is empty");
        }
        NormalizedDocument document = documentNormalizer.normalizeBytes(content, contentType, fileName);
        if (document.parsingFailed()) {
            throw new InvalidJobRequirementException(
                "Could not read uploaded job description (" + document.failureCode() + ")"
            );
        }
        return create(title, document.text());
    }

    public JobRequirement get(long jobId) {
        JobRequirement job = repository.findJobRequirement(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }
}
