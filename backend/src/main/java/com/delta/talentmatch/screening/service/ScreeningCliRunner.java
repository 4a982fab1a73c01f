package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.document.DocumentNormalizer;
import com.delta.talentmatch.screening.model.CandidateEvaluation;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.NormalizedDocument;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import com.delta.talentmatch.screening.model.Submission;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores a file of submissions against a job description file and logs each breakdown. Nothing is stored.
 */
@Component
public class ScreeningCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScreeningCliRunner.class);

    private final ScreeningProperties properties;
    private final JobRequirementService jobRequirementService;
    private final CandidateScoringService scoringService;
    private final DocumentNormalizer documentNormalizer;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public ScreeningCliRunner(
        ScreeningProperties properties,
        JobRequirementService jobRequirementService,
        CandidateScoringService scoringService,
        DocumentNormalizer documentNormalizer,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobRequirementService = jobRequirementService;
        this.scoringService = scoringService;
        this.documentNormalizer = documentNormalizer;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        JobRequirement job = jobRequirementService.draft(
            properties.getCli().getJobTitle(),
            readJobDescription(properties.getCli().getJobDescriptionFile())
        );
        List<Submission> submissions = readSubmissions(properties.getCli().getSubmissionFile());
        log.info("Scoring {} submissions against '{}' (skills={})", submissions.size(), job.title(), job.requiredSkills());

        List<CandidateEvaluation> evaluations = scoringService.scoreBatch(submissions, job);
        for (CandidateEvaluation evaluation : evaluations) {
            ScoreBreakdown breakdown = evaluation.breakdown();
            log.info(
                "Candidate {} <{}>: total={}, grade={}, weighted={}, ai={}, modifiers={}, parsingFailed={}",
                evaluation.fields().name(),
                evaluation.fields().email(),
                breakdown.totalScore(),
                breakdown.grade(),
                breakdown.weightedSum(),
                breakdown.aiAdjustment(),
                breakdown.modifiersApplied(),
                evaluation.document().parsingFailed()
            );
            log.info("Dimensions: {}", breakdown.dimensionScores());
            for (String line : breakdown.feedback()) {
                log.info("  {}", line);
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    List<Submission> readSubmissions(String file) {
        Path path = requireFile(file, "screening.cli.submission-file");
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            List<Submission> out = new ArrayList<>();
            if (root.isArray()) {
                for (JsonNode node : root) {
                    out.add(objectMapper.treeToValue(node, Submission.class));
                }
            } else {
                out.add(objectMapper.treeToValue(root, Submission.class));
            }
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read submissions from " + path, e);
        }
    }

    private String readJobDescription(String file) {
        Path path = requireFile(file, "screening.cli.job-description-file");
        try {
            byte[] content = Files.readAllBytes(path);
            NormalizedDocument document = documentNormalizer.normalizeBytes(content, null, path.getFileName().toString());
            if (document.parsingFailed()) {
                throw new InvalidJobRequirementException(
                    "Could not read job description " + path + " (" + document.failureCode() + ")"
                );
            }
            return document.text();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read job description from " + path, e);
        }
    }

    private Path requireFile(String file, String propertyName) {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException(propertyName + " must be set when screening.cli.run=true");
        }
        Path path = Paths.get(file);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("File not found: " + path.toAbsolutePath());
        }
        return path;
    }
}
