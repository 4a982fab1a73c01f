package com.delta.talentmatch.screening.api;

import com.delta.talentmatch.screening.model.CandidateView;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.RankedCandidate;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import com.delta.talentmatch.screening.model.Submission;
import com.delta.talentmatch.screening.model.SubmissionReceipt;
import com.delta.talentmatch.screening.service.CandidateReviewService;
import com.delta.talentmatch.screening.service.CandidateScoringService;
import com.delta.talentmatch.screening.service.JobRequirementService;
import com.delta.talentmatch.screening.service.SubmissionIntakeService;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ScreeningController {
    private final JobRequirementService jobRequirementService;
    private final SubmissionIntakeService intakeService;
    private final CandidateScoringService scoringService;
    private final CandidateReviewService reviewService;

    public ScreeningController(
        JobRequirementService jobRequirementService,
        SubmissionIntakeService intakeService,
        CandidateScoringService scoringService,
        CandidateReviewService reviewService
    ) {
        this.jobRequirementService = jobRequirementService;
        this.intakeService = intakeService;
        this.scoringService = scoringService;
        this.reviewService = reviewService;
    }

    @PostMapping("/jobs")
    public JobRequirement createJob(@RequestBody(required = false) CreateJobRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        return jobRequirementService.create(request.title(), request.description());
    }

    @PostMapping(path = "/jobs/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public JobRequirement createJobFromUpload(
        @RequestParam(name = "title", required = false) String title,
        @RequestParam(name = "file") MultipartFile file
    ) throws IOException {
        return jobRequirementService.createFromUpload(
            title,
            file.getBytes(),
            file.getContentType(),
            file.getOriginalFilename()
        );
    }

    @GetMapping("/jobs/{jobId}")
    public JobRequirement getJob(@PathVariable("jobId") long jobId) {
        return jobRequirementService.get(jobId);
    }

    @PostMapping("/submissions")
    public SubmissionReceipt submit(
        @RequestBody(required = false) Submission submission,
        @RequestParam(name = "sync", required = false, defaultValue = "false") boolean sync
    ) {
        if (submission == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        return intakeService.submit(submission, sync);
    }

    @GetMapping("/candidates/{candidateId}")
    public CandidateView getCandidate(@PathVariable("candidateId") long candidateId) {
        return CandidateView.from(reviewService.get(candidateId));
    }

    @PostMapping("/candidates/{candidateId}/rescore")
    public ScoreBreakdown rescore(@PathVariable("candidateId") long candidateId) {
        return scoringService.rescore(candidateId);
    }

    @PutMapping("/candidates/{candidateId}/status")
    public CandidateView updateStatus(
        @PathVariable("candidateId") long candidateId,
        @RequestBody CandidateStatusRequest request
    ) {
        return CandidateView.from(reviewService.updateStatus(candidateId, request.status()));
    }

    @PutMapping("/candidates/{candidateId}/tags")
    public CandidateView updateTags(
        @PathVariable("candidateId") long candidateId,
        @RequestBody CandidateTagsRequest request
    ) {
        return CandidateView.from(reviewService.updateTags(candidateId, request.tags()));
    }

    @PutMapping("/candidates/{candidateId}/notes")
    public CandidateView updateNotes(
        @PathVariable("candidateId") long candidateId,
        @RequestBody CandidateNotesRequest request
    ) {
        return CandidateView.from(reviewService.updateNotes(candidateId, request.notes()));
    }

    @GetMapping("/jobs/{jobId}/ranking")
    public List<RankedCandidate> ranking(@PathVariable("jobId") long jobId) {
        return reviewService.ranking(jobId);
    }

    @GetMapping("/jobs/{jobId}/ranking.csv")
    public void rankingCsv(@PathVariable("jobId") long jobId, HttpServletResponse response) throws IOException {
        response.setContentType("text/csv");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader("Content-Disposition", "attachment; filename=\"job-" + jobId + "-ranking.csv\"");
        reviewService.writeRankingCsv(jobId, response.getWriter());
    }
}
