package com.delta.talentmatch.screening.api;

import com.delta.talentmatch.screening.scoring.ScoringInvariantViolationException;
import com.delta.talentmatch.screening.service.CandidateNotFoundException;
import com.delta.talentmatch.screening.service.InvalidJobRequirementException;
import com.delta.talentmatch.screening.service.JobNotFoundException;
import com.delta.talentmatch.screening.service.ScoringInProgressException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScreeningExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ScreeningExceptionHandler.class);

  @ExceptionHandler(InvalidJobRequirementException.class)
  public ResponseEntity<Map<String, String>> handleInvalidJob(InvalidJobRequirementException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_job_requirement", ex.getMessage());
  }

  @ExceptionHandler(ScoringInvariantViolationException.class)
  public ResponseEntity<Map<String, String>> handleInvariant(ScoringInvariantViolationException ex) {
    log.error("Scoring invariant violated", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "scoring_invariant_violation", ex.getMessage());
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleJobNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
  }

  @ExceptionHandler(CandidateNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleCandidateNotFound(CandidateNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "candidate_not_found", ex.getMessage());
  }

  @ExceptionHandler(ScoringInProgressException.class)
  public ResponseEntity<Map<String, String>> handleInProgress(ScoringInProgressException ex) {
    return error(HttpStatus.CONFLICT, "scoring_in_progress", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
  }

  private ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", code, "message", message == null ? "" : message));
  }
}
