package com.delta.talentmatch.screening.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ScoringInProgressException extends RuntimeException {
    public ScoringInProgressException(long candidateId) {
        super("Candidate " + candidateId + " is already being scored");
    }
}
