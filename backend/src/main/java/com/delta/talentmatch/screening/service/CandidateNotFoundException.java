package com.delta.talentmatch.screening.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CandidateNotFoundException extends RuntimeException {
    public CandidateNotFoundException(long candidateId) {
        super("Candidate " + candidateId + " not found");
    }
}
