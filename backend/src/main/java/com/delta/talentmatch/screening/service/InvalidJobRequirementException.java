package com.delta.talentmatch.screening.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidJobRequirementException extends RuntimeException {
    public InvalidJobRequirementException(String message) {
        super(message);
    }
}
