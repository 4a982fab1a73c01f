package com.delta.talentmatch.screening.api;

public record CandidateNotesRequest(String notes) {
}
