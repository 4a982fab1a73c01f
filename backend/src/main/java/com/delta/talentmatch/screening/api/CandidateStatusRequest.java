package com.delta.talentmatch.screening.api;

public record CandidateStatusRequest(String status) {
}
