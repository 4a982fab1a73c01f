package com.delta.talentmatch.screening.api;

import java.util.List;

public record CandidateTagsRequest(List<String> tags) {
}
