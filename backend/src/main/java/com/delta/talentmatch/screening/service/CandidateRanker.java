package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.screening.model.CandidateProfile;
import com.delta.talentmatch.screening.model.RankedCandidate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored candidates by total score, earliest submission first on ties, id as the final tie-break.
 * Candidates without a breakdown are left out.
 */
@Component
public class CandidateRanker {
    private static final Comparator<CandidateProfile> ORDER = Comparator
        .comparingInt((CandidateProfile c) -> c.breakdown().totalScore()).reversed()
        .thenComparing(CandidateProfile::submittedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
        .thenComparingLong(CandidateProfile::id);

    public List<RankedCandidate> rank(List<CandidateProfile> candidates) {
        List<CandidateProfile> scored = new ArrayList<>();
        if (candidates != null) {
            for (CandidateProfile candidate : candidates) {
                if (candidate != null && candidate.breakdown() != null) {
                    scored.add(candidate);
                }
            }
        }
        scored.sort(ORDER);
        List<RankedCandidate> ranked = new ArrayList<>(scored.size());
        int rank = 1;
        for (CandidateProfile candidate : scored) {
            ranked.add(new RankedCandidate(
                rank++,
                candidate.id(),
                candidate.name(),
                candidate.email(),
                candidate.breakdown().totalScore(),
                candidate.breakdown().grade(),
                candidate.parsingFailed(),
                candidate.status(),
                candidate.submittedAt()
            ));
        }
        return ranked;
    }
}
