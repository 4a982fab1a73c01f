package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Share of the requirement's content terms that also appear in the résumé. Eighty percent coverage
 * already counts as a full match.
 */
@Component
public class JobRelevanceScorer implements DimensionScorer {
    private static final double FULL_COVERAGE = 0.8;

    @Override
    public Dimension dimension() {
        return Dimension.JOB_RELEVANCE;
    }

    @Override
    public int score(ScoringInput input) {
        if (!input.hasResumeText()) {
            return MIN_SCORE;
        }
        Set<String> jobTerms = TextSignals.contentTerms(input.job() == null ? null : input.job().requirementText());
        if (jobTerms.isEmpty()) {
            return 50;
        }
        Set<String> resumeTerms = TextSignals.contentTerms(input.resumeText());
        int matched = 0;
        for (String term : jobTerms) {
            if (resumeTerms.contains(term)) {
                matched++;
            }
        }
        double coverage = matched / (double) jobTerms.size();
        long score = Math.round(100.0 * Math.min(1.0, coverage / FULL_COVERAGE));
        return Math.max(MIN_SCORE, TextSignals.clampScore(score));
    }
}
