package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Stream;

/**
 * Highest degree found in the résumé, judged against the education bar implied by the requirement text.
 */
@Component
public class EducationScorer implements DimensionScorer {
    static final int NO_DEGREE_FOUND_SCORE = 50;

    private static final List<String> DOCTORATE = List.of("phd", "ph.d", "ph.d.", "doctorate", "doctoral");
    private static final List<String> MASTERS = List.of(
        "master's", "masters", "master of", "mba", "m.s.", "m.sc", "msc", "m.tech", "m.eng", "m.a."
    );
    private static final List<String> BACHELORS = List.of(
        "bachelor's", "bachelors", "bachelor of", "b.s.", "b.sc", "bsc", "b.a.", "b.tech", "b.e.", "b.eng", "undergraduate degree"
    );

    /** Terms that mark a line as describing a qualification rather than a job. */
    static final List<String> DEGREE_TERMS = Stream.of(
        DOCTORATE,
        MASTERS,
        BACHELORS,
        List.of("degree", "diploma", "associate's", "high school", "graduated", "gpa")
    ).flatMap(List::stream).toList();

    private enum Level { NONE, BACHELORS, MASTERS, DOCTORATE }

    @Override
    public Dimension dimension() {
        return Dimension.EDUCATION;
    }

    @Override
    public int score(ScoringInput input) {
        if (!input.hasResumeText()) {
            return MIN_SCORE;
        }
        Level held = highestLevel(TextSignals.lower(input.resumeText()));
        if (held == Level.NONE) {
            return NO_DEGREE_FOUND_SCORE;
        }
        String job = TextSignals.lower(input.job() == null ? null : input.job().requirementText());
        if (TextSignals.countDistinctTerms(job, DOCTORATE) > 0) {
            return switch (held) {
                case DOCTORATE -> 100;
                case MASTERS -> 80;
                default -> 60;
            };
        }
        if (job.contains("master") || TextSignals.containsTerm(job, "mba")) {
            return switch (held) {
                case MASTERS -> 100;
                case DOCTORATE -> 90;
                default -> 70;
            };
        }
        if (job.contains("bachelor") || TextSignals.containsTerm(job, "degree")) {
            return 100;
        }
        return switch (held) {
            case DOCTORATE -> 100;
            case MASTERS -> 90;
            default -> 80;
        };
    }

    private Level highestLevel(String lowerResume) {
        if (TextSignals.countDistinctTerms(lowerResume, DOCTORATE) > 0) {
            return Level.DOCTORATE;
        }
        if (TextSignals.countDistinctTerms(lowerResume, MASTERS) > 0) {
            return Level.MASTERS;
        }
        if (TextSignals.countDistinctTerms(lowerResume, BACHELORS) > 0) {
            return Level.BACHELORS;
        }
        return Level.NONE;
    }
}
