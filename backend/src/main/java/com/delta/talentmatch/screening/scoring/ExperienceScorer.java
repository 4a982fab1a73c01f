package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.JobRequirement;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Years of experience from explicit phrases or employment date ranges. Against a stated requirement the
 * score steps down as the candidate falls short; without one it follows a saturating curve.
 */
@Component
public class ExperienceScorer implements DimensionScorer {
    static final int NO_YEARS_FOUND_SCORE = 30;
    private static final double CURVE_SCALE_YEARS = 3.5;
    private static final double MAX_PLAUSIBLE_YEARS = 50.0;

    private static final List<Pattern> CANDIDATE_YEAR_PATTERNS = List.of(
        Pattern.compile("(\\d{1,2}(?:\\.\\d)?)\\s*\\+?\\s*(?:years?|yrs?)(?:\\s+of)?(?:\\s+[a-z-]+){0,3}?\\s+experience"),
        Pattern.compile("experience[:\\s]+(?:of\\s+)?(\\d{1,2}(?:\\.\\d)?)\\s*\\+?\\s*(?:years?|yrs?)"),
        Pattern.compile("(\\d{1,2})\\s*\\+?\\s*years?\\s+in\\s")
    );
    private static final List<Pattern> REQUIRED_YEAR_PATTERNS = List.of(
        Pattern.compile("(\\d+)\\+?\\s*years?\\s+(?:of\\s+)?experience"),
        Pattern.compile("minimum\\s+of\\s+(\\d+)\\s+years?"),
        Pattern.compile("at\\s+least\\s+(\\d+)\\s+years?")
    );

    @Override
    public Dimension dimension() {
        return Dimension.EXPERIENCE;
    }

    @Override
    public int score(ScoringInput input) {
        if (!input.hasResumeText()) {
            return MIN_SCORE;
        }
        Double years = candidateYears(input.resumeText(), input.job());
        if (years == null) {
            return NO_YEARS_FOUND_SCORE;
        }
        Integer required = input.job() == null ? null : requiredYears(input.job().requirementText());
        int score = required == null ? curve(years) : againstRequirement(years, required);
        return Math.max(MIN_SCORE, TextSignals.clampScore(score));
    }

    static Double candidateYears(String resumeText, JobRequirement job) {
        String lower = TextSignals.lower(resumeText);
        double best = -1;
        for (Pattern pattern : CANDIDATE_YEAR_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            while (matcher.find()) {
                double value = Double.parseDouble(matcher.group(1));
                if (value <= MAX_PLAUSIBLE_YEARS) {
                    best = Math.max(best, value);
                }
            }
        }
        EmploymentTimeline timeline = EmploymentTimeline.parse(resumeText, job == null ? null : job.createdAt());
        if (!timeline.isEmpty()) {
            best = Math.max(best, Math.min(MAX_PLAUSIBLE_YEARS, timeline.totalYears()));
        }
        return best < 0 ? null : best;
    }

    static Integer requiredYears(String requirementText) {
        String lower = TextSignals.lower(requirementText);
        for (Pattern pattern : REQUIRED_YEAR_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                try {
                    return Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException ignored) {
                    return null;
                }
            }
        }
        return null;
    }

    private int againstRequirement(double years, int required) {
        if (years >= required + 1) {
            return 100;
        }
        if (years >= required) {
            return 95;
        }
        if (years >= required * 0.75) {
            return 75;
        }
        if (years >= required * 0.5) {
            return 50;
        }
        return 20;
    }

    private int curve(double years) {
        return (int) Math.round(100.0 * (1.0 - Math.exp(-years / CURVE_SCALE_YEARS)));
    }
}
