package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw keyword coverage: words of four or more letters from the requirement that the résumé repeats verbatim.
 * Matching half of them already earns a high score.
 */
@Component
public class KeywordsScorer implements DimensionScorer {
    private static final Pattern WORD = Pattern.compile("\\b\\w{4,}\\b");
    private static final double RATIO_MULTIPLIER = 150.0;

    @Override
    public Dimension dimension() {
        return Dimension.KEYWORDS;
    }

    @Override
    public int score(ScoringInput input) {
        if (!input.hasResumeText()) {
            return MIN_SCORE;
        }
        Set<String> jobWords = words(input.job() == null ? null : input.job().requirementText());
        if (jobWords.isEmpty()) {
            return 50;
        }
        Set<String> resumeWords = words(input.resumeText());
        int matched = 0;
        for (String word : jobWords) {
            if (resumeWords.contains(word)) {
                matched++;
            }
        }
        long score = Math.round(Math.min(100.0, matched / (double) jobWords.size() * RATIO_MULTIPLIER));
        return Math.max(MIN_SCORE, TextSignals.clampScore(score));
    }

    private Set<String> words(String text) {
        Set<String> out = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(TextSignals.lower(text));
        while (matcher.find()) {
            String word = matcher.group();
            if (!TextSignals.STOPWORDS.contains(word)) {
                out.add(word);
            }
        }
        return out;
    }
}
