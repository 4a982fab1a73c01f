package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Clarity of the candidate's free-text answers (not the résumé): answer length, sentence length and
 * basic sentence hygiene, averaged over answers.
 */
@Component
public class CommunicationScorer implements DimensionScorer {
    static final int NO_ANSWERS_SCORE = 40;
    private static final int FULL_LENGTH_WORDS = 60;

    @Override
    public Dimension dimension() {
        return Dimension.COMMUNICATION;
    }

    @Override
    public int score(ScoringInput input) {
        List<String> answers = TextSignals.freeTextAnswers(input.answers());
        if (answers.isEmpty()) {
            return NO_ANSWERS_SCORE;
        }
        int total = 0;
        for (String answer : answers) {
            total += scoreAnswer(answer);
        }
        long average = Math.round(total / (double) answers.size());
        return Math.max(MIN_SCORE, TextSignals.clampScore(average));
    }

    private int scoreAnswer(String answer) {
        int words = TextSignals.wordCount(answer);
        int lengthPoints = Math.min(50, words * 50 / FULL_LENGTH_WORDS);

        List<String> sentences = TextSignals.sentences(answer);
        double averageSentence = sentences.isEmpty() ? words : words / (double) sentences.size();
        int clarityPoints;
        if (averageSentence >= 8 && averageSentence <= 25) {
            clarityPoints = 30;
        } else if (averageSentence >= 5 && averageSentence <= 35) {
            clarityPoints = 15;
        } else {
            clarityPoints = 5;
        }

        int hygienePoints = 0;
        char first = answer.charAt(0);
        char last = answer.charAt(answer.length() - 1);
        if (Character.isUpperCase(first) && (last == '.' || last == '!' || last == '?')) {
            hygienePoints += 10;
        }
        if (upperCaseRatio(answer) < 0.3) {
            hygienePoints += 10;
        }
        return lengthPoints + clarityPoints + hygienePoints;
    }

    private double upperCaseRatio(String text) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        return letters == 0 ? 0 : upper / (double) letters;
    }
}
