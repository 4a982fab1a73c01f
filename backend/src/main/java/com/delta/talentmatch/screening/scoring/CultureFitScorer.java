package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
public class CultureFitScorer implements DimensionScorer {
    static final int NO_ANSWERS_SCORE = 30;
    private static final Set<String> COLLABORATION_STEMS = TextSignals.stemAll(List.of(
        "team", "teammates", "collaborate", "collaboration", "collaborative", "together", "mentor", "mentoring",
        "communicate", "feedback", "pairing", "help", "support", "share", "inclusive",
        "empathy", "culture", "community", "respect", "ownership", "trust", "learning", "partnered"
    ));

    @Override
    public Dimension dimension() {
        return Dimension.CULTURE_FIT;
    }

    @Override
    public int score(ScoringInput input) {
        List<String> answers = TextSignals.freeTextAnswers(input.answers());
        if (answers.isEmpty()) {
            return NO_ANSWERS_SCORE;
        }
        Set<String> answerStems = TextSignals.stems(String.join("\n", answers));
        int hits = 0;
        for (String stem : COLLABORATION_STEMS) {
            if (answerStems.contains(stem)) {
                hits++;
            }
        }
        return TextSignals.clampScore(30L + 14L * hits);
    }
}
