package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.screening.model.AiAdjustment;
import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.Grade;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.model.ScoreBreakdown;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreAggregatorTest {
    private final ScoreAggregator aggregator = new ScoreAggregator();

    @Test
    void totalIsClampedForEveryCombination() {
        int[] sums = {0, 1, 50, 99, 100};
        int[] aiDeltas = {-15, 0, 15};
        List<List<ModifierApplication>> modifierSets = List.of(
            List.of(),
            List.of(new ModifierApplication("unicorn", 5, "u"), new ModifierApplication("leadership", 3, "l")),
            List.of(
                new ModifierApplication("missing_profile_link", -3, "m"),
                new ModifierApplication("red_flag:employment_gap", -5, "g"),
                new ModifierApplication("red_flag:job_hopping", -5, "h"),
                new ModifierApplication("red_flag:inconsistent_dates", -5, "d"),
                new ModifierApplication("ai_authored_answers", -10, "a"),
                new ModifierApplication("low_relevance", -10, "r")
            )
        );
        for (int sum : sums) {
            for (int delta : aiDeltas) {
                for (List<ModifierApplication> modifiers : modifierSets) {
                    ScoreBreakdown breakdown = aggregator.aggregate(
                        uniform(sum), weights(), sum, ai(delta), modifiers, false
                    );
                    assertThat(breakdown.totalScore()).isBetween(0, 100);
                    assertThat(breakdown.grade()).isEqualTo(Grade.forScore(breakdown.totalScore()));
                }
            }
        }
    }

    @Test
    void gradeBoundaries() {
        assertThat(Grade.forScore(80)).isEqualTo(Grade.A);
        assertThat(Grade.forScore(79)).isEqualTo(Grade.B);
        assertThat(Grade.forScore(65)).isEqualTo(Grade.B);
        assertThat(Grade.forScore(64)).isEqualTo(Grade.C);
        assertThat(Grade.forScore(50)).isEqualTo(Grade.C);
        assertThat(Grade.forScore(49)).isEqualTo(Grade.D);
    }

    @Test
    void feedbackFollowsFixedOrder() {
        Map<String, Integer> scores = uniform(60);
        scores.put("job_relevance", 90);
        scores.put("keywords", 10);
        AiAdjustment ai = new AiAdjustment("Good fit", List.of("Clear writing"), List.of("Short tenure"), 4, true);

        ScoreBreakdown breakdown = aggregator.aggregate(
            scores,
            weights(),
            61,
            ai,
            List.of(new ModifierApplication("leadership", 3, "Leadership experience (\"tech lead\")")),
            true
        );

        List<String> feedback = breakdown.feedback();
        assertThat(feedback.get(0)).isEqualTo(ScoreAggregator.PARSE_FAILED_FEEDBACK);
        assertThat(feedback.get(1)).isEqualTo("✓ Strong job relevance (90/100)");
        assertThat(feedback.get(2)).isEqualTo("• Adequate skills match (60/100)");
        assertThat(feedback.get(9)).isEqualTo("⚠ Low keyword coverage (10/100)");
        assertThat(feedback.subList(10, feedback.size())).containsExactly(
            "+3 Leadership experience (\"tech lead\")",
            "Good fit",
            "Pro: Clear writing",
            "Con: Short tenure"
        );
        assertThat(breakdown.totalScore()).isEqualTo(68);
        assertThat(breakdown.grade()).isEqualTo(Grade.B);
    }

    @Test
    void unavailableAiIsReportedOnce() {
        ScoreBreakdown breakdown = aggregator.aggregate(uniform(50), weights(), 50, null, null, false);
        assertThat(breakdown.aiAdjustment()).isZero();
        assertThat(breakdown.feedback()).filteredOn(AiAdjustment.UNAVAILABLE_SUMMARY::equals).hasSize(1);
        assertThat(breakdown.modifiersApplied()).isEmpty();
    }

    private AiAdjustment ai(int delta) {
        return new AiAdjustment("", List.of(), List.of(), delta, true);
    }

    private Map<String, Integer> uniform(int value) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            scores.put(dimension.key(), value);
        }
        return scores;
    }

    private Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            weights.put(dimension.key(), dimension.weight());
        }
        return weights;
    }
}
