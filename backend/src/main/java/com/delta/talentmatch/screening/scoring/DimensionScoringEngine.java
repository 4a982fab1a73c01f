package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the nine dimension scorers and folds them into the weighted sum.
 */
@Component
public class DimensionScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(DimensionScoringEngine.class);

    private final Map<Dimension, DimensionScorer> scorers;

    public DimensionScoringEngine(List<DimensionScorer> scorers) {
        this.scorers = index(scorers);
        verifyWeights();
    }

    /** Sub-scores keyed by {@link Dimension#key()}, in dimension declaration order. */
    public Map<String, Integer> scoreAll(ScoringInput input) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            DimensionScorer scorer = scorers.get(dimension);
            int score;
            try {
                score = scorer.score(input);
            } catch (RuntimeException e) {
                throw new ScoringInvariantViolationException("Scorer for " + dimension.key() + " threw", e);
            }
            if (score < 0 || score > 100) {
                throw new ScoringInvariantViolationException(
                    "Scorer for " + dimension.key() + " returned " + score + " outside [0, 100]"
                );
            }
            out.put(dimension.key(), score);
        }
        log.debug("Dimension scores {}", out);
        return Collections.unmodifiableMap(out);
    }

    public Map<String, Double> weights() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            out.put(dimension.key(), dimension.weight());
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Weighted sum rounded half-up to an integer in {@code [0, 100]}. Works in basis points so the weights
     * add up exactly.
     */
    public int weightedSum(Map<String, Integer> dimensionScores) {
        long accumulated = 0;
        for (Dimension dimension : Dimension.values()) {
            Integer score = dimensionScores.get(dimension.key());
            if (score == null) {
                throw new ScoringInvariantViolationException("Missing score for " + dimension.key());
            }
            accumulated += (long) score * dimension.weightBasisPoints();
        }
        long rounded = (accumulated * 2 + Dimension.TOTAL_BASIS_POINTS) / (2L * Dimension.TOTAL_BASIS_POINTS);
        return TextSignals.clampScore(rounded);
    }

    static void verifyWeights() {
        int total = Dimension.totalWeightBasisPoints();
        if (total != Dimension.TOTAL_BASIS_POINTS || Dimension.values().length != 9) {
            throw new ScoringInvariantViolationException(
                "Dimension weights must be nine entries summing to " + Dimension.TOTAL_BASIS_POINTS + " basis points, got " + total
            );
        }
    }

    private static Map<Dimension, DimensionScorer> index(List<DimensionScorer> scorers) {
        Map<Dimension, DimensionScorer> byDimension = new EnumMap<>(Dimension.class);
        for (DimensionScorer scorer : scorers) {
            DimensionScorer previous = byDimension.put(scorer.dimension(), scorer);
            if (previous != null) {
                throw new ScoringInvariantViolationException("Two scorers registered for " + scorer.dimension().key());
            }
        }
        for (Dimension dimension : Dimension.values()) {
            if (!byDimension.containsKey(dimension)) {
                throw new ScoringInvariantViolationException("No scorer registered for " + dimension.key());
            }
        }
        return byDimension;
    }
}
