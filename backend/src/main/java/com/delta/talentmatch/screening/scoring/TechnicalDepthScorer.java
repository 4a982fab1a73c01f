package com.delta.talentmatch.screening.scoring;

import com.delta.talentmatch.screening.model.Dimension;
import com.delta.talentmatch.screening.model.ScoringInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Density of seniority and complexity indicators. Each distinct indicator counts once.
 */
@Component
public class TechnicalDepthScorer implements DimensionScorer {
    private static final List<String> INDICATORS = List.of(
        "architecture", "architected", "designed", "led", "optimized", "scale", "scalable", "distributed",
        "performance", "latency", "throughput", "concurrency", "microservices", "mentored", "refactored",
        "migrated", "implemented", "owned", "production", "reliability", "availability", "resilience",
        "senior", "principal", "staff", "infrastructure", "pipeline", "automated", "benchmarked", "profiled"
    );
    private static final Set<String> INDICATOR_STEMS = TextSignals.stemAll(INDICATORS);

    @Override
    public Dimension dimension() {
        return Dimension.TECHNICAL_DEPTH;
    }

    @Override
    public int score(ScoringInput input) {
        if (!input.hasResumeText()) {
            return MIN_SCORE;
        }
        Set<String> resumeStems = TextSignals.stems(input.resumeText());
        int hits = 0;
        for (String indicator : INDICATOR_STEMS) {
            if (resumeStems.contains(indicator)) {
                hits++;
            }
        }
        return TextSignals.clampScore(10L + 15L * hits);
    }
}
