package com.delta.talentmatch.screening.ai;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.AiAdjustment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the AI analysis off the scoring thread with a hard time budget and turns whatever comes back into a
 * bounded {@link AiAdjustment}. Every failure path ends in {@link AiAdjustment#neutral()}.
 */
@Service
public class AiAdjustmentAdapter {
    private static final Logger log = LoggerFactory.getLogger(AiAdjustmentAdapter.class);
    private static final int MAX_LIST_ITEMS = 5;

    private final CandidateAnalyzer analyzer;
    private final ScreeningProperties properties;
    private final ExecutorService aiExecutor;

    public AiAdjustmentAdapter(
        CandidateAnalyzer analyzer,
        ScreeningProperties properties,
        @Qualifier("aiExecutor") ExecutorService aiExecutor
    ) {
        this.analyzer = analyzer;
        this.properties = properties;
        this.aiExecutor = aiExecutor;
    }

    public CompletableFuture<AiAdjustment> adjustAsync(AiAnalysisRequest request, String candidateRef) {
        if (!properties.getAi().isEnabled() || !analyzer.isAvailable()) {
            log.debug("AI analysis skipped for candidate {}: provider disabled or not configured", candidateRef);
            return CompletableFuture.completedFuture(AiAdjustment.neutral());
        }
        return CompletableFuture
            .supplyAsync(() -> toAdjustment(analyzer.analyze(request)), aiExecutor)
            .orTimeout(properties.getAi().getTimeoutSeconds(), TimeUnit.SECONDS)
            .exceptionally(error -> {
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                    log.warn("AI analysis timed out for candidate {} after {}s", candidateRef, properties.getAi().getTimeoutSeconds());
                } else {
                    log.warn("AI analysis failed for candidate {}: {}", candidateRef, cause.getMessage());
                }
                return AiAdjustment.neutral();
            });
    }

    public AiAdjustment toAdjustment(AiAnalysisResponse response) {
        if (response == null) {
            return AiAdjustment.neutral();
        }
        int bound = properties.getAi().getMaxAdjustment();
        int raw = response.scoreAdjustment() == null ? 0 : response.scoreAdjustment();
        int delta = Math.max(-bound, Math.min(bound, raw));
        return new AiAdjustment(
            response.summary() == null ? "" : response.summary().strip(),
            cleanList(response.pros()),
            cleanList(response.cons()),
            delta,
            true
        );
    }

    private List<String> cleanList(List<String> items) {
        List<String> out = new ArrayList<>();
        if (items == null) {
            return out;
        }
        for (String item : items) {
            if (item != null && !item.isBlank() && out.size() < MAX_LIST_ITEMS) {
                out.add(item.strip());
            }
        }
        return out;
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
