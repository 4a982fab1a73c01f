package com.delta.talentmatch.screening.service;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.ScoringDaemonStatusResponse;
import com.delta.talentmatch.screening.model.ScoringQueueStats;
import com.delta.talentmatch.screening.persistence.ScreeningJdbcRepository;
import com.delta.talentmatch.screening.scoring.ScoringInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background workers that drain unscored candidates. Each worker claims one candidate at a time
 * ({@code UNSCORED -> SCORING_IN_PROGRESS}), scores it and stores it {@code SCORED}. A failed attempt releases the
 * claim; after {@code maxAttempts} the candidate stays parked in {@code UNSCORED} for manual review.
 */
@Service
public class ScoringDaemonService {
    private static final Logger log = LoggerFactory.getLogger(ScoringDaemonService.class);

    private final ScreeningJdbcRepository repository;
    private final CandidateScoringService scoringService;
    private final ScreeningProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private int activeWorkerCount;

    public ScoringDaemonService(
        ScreeningJdbcRepository repository,
        CandidateScoringService scoringService,
        ScreeningProperties properties
    ) {
        this.repository = repository;
        this.scoringService = scoringService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getDaemon().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public ScoringDaemonStatusResponse getStatus() {
        ScoringQueueStats stats;
        try {
            stats = repository.fetchQueueStats(properties.getDaemon().getMaxAttempts());
        } catch (Exception e) {
            log.warn("Failed to load scoring queue stats", e);
            stats = new ScoringQueueStats(0, 0, 0, 0);
        }
        return new ScoringDaemonStatusResponse(running.get(), activeWorkerCount, stats);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getDaemon().getWorkerCount();
            int pollIntervalMs = properties.getDaemon().getPollIntervalMs();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("scoring-daemon-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            log.info("Scoring daemon started with {} workers", workerCount);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Scoring daemon stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claims and scores the next queued candidate on the calling thread.
     *
     * @return false when the queue had nothing claimable
     */
    public boolean processNext() {
        Long candidateId = repository.claimNextUnscored(Instant.now(), properties.getDaemon().getMaxAttempts());
        if (candidateId == null) {
            return false;
        }
        try {
            scoringService.scoreClaimed(candidateId);
        } catch (ScoringInvariantViolationException e) {
            log.error("Scoring invariant violated for candidate {}", candidateId, e);
        } catch (RuntimeException e) {
            log.warn("Scoring failed for candidate {}", candidateId, e);
        }
        return true;
    }

    public int requeueStaleClaims() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getDaemon().getStaleClaimMinutes()));
        int requeued = repository.requeueStaleClaims(cutoff);
        if (requeued > 0) {
            log.info("Returned {} stale scoring claims to the queue", requeued);
        }
        return requeued;
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        Thread.currentThread().setName("scoring-daemon-worker-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean processed;
            try {
                processed = processNext();
            } catch (Exception e) {
                log.warn("Daemon worker {} failed to claim queue item", workerIndex, e);
                sleep(pollIntervalMs);
                continue;
            }
            if (!processed) {
                if (workerIndex == 1) {
                    try {
                        requeueStaleClaims();
                    } catch (Exception e) {
                        log.warn("Failed to requeue stale scoring claims", e);
                    }
                }
                sleep(pollIntervalMs);
            }
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
