package com.retinaai.service;

import com.retinaai.exception.ExternalServiceException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.ai.AiAnalysis;
import com.retinaai.scoring.RetinalScorer;
import com.retinaai.scoring.ScoringOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one image through the scorer end to end: submit, score, then complete or fail.
 *
 * The scorer is called outside any transaction on the scorer pool and bounded by
 * a timeout. Scorer errors, timeouts and invalid scorer output all end in a failed
 * analysis carrying the reason; they are not rethrown.
 */
@Service
@Slf4j
public class AnalysisRunner {

    static final String TIMEOUT_REASON = "timeout";

    private final AnalysisOrchestrator orchestrator;
    private final RetinalScorer scorer;
    private final ExecutorService scorerExecutor;
    private final Duration defaultTimeout;

    public AnalysisRunner(
            AnalysisOrchestrator orchestrator,
            RetinalScorer scorer,
            @Qualifier("scorerExecutor") ExecutorService scorerExecutor,
            @Value("${retina.scorer.timeout-ms:30000}") long timeoutMs) {
        this.orchestrator = orchestrator;
        this.scorer = scorer;
        this.scorerExecutor = scorerExecutor;
        this.defaultTimeout = Duration.ofMillis(timeoutMs);
    }

    public AiAnalysis run(Long imageId) {
        return run(imageId, defaultTimeout);
    }

    /**
     * Analyze an image with the active model, waiting at most {@code timeout} for the scorer.
     *
     * @return the analysis in its terminal state
     */
    public AiAnalysis run(Long imageId, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ValidationException("Scorer timeout must be positive");
        }

        AiAnalysis analysis = orchestrator.submit(imageId);
        Long analysisId = analysis.getId();

        ScoringOutcome outcome;
        try {
            outcome = score(analysis, timeout);
        } catch (ExternalServiceException e) {
            log.warn("Scorer failed for analysis {}: {}", analysisId, e.getMessage());
            return orchestrator.fail(analysisId, e.isTimeout() ? TIMEOUT_REASON : e.getMessage());
        }

        try {
            return orchestrator.complete(analysisId, outcome.findings(), outcome.heatmapUrl(), outcome.description());
        } catch (ValidationException e) {
            log.warn("Rejected scorer output for analysis {}: {}", analysisId, e.getMessage());
            return orchestrator.fail(analysisId, "Invalid scorer output: " + e.getMessage());
        }
    }

    private ScoringOutcome score(AiAnalysis analysis, Duration timeout) {
        String imageUrl = analysis.getImage().getImageUrl();
        String thresholdConfig = analysis.getModelVersion().getThresholdConfig();

        Future<ScoringOutcome> future;
        try {
            future = scorerExecutor.submit(() -> scorer.score(imageUrl, thresholdConfig));
        } catch (RejectedExecutionException e) {
            throw new ExternalServiceException("Scorer pool rejected the request", e);
        }

        try {
            ScoringOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                throw new ExternalServiceException("Scorer returned no outcome");
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ExternalServiceException.timeout("Scorer did not answer within " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalServiceException external) {
                throw external;
            }
            String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new ExternalServiceException("Scorer failed: " + detail, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExternalServiceException("Interrupted while waiting for the scorer", e);
        }
    }
}
