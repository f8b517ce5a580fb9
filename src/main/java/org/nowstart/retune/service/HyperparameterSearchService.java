package org.nowstart.retune.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.BacktestWindow;
import org.nowstart.retune.data.dto.CandidateEvaluation;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.Hyperparameters;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.dto.OptimizationRun;
import org.nowstart.retune.data.dto.SearchSpace;
import org.nowstart.retune.data.exception.CandidateEvaluationException;
import org.nowstart.retune.data.property.SearchProperties;
import org.nowstart.retune.data.type.SearchCompletion;
import org.nowstart.retune.service.signal.ForecastEvaluator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Exhaustive, deterministic grid search over a {@link SearchSpace}.
 *
 * <p>Candidates are evaluated in index order against the same backtest window. The winner is the lowest
 * primary error, ties broken by lower latency and then by lower index. When the wall-clock ceiling is
 * reached mid-grid, the remaining candidates are replaced by an evenly spaced sample and the run is
 * marked {@link SearchCompletion#REDUCED}.
 */
@Slf4j
@Service
public class HyperparameterSearchService {

    private static final Comparator<CandidateEvaluation> BEST_FIRST = Comparator
            .comparingDouble((CandidateEvaluation candidate) -> candidate.metrics().primaryError())
            .thenComparingDouble(candidate -> latencyOf(candidate.metrics()))
            .thenComparingInt(CandidateEvaluation::index);

    private final ForecastEvaluator forecastEvaluator;
    private final SearchProperties searchProperties;
    private final Executor candidateEvaluationExecutor;
    private final Clock clock;

    public HyperparameterSearchService(
            ForecastEvaluator forecastEvaluator,
            SearchProperties searchProperties,
            @Qualifier("candidateEvaluationExecutor") Executor candidateEvaluationExecutor,
            Clock clock
    ) {
        this.forecastEvaluator = forecastEvaluator;
        this.searchProperties = searchProperties;
        this.candidateEvaluationExecutor = candidateEvaluationExecutor;
        this.clock = clock;
    }

    public OptimizationRun search(String horizon, SearchSpace searchSpace) {
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(searchProperties.maxRuntime());
        BacktestWindow window = BacktestWindow.endingAt(horizon, startedAt, searchProperties.backtestWindowDays());
        int total = searchSpace.size();

        log.info("event=search_started horizon={} candidates={} window_start={} window_end={}",
                horizon, total, window.start(), window.end());

        List<CandidateEvaluation> evaluations = new ArrayList<>(total);
        SearchCompletion completion = SearchCompletion.FULL;
        for (int index = 0; index < total; index++) {
            if (!clock.instant().isBefore(deadline)) {
                List<Integer> sample = sampleRemaining(index, total, searchProperties.fallbackSampleSize());
                log.warn("event=search_reduced horizon={} evaluated={} remaining={} sampled={} max_runtime={}",
                        horizon, index, total - index, sample, searchProperties.maxRuntime());
                for (int sampledIndex : sample) {
                    evaluations.add(evaluateCandidate(horizon, sampledIndex, searchSpace.candidateAt(sampledIndex), window));
                }
                completion = SearchCompletion.REDUCED;
                break;
            }
            evaluations.add(evaluateCandidate(horizon, index, searchSpace.candidateAt(index), window));
        }

        CandidateEvaluation best = evaluations.stream()
                .filter(CandidateEvaluation::isSucceeded)
                .min(BEST_FIRST)
                .orElse(null);
        int evaluated = evaluations.size();
        ModelConfiguration bestConfiguration = best == null
                ? null
                : ModelConfiguration.create(horizon, best.hyperparameters(), best.metrics(), evaluated, clock.instant());
        Duration duration = Duration.between(startedAt, clock.instant());
        OptimizationRun run = new OptimizationRun(
                horizon,
                searchSpace,
                window,
                List.copyOf(evaluations),
                best,
                bestConfiguration,
                duration,
                completion
        );

        log.info(
                "event=search_completed horizon={} completion={} evaluated={} failed={} best_index={} best_primary_error={} config_id={} duration_ms={}",
                horizon,
                completion,
                evaluated,
                run.failures().size(),
                best == null ? null : best.index(),
                best == null ? null : best.metrics().primaryError(),
                bestConfiguration == null ? null : bestConfiguration.configId(),
                duration.toMillis()
        );
        return run;
    }

    /**
     * Re-evaluates an existing configuration on the given window so it can be compared with a fresh
     * candidate. Falls back to the stored metrics when the evaluation fails.
     */
    public ModelConfiguration rescore(ModelConfiguration configuration, BacktestWindow window) {
        CandidateEvaluation evaluation = evaluateCandidate(
                configuration.horizon(),
                -1,
                configuration.hyperparameters(),
                window
        );
        if (evaluation.isSucceeded()) {
            return configuration.withValidationMetrics(evaluation.metrics());
        }
        log.warn("event=baseline_rescore_failed horizon={} config_id={} reason={} fallback=stored_metrics",
                configuration.horizon(), configuration.configId(), evaluation.failureReason());
        return configuration;
    }

    private CandidateEvaluation evaluateCandidate(
            String horizon,
            int index,
            Hyperparameters hyperparameters,
            BacktestWindow window
    ) {
        CompletableFuture<ForecastMetrics> future = CompletableFuture.supplyAsync(
                () -> forecastEvaluator.evaluate(hyperparameters, window),
                candidateEvaluationExecutor
        );
        ForecastMetrics metrics;
        try {
            metrics = future.get(searchProperties.candidateTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(horizon, index, hyperparameters, "timeout after " + searchProperties.candidateTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("event=candidate_failed horizon={} index={} params={}", horizon, index, hyperparameters, cause);
            return CandidateEvaluation.failed(index, hyperparameters, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CandidateEvaluationException(horizon, "interrupted", e);
        }

        if (metrics == null || metrics.primaryError() == null || !Double.isFinite(metrics.primaryError())) {
            return failed(horizon, index, hyperparameters, "missing primary error");
        }
        log.debug("event=candidate_evaluated horizon={} index={} params={} primary_error={} latency_ms={}",
                horizon, index, hyperparameters, metrics.primaryError(), metrics.latencyMillis());
        return CandidateEvaluation.succeeded(index, hyperparameters, metrics);
    }

    private CandidateEvaluation failed(String horizon, int index, Hyperparameters hyperparameters, String reason) {
        log.warn("event=candidate_failed horizon={} index={} params={} reason={}", horizon, index, hyperparameters, reason);
        return CandidateEvaluation.failed(index, hyperparameters, reason);
    }

    static List<Integer> sampleRemaining(int from, int total, int sampleSize) {
        int remaining = total - from;
        List<Integer> sample = new ArrayList<>();
        if (remaining <= sampleSize) {
            for (int index = from; index < total; index++) {
                sample.add(index);
            }
            return sample;
        }
        for (int i = 0; i < sampleSize; i++) {
            sample.add(from + (int) ((long) i * remaining / sampleSize));
        }
        return sample;
    }

    private static double latencyOf(ForecastMetrics metrics) {
        Double latency = metrics.latencyMillis();
        return latency == null || !Double.isFinite(latency) ? Double.MAX_VALUE : latency;
    }
}
