package org.nowstart.retune.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.retune.data.dto.BacktestWindow;
import org.nowstart.retune.data.dto.CandidateEvaluation;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.Hyperparameters;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.dto.OptimizationRun;
import org.nowstart.retune.data.dto.SearchSpace;
import org.nowstart.retune.data.property.SearchProperties;
import org.nowstart.retune.data.type.SearchCompletion;
import org.nowstart.retune.service.signal.ForecastEvaluator;
import org.nowstart.retune.support.MutableClock;

@ExtendWith(MockitoExtension.class)
class HyperparameterSearchServiceTest {

    private static final Instant NOW = Instant.parse("2026-04-01T03:00:00Z");
    private static final SearchSpace SPACE = new SearchSpace(List.of(90, 180), List.of(50, 100), List.of(1.0));

    @Mock
    private ForecastEvaluator forecastEvaluator;

    @Test
    void search_picksLowestPrimaryErrorDeterministically() {
        when(forecastEvaluator.evaluate(any(), any())).thenAnswer(invocation -> {
            Hyperparameters hp = invocation.getArgument(0);
            double error = hp.contextLength() == 180 && hp.numSamples() == 50 ? 7.5 : 9.0 + hp.numSamples() / 100.0;
            return metrics(error, 100.0);
        });
        HyperparameterSearchService service = service(Clock.fixed(NOW, ZoneOffset.UTC), properties(Duration.ofMinutes(10)));

        OptimizationRun first = service.search("7d", SPACE);
        OptimizationRun second = service.search("7d", SPACE);

        assertThat(first.completion()).isEqualTo(SearchCompletion.FULL);
        assertThat(first.evaluations()).extracting(CandidateEvaluation::index).containsExactly(0, 1, 2, 3);
        assertThat(first.bestCandidate().index()).isEqualTo(2);
        assertThat(first.best()).get()
                .extracting(ModelConfiguration::hyperparameters)
                .isEqualTo(new Hyperparameters(180, 50, 1.0));
        assertThat(first.bestConfiguration().searchIterations()).isEqualTo(4);
        assertThat(first.window()).isEqualTo(BacktestWindow.endingAt("7d", NOW, 30));
        assertThat(second.bestConfiguration()).isEqualTo(first.bestConfiguration());
    }

    @Test
    void search_breaksTiesByLatencyThenIndex() {
        when(forecastEvaluator.evaluate(any(), any())).thenAnswer(invocation -> {
            Hyperparameters hp = invocation.getArgument(0);
            double latency = hp.contextLength() == 90 && hp.numSamples() == 50 ? 300.0 : 120.0;
            return metrics(8.0, latency);
        });
        HyperparameterSearchService service = service(Clock.fixed(NOW, ZoneOffset.UTC), properties(Duration.ofMinutes(10)));

        OptimizationRun run = service.search("7d", SPACE);

        assertThat(run.bestCandidate().index()).isEqualTo(1);
    }

    @Test
    void search_excludesFailedCandidates() {
        when(forecastEvaluator.evaluate(any(), any())).thenAnswer(invocation -> {
            Hyperparameters hp = invocation.getArgument(0);
            if (hp.contextLength() == 90) {
                throw new IllegalStateException("backtest crashed");
            }
            if (hp.numSamples() == 100) {
                return new ForecastMetrics(null, 1.0, 1.0, 1.0, 1.0, 0.95, 0.0);
            }
            return metrics(11.0, 100.0);
        });
        HyperparameterSearchService service = service(Clock.fixed(NOW, ZoneOffset.UTC), properties(Duration.ofMinutes(10)));

        OptimizationRun run = service.search("7d", SPACE);

        assertThat(run.failures()).extracting(CandidateEvaluation::index).containsExactly(0, 1, 3);
        assertThat(run.failures().get(0).failureReason()).isEqualTo("backtest crashed");
        assertThat(run.failures().get(2).failureReason()).isEqualTo("missing primary error");
        assertThat(run.bestCandidate().index()).isEqualTo(2);
    }

    @Test
    void search_returnsNoWinnerWhenEveryCandidateFails() {
        when(forecastEvaluator.evaluate(any(), any())).thenThrow(new IllegalStateException("down"));
        HyperparameterSearchService service = service(Clock.fixed(NOW, ZoneOffset.UTC), properties(Duration.ofMinutes(10)));

        OptimizationRun run = service.search("30d", SPACE);

        assertThat(run.best()).isEmpty();
        assertThat(run.bestCandidate()).isNull();
        assertThat(run.failures()).hasSize(4);
    }

    @Test
    void search_samplesRemainingCandidatesOnceRuntimeCeilingIsHit() {
        MutableClock clock = new MutableClock(NOW);
        when(forecastEvaluator.evaluate(any(), any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(1));
            Hyperparameters hp = invocation.getArgument(0);
            return metrics(hp.contextLength() / 10.0 + hp.numSamples() / 1000.0, 100.0);
        });
        SearchSpace space = new SearchSpace(List.of(90, 180, 270), List.of(50, 100), List.of(0.8, 1.2));
        HyperparameterSearchService service = service(clock, properties(Duration.ofMinutes(3)));

        OptimizationRun run = service.search("7d", space);

        assertThat(run.completion()).isEqualTo(SearchCompletion.REDUCED);
        assertThat(run.evaluations()).extracting(CandidateEvaluation::index)
                .containsExactly(0, 1, 2, 3, 4, 6, 8, 10);
        assertThat(run.duration()).isEqualTo(Duration.ofMinutes(8));
        assertThat(run.bestCandidate().index()).isZero();
    }

    @Test
    void search_marksSlowCandidateAsTimedOut() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        when(forecastEvaluator.evaluate(any(), any())).thenAnswer(invocation -> {
            Hyperparameters hp = invocation.getArgument(0);
            if (hp.contextLength() == 90 && hp.numSamples() == 50) {
                release.await(5, TimeUnit.SECONDS);
            }
            return metrics(10.0, 100.0);
        });
        SearchProperties properties = new SearchProperties(30, Duration.ofMillis(100), Duration.ofMinutes(10), 5,
                List.of(50), List.of(1.0), List.of(180), Map.of());
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            HyperparameterSearchService service = new HyperparameterSearchService(
                    forecastEvaluator, properties, executor, Clock.fixed(NOW, ZoneOffset.UTC));

            OptimizationRun run = service.search("7d", SPACE);

            assertThat(run.failures()).singleElement()
                    .satisfies(failure -> {
                        assertThat(failure.index()).isZero();
                        assertThat(failure.failureReason()).startsWith("timeout after");
                    });
            assertThat(run.bestCandidate().index()).isEqualTo(1);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void rescore_fallsBackToStoredMetricsWhenEvaluationFails() {
        ForecastMetrics stored = metrics(9.0, 100.0);
        ModelConfiguration active = ModelConfiguration.create("7d", new Hyperparameters(180, 100, 1.0), stored, 27, NOW);
        BacktestWindow window = BacktestWindow.endingAt("7d", NOW, 30);
        when(forecastEvaluator.evaluate(active.hyperparameters(), window))
                .thenReturn(metrics(9.5, 110.0))
                .thenThrow(new IllegalStateException("down"));
        HyperparameterSearchService service = service(Clock.fixed(NOW, ZoneOffset.UTC), properties(Duration.ofMinutes(10)));

        ModelConfiguration rescored = service.rescore(active, window);
        ModelConfiguration fallback = service.rescore(active, window);

        assertThat(rescored.configId()).isEqualTo(active.configId());
        assertThat(rescored.validationMetrics().primaryError()).isEqualTo(9.5);
        assertThat(fallback).isEqualTo(active);
        verify(forecastEvaluator, times(2)).evaluate(active.hyperparameters(), window);
    }

    @Test
    void sampleRemaining_spreadsSampleEvenlyOverRemainder() {
        assertThat(HyperparameterSearchService.sampleRemaining(3, 12, 5)).containsExactly(3, 4, 6, 8, 10);
        assertThat(HyperparameterSearchService.sampleRemaining(10, 12, 5)).containsExactly(10, 11);
        assertThat(HyperparameterSearchService.sampleRemaining(12, 12, 5)).isEmpty();
    }

    private HyperparameterSearchService service(Clock clock, SearchProperties properties) {
        return new HyperparameterSearchService(forecastEvaluator, properties, Runnable::run, clock);
    }

    private SearchProperties properties(Duration maxRuntime) {
        return new SearchProperties(30, Duration.ofSeconds(60), maxRuntime, 5,
                List.of(50, 100), List.of(1.0), List.of(180), Map.of());
    }

    private ForecastMetrics metrics(double primaryError, double latency) {
        return new ForecastMetrics(primaryError, primaryError * 0.8, primaryError, 2.0, latency, 0.93, 0.5);
    }
}
