package org.nowstart.retune.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.DeploymentRecord;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.dto.MonitorResult;
import org.nowstart.retune.data.dto.OptimizationRun;
import org.nowstart.retune.data.dto.PipelineResult;
import org.nowstart.retune.data.dto.RunOptions;
import org.nowstart.retune.data.dto.SearchSpace;
import org.nowstart.retune.data.dto.TriggerReport;
import org.nowstart.retune.data.dto.ValidationReport;
import org.nowstart.retune.data.exception.HorizonBusyException;
import org.nowstart.retune.data.exception.OptimizerApiException;
import org.nowstart.retune.data.exception.SearchExhaustedException;
import org.nowstart.retune.data.property.MonitorProperties;
import org.nowstart.retune.data.property.OptimizerProperties;
import org.nowstart.retune.data.type.NotificationType;
import org.nowstart.retune.data.type.PipelineOutcome;
import org.nowstart.retune.data.type.TriggerReason;
import org.nowstart.retune.repository.ConfigurationSlotRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Runs trigger, search, validation, deployment and monitoring for each horizon.
 *
 * <p>Horizons are independent: a cycle fans them out on the pipeline executor and one horizon's failure
 * never affects another. Within a horizon at most one run is in flight; a second request fails fast.
 * Every run that starts ends with exactly one history entry and one {@code CYCLE_COMPLETED} notification.
 */
@Slf4j
@Service
public class OptimizationPipelineService {

    private final OptimizerProperties optimizerProperties;
    private final MonitorProperties monitorProperties;
    private final OptimizationTriggerService optimizationTriggerService;
    private final SearchSpaceResolver searchSpaceResolver;
    private final HyperparameterSearchService hyperparameterSearchService;
    private final ConfigValidationService configValidationService;
    private final ConfigDeploymentService configDeploymentService;
    private final PostDeploymentMonitorService postDeploymentMonitorService;
    private final ConfigurationSlotRepository configurationSlotRepository;
    private final OptimizationHistoryService optimizationHistoryService;
    private final OptimizerNotificationService optimizerNotificationService;
    private final Executor pipelineExecutor;
    private final Clock clock;
    private final HorizonGuard pipelineGuard = new HorizonGuard();

    public OptimizationPipelineService(
            OptimizerProperties optimizerProperties,
            MonitorProperties monitorProperties,
            OptimizationTriggerService optimizationTriggerService,
            SearchSpaceResolver searchSpaceResolver,
            HyperparameterSearchService hyperparameterSearchService,
            ConfigValidationService configValidationService,
            ConfigDeploymentService configDeploymentService,
            PostDeploymentMonitorService postDeploymentMonitorService,
            ConfigurationSlotRepository configurationSlotRepository,
            OptimizationHistoryService optimizationHistoryService,
            OptimizerNotificationService optimizerNotificationService,
            @Qualifier("pipelineExecutor") Executor pipelineExecutor,
            Clock clock
    ) {
        this.optimizerProperties = optimizerProperties;
        this.monitorProperties = monitorProperties;
        this.optimizationTriggerService = optimizationTriggerService;
        this.searchSpaceResolver = searchSpaceResolver;
        this.hyperparameterSearchService = hyperparameterSearchService;
        this.configValidationService = configValidationService;
        this.configDeploymentService = configDeploymentService;
        this.postDeploymentMonitorService = postDeploymentMonitorService;
        this.configurationSlotRepository = configurationSlotRepository;
        this.optimizationHistoryService = optimizationHistoryService;
        this.optimizerNotificationService = optimizerNotificationService;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    public List<PipelineResult> runCycle() {
        List<String> horizons = optimizerProperties.horizons().stream()
                .map(String::trim)
                .filter(horizon -> !horizon.isBlank())
                .distinct()
                .toList();
        if (horizons.isEmpty()) {
            return List.of();
        }

        RunOptions options = new RunOptions(false, optimizerProperties.dryRun());
        log.info("event=cycle_started horizons={} dry_run={}", horizons, options.dryRun());
        List<CompletableFuture<PipelineResult>> futures = horizons.stream()
                .map(horizon -> CompletableFuture
                        .supplyAsync(() -> runHorizon(horizon, options), pipelineExecutor)
                        .exceptionally(e -> {
                            log.error("event=horizon_run_crashed horizon={}", horizon, e);
                            Instant now = clock.instant();
                            return PipelineResult.builder()
                                    .horizon(horizon)
                                    .outcome(PipelineOutcome.FAILED)
                                    .detail(String.valueOf(e.getMessage()))
                                    .startedAt(now)
                                    .finishedAt(now)
                                    .build();
                        }))
                .toList();

        List<PipelineResult> results = futures.stream()
                .map(CompletableFuture::join)
                .toList();
        for (PipelineResult result : results) {
            log.info("event=cycle_summary horizon={} outcome={} detail={}",
                    result.horizon(), result.outcome(), result.detail());
        }
        return results;
    }

    public PipelineResult runHorizon(String horizon, RunOptions options) {
        if (!pipelineGuard.tryAcquire(horizon)) {
            log.warn("event=pipeline_busy horizon={}", horizon);
            Instant now = clock.instant();
            return PipelineResult.builder()
                    .horizon(horizon)
                    .outcome(PipelineOutcome.BUSY)
                    .detail("optimization already running")
                    .startedAt(now)
                    .finishedAt(now)
                    .build();
        }
        try {
            return runExclusive(horizon, options);
        } finally {
            pipelineGuard.release(horizon);
        }
    }

    /**
     * Starts a run in the background. The horizon lease is taken before returning, so a concurrent
     * request for the same horizon is rejected immediately.
     */
    public void submit(String horizon, RunOptions options) {
        if (!optimizerProperties.manages(horizon)) {
            throw new OptimizerApiException(HttpStatus.NOT_FOUND, "horizon_not_found", "Unknown horizon=" + horizon);
        }
        if (!pipelineGuard.tryAcquire(horizon)) {
            throw HorizonBusyException.pipeline(horizon);
        }
        try {
            pipelineExecutor.execute(() -> {
                try {
                    runExclusive(horizon, options);
                } finally {
                    pipelineGuard.release(horizon);
                }
            });
        } catch (RejectedExecutionException e) {
            pipelineGuard.release(horizon);
            throw new OptimizerApiException(HttpStatus.SERVICE_UNAVAILABLE, "pipeline_rejected",
                    "Pipeline executor rejected run for horizon=" + horizon, e);
        }
        log.info("event=pipeline_submitted horizon={} force={} dry_run={}", horizon, options.force(), options.dryRun());
    }

    public boolean isRunning(String horizon) {
        return pipelineGuard.isHeld(horizon);
    }

    private PipelineResult runExclusive(String horizon, RunOptions options) {
        PipelineResult.PipelineResultBuilder result = PipelineResult.builder()
                .horizon(horizon)
                .startedAt(clock.instant());
        try {
            return execute(horizon, options, result);
        } catch (SearchExhaustedException e) {
            log.error("event=search_exhausted horizon={} code={} message={}", horizon, e.getCode(), e.getMessage());
            return finish(result.outcome(PipelineOutcome.FAILED).detail(e.getCode() + ": " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("event=pipeline_failed horizon={}", horizon, e);
            return finish(result.outcome(PipelineOutcome.FAILED).detail("unexpected error: " + e.getMessage()));
        }
    }

    private PipelineResult execute(String horizon, RunOptions options, PipelineResult.PipelineResultBuilder result) {
        if (!options.force()) {
            TriggerReport trigger = optimizationTriggerService.evaluate(horizon);
            result.trigger(trigger);
            if (trigger.skipped()) {
                return finish(result.outcome(PipelineOutcome.SKIPPED).detail("no trigger signal available"));
            }
            if (!trigger.shouldOptimize()) {
                return finish(result.outcome(PipelineOutcome.NO_OP).detail("no trigger fired"));
            }
            optimizerNotificationService.publish(NotificationType.OPTIMIZATION_TRIGGERED, horizon,
                    "Triggered by " + trigger.reasons().stream().map(TriggerReason::code).collect(Collectors.joining(",")));
        } else {
            optimizerNotificationService.publish(NotificationType.OPTIMIZATION_TRIGGERED, horizon, "Forced run");
        }

        SearchSpace searchSpace = searchSpaceResolver.resolve(horizon);
        OptimizationRun run = hyperparameterSearchService.search(horizon, searchSpace);
        result.run(run);
        ModelConfiguration candidate = run.best()
                .orElseThrow(() -> new SearchExhaustedException(horizon, run.failures().size()));

        ModelConfiguration baseline = configurationSlotRepository.readActive(horizon)
                .map(active -> hyperparameterSearchService.rescore(active, run.window()))
                .orElse(null);
        ValidationReport validation = configValidationService.validate(candidate, baseline);
        result.validation(validation);
        if (!validation.approved()) {
            optimizerNotificationService.publish(NotificationType.VALIDATION_FAILED, horizon,
                    "Rejected " + candidate.configId() + ": " + validation.rejectionReasons());
            return finish(result.outcome(PipelineOutcome.REJECTED)
                    .detail("validation rejected: " + validation.rejectionReasons()));
        }
        optimizerNotificationService.publish(NotificationType.VALIDATION_PASSED, horizon,
                "Approved " + candidate.configId());

        if (options.dryRun()) {
            return finish(result.outcome(PipelineOutcome.DRY_RUN).detail("dry run, " + candidate.configId() + " not deployed"));
        }

        DeploymentRecord deployment;
        try {
            deployment = configDeploymentService.deploy(candidate);
        } catch (OptimizerApiException e) {
            log.error("event=pipeline_deployment_failed horizon={} config_id={} code={}",
                    horizon, candidate.configId(), e.getCode(), e);
            return finish(result.outcome(PipelineOutcome.FAILED).detail(e.getCode() + ": " + e.getMessage()));
        }
        result.deployment(deployment);

        if (!monitorProperties.enabled()) {
            return finish(result.outcome(PipelineOutcome.DEPLOYED).detail("deployed " + candidate.configId()));
        }
        MonitorResult monitor = postDeploymentMonitorService.observe(horizon, monitorProperties.window());
        result.monitor(monitor);
        return finish(switch (monitor.state()) {
            case ROLLED_BACK -> result.outcome(PipelineOutcome.ROLLED_BACK)
                    .detail("rolled back after " + monitor.probeFailures() + " failed probes");
            case ROLLBACK_FAILED -> result.outcome(PipelineOutcome.FAILED)
                    .detail("automatic rollback failed, " + candidate.configId() + " still active");
            case INTERRUPTED -> result.outcome(PipelineOutcome.DEPLOYED)
                    .detail("deployed " + candidate.configId() + ", monitoring interrupted");
            default -> result.outcome(PipelineOutcome.DEPLOYED).detail("deployed " + candidate.configId());
        });
    }

    private PipelineResult finish(PipelineResult.PipelineResultBuilder builder) {
        PipelineResult result = builder.finishedAt(clock.instant()).build();
        try {
            optimizationHistoryService.record(result);
        } catch (RuntimeException e) {
            log.error("event=history_record_failed horizon={} outcome={}", result.horizon(), result.outcome(), e);
        }
        optimizerNotificationService.publish(NotificationType.CYCLE_COMPLETED, result.horizon(),
                result.outcome() + ": " + result.detail());
        log.info("event=pipeline_completed horizon={} outcome={} detail={}",
                result.horizon(), result.outcome(), result.detail());
        return result;
    }
}
