package org.nowstart.retune.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.time.Clock;
import java.util.List;
import org.nowstart.retune.data.dto.BackupSnapshot;
import org.nowstart.retune.data.dto.DeploymentRecord;
import org.nowstart.retune.data.dto.HorizonStatusDto;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.dto.OptimizationHistoryDto;
import org.nowstart.retune.data.dto.RollbackRequest;
import org.nowstart.retune.data.dto.RunAcceptedDto;
import org.nowstart.retune.data.dto.RunOptions;
import org.nowstart.retune.service.ConfigDeploymentService;
import org.nowstart.retune.service.OptimizationPipelineService;
import org.nowstart.retune.service.OptimizerQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/optimizer")
@Tag(name = "Optimizer", description = "Active configuration, deployment ledger, on-demand runs and rollback")
public class OptimizerController {

    private static final String HORIZON_REGEX = "[A-Za-z0-9_-]+";
    private static final String HORIZON_MESSAGE = "horizon must match " + HORIZON_REGEX;

    private final OptimizerQueryService optimizerQueryService;
    private final OptimizationPipelineService optimizationPipelineService;
    private final ConfigDeploymentService configDeploymentService;
    private final Clock clock;

    public OptimizerController(
            OptimizerQueryService optimizerQueryService,
            OptimizationPipelineService optimizationPipelineService,
            ConfigDeploymentService configDeploymentService,
            Clock clock
    ) {
        this.optimizerQueryService = optimizerQueryService;
        this.optimizationPipelineService = optimizationPipelineService;
        this.configDeploymentService = configDeploymentService;
        this.clock = clock;
    }

    @GetMapping("/horizons/{horizon}/configuration")
    @Operation(summary = "Active configuration", description = "Returns the configuration currently in the horizon's active slot.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "No configuration deployed yet")
    })
    public ModelConfiguration getActiveConfiguration(
            @PathVariable @Pattern(regexp = HORIZON_REGEX, message = HORIZON_MESSAGE) String horizon
    ) {
        return optimizerQueryService.getActiveConfiguration(horizon);
    }

    @GetMapping("/horizons/{horizon}/status")
    @Operation(summary = "Horizon status", description = "Active slot, ledger replay and backup count for a horizon.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found")
    })
    public HorizonStatusDto getStatus(
            @PathVariable @Pattern(regexp = HORIZON_REGEX, message = HORIZON_MESSAGE) String horizon
    ) {
        return optimizerQueryService.getStatus(horizon);
    }

    @GetMapping("/horizons/{horizon}/ledger")
    @Operation(summary = "Deployment ledger", description = "All deployments and rollbacks of a horizon, oldest first.")
    public List<DeploymentRecord> getLedger(
            @PathVariable @Pattern(regexp = HORIZON_REGEX, message = HORIZON_MESSAGE) String horizon
    ) {
        return optimizerQueryService.getLedger(horizon);
    }

    @GetMapping("/horizons/{horizon}/history")
    @Operation(summary = "Optimization history", description = "Trigger, search and validation outcomes of past runs, oldest first.")
    public List<OptimizationHistoryDto> getHistory(
            @PathVariable @Pattern(regexp = HORIZON_REGEX, message = HORIZON_MESSAGE) String horizon
    ) {
        return optimizerQueryService.getHistory(horizon);
    }

    @GetMapping("/horizons/{horizon}/backups")
    @Operation(summary = "Backups", description = "Backup set of a horizon, newest first.")
    public List<BackupSnapshot> getBackups(
            @PathVariable @Pattern(regexp = HORIZON_REGEX, message = HORIZON_MESSAGE) String horizon
    ) {
        return optimizerQueryService.getBackups(horizon);
    }

    @PostMapping("/horizons/{horizon}/runs")
    @Operation(summary = "Start optimization", description = "Runs the pipeline for one horizon in the background.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Accepted"),
            @ApiResponse(responseCode = "404", description = "Unknown horizon"),
            @ApiResponse(responseCode = "409", description = "A run is already in progress")
    })
    public ResponseEntity<RunAcceptedDto> startRun(
            @PathVariable @Pattern(regexp = HORIZON_REGEX, message = HORIZON_MESSAGE) String horizon,
            @RequestParam(value = "force", defaultValue = "false") boolean force,
            @RequestParam(value = "dryRun", defaultValue = "false") boolean dryRun
    ) {
        optimizationPipelineService.submit(horizon, new RunOptions(force, dryRun));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new RunAcceptedDto(horizon, force, dryRun, clock.instant()));
    }

    @PostMapping("/horizons/{horizon}/rollback")
    @Operation(summary = "Roll back", description = "Restores the most recent backup into the active slot.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rolled back"),
            @ApiResponse(responseCode = "409", description = "No backup available or deployment in progress")
    })
    public DeploymentRecord rollback(
            @PathVariable @Pattern(regexp = HORIZON_REGEX, message = HORIZON_MESSAGE) String horizon,
            @RequestBody(required = false) @Valid RollbackRequest request
    ) {
        return configDeploymentService.rollback(horizon, request == null ? null : request.reason());
    }
}
