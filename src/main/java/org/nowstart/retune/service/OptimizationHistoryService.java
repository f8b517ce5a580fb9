package org.nowstart.retune.service;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.nowstart.retune.data.dto.OptimizationHistoryDto;
import org.nowstart.retune.data.dto.OptimizationRun;
import org.nowstart.retune.data.dto.PipelineResult;
import org.nowstart.retune.data.entity.OptimizationHistoryEntry;
import org.nowstart.retune.data.type.PipelineOutcome;
import org.nowstart.retune.data.type.TriggerReason;
import org.nowstart.retune.data.type.ValidationCriterion;
import org.nowstart.retune.repository.OptimizationHistoryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class OptimizationHistoryService {

    private final OptimizationHistoryRepository optimizationHistoryRepository;

    @Transactional
    public OptimizationHistoryEntry record(PipelineResult result) {
        OptimizationRun run = result.run();
        OptimizationHistoryEntry.OptimizationHistoryEntryBuilder builder = OptimizationHistoryEntry.builder()
                .horizon(result.horizon())
                .outcome(result.outcome())
                .success(isSuccess(result.outcome()))
                .searched(run != null)
                .detail(truncate(result.detail()))
                .startedAt(result.startedAt())
                .finishedAt(result.finishedAt());

        if (result.trigger() != null) {
            builder.triggerReasons(result.trigger().reasons().stream()
                    .map(TriggerReason::code)
                    .collect(Collectors.joining(",")));
        }
        if (run != null) {
            builder.candidatesEvaluated(run.evaluations().size())
                    .candidatesFailed(run.failures().size())
                    .searchCompletion(run.completion());
            run.best().ifPresent(best -> builder
                    .bestConfigId(best.configId())
                    .bestPrimaryError(best.validationMetrics().primaryError()));
        }
        if (result.validation() != null) {
            builder.approved(result.validation().approved())
                    .rejectionReasons(result.validation().rejectionReasons().stream()
                            .map(ValidationCriterion::code)
                            .collect(Collectors.joining(",")));
        }
        return optimizationHistoryRepository.save(builder.build());
    }

    @Transactional(readOnly = true)
    public List<OptimizationHistoryDto> findHistory(String horizon) {
        return optimizationHistoryRepository.findByHorizonOrderByIdAsc(horizon).stream()
                .map(this::toDto)
                .toList();
    }

    private boolean isSuccess(PipelineOutcome outcome) {
        return outcome == PipelineOutcome.DEPLOYED
                || outcome == PipelineOutcome.DRY_RUN
                || outcome == PipelineOutcome.NO_OP;
    }

    private OptimizationHistoryDto toDto(OptimizationHistoryEntry entry) {
        return new OptimizationHistoryDto(
                entry.getId(),
                entry.getHorizon(),
                entry.getOutcome(),
                entry.isSuccess(),
                split(entry.getTriggerReasons()),
                entry.isSearched(),
                entry.getBestConfigId(),
                entry.getBestPrimaryError(),
                entry.getCandidatesEvaluated(),
                entry.getCandidatesFailed(),
                entry.getSearchCompletion(),
                entry.getApproved(),
                split(entry.getRejectionReasons()),
                entry.getDetail(),
                entry.getStartedAt(),
                entry.getFinishedAt()
        );
    }

    private List<String> split(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(",")).toList();
    }

    private String truncate(String detail) {
        if (detail == null || detail.length() <= 1000) {
            return detail;
        }
        return detail.substring(0, 1000);
    }
}
