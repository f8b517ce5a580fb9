package org.nowstart.retune.service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.BackupSnapshot;
import org.nowstart.retune.data.dto.DeploymentRecord;
import org.nowstart.retune.data.dto.HorizonStatusDto;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.dto.OptimizationHistoryDto;
import org.nowstart.retune.data.exception.OptimizerApiException;
import org.nowstart.retune.repository.ConfigurationSlotRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizerQueryService {

    private final ConfigurationSlotRepository configurationSlotRepository;
    private final DeploymentLedgerService deploymentLedgerService;
    private final OptimizationHistoryService optimizationHistoryService;
    private final OptimizationPipelineService optimizationPipelineService;

    public ModelConfiguration getActiveConfiguration(String horizon) {
        return configurationSlotRepository.readActive(horizon)
                .orElseThrow(() -> new OptimizerApiException(
                        HttpStatus.NOT_FOUND,
                        "configuration_not_found",
                        "No active configuration for horizon=" + horizon
                ));
    }

    public List<DeploymentRecord> getLedger(String horizon) {
        return deploymentLedgerService.findLedger(horizon);
    }

    public List<OptimizationHistoryDto> getHistory(String horizon) {
        return optimizationHistoryService.findHistory(horizon);
    }

    public List<BackupSnapshot> getBackups(String horizon) {
        return configurationSlotRepository.listBackups(horizon);
    }

    /**
     * Compares the active slot with the configuration obtained by replaying the ledger.
     */
    public HorizonStatusDto getStatus(String horizon) {
        String activeConfigId = configurationSlotRepository.readActive(horizon)
                .map(ModelConfiguration::configId)
                .orElse(null);
        List<DeploymentRecord> ledger = deploymentLedgerService.findLedger(horizon);
        String ledgerConfigId = deploymentLedgerService.replayActiveConfigId(horizon).orElse(null);
        Instant lastTransitionAt = ledger.isEmpty() ? null : ledger.get(ledger.size() - 1).deployedAt();
        boolean consistent = Objects.equals(activeConfigId, ledgerConfigId);
        if (!consistent) {
            log.warn("event=slot_ledger_mismatch horizon={} active_config_id={} ledger_config_id={}",
                    horizon, activeConfigId, ledgerConfigId);
        }
        return new HorizonStatusDto(
                horizon,
                activeConfigId,
                ledgerConfigId,
                consistent,
                configurationSlotRepository.listBackups(horizon).size(),
                lastTransitionAt,
                optimizationPipelineService.isRunning(horizon)
        );
    }
}
