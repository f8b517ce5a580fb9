package org.nowstart.retune.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.DeploymentRecord;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.entity.ConfigVersion;
import org.nowstart.retune.data.entity.DeploymentLedgerEntry;
import org.nowstart.retune.data.type.ConfigStatus;
import org.nowstart.retune.data.type.DeploymentAction;
import org.nowstart.retune.data.type.DeploymentOutcome;
import org.nowstart.retune.repository.ConfigVersionRepository;
import org.nowstart.retune.repository.DeploymentLedgerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentLedgerService {

    static final String ACTIVATED_BY_DEPLOYMENT = "deployment";
    static final String ACTIVATED_BY_ROLLBACK = "rollback";

    private final DeploymentLedgerRepository deploymentLedgerRepository;
    private final ConfigVersionRepository configVersionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public DeploymentRecord recordDeployment(ModelConfiguration deployed, String previousConfigId, String backupRef) {
        Instant now = clock.instant();
        archive(deployed, ACTIVATED_BY_DEPLOYMENT, now);
        markStatus(previousConfigId, ConfigStatus.SUPERSEDED);

        DeploymentLedgerEntry entry = deploymentLedgerRepository.save(DeploymentLedgerEntry.builder()
                .horizon(deployed.horizon())
                .action(DeploymentAction.DEPLOY)
                .deployedConfigId(deployed.configId())
                .previousConfigId(previousConfigId)
                .backupRef(backupRef)
                .outcome(DeploymentOutcome.DEPLOYED)
                .deployedAt(now)
                .build());
        return toRecord(entry);
    }

    @Transactional
    public DeploymentRecord recordRollback(
            ModelConfiguration restored,
            String deactivatedConfigId,
            String reason,
            String backupRef
    ) {
        Instant now = clock.instant();
        archive(restored, ACTIVATED_BY_ROLLBACK, now);
        markStatus(deactivatedConfigId, ConfigStatus.ROLLED_BACK);

        DeploymentLedgerEntry entry = deploymentLedgerRepository.save(DeploymentLedgerEntry.builder()
                .horizon(restored.horizon())
                .action(DeploymentAction.ROLLBACK)
                .deployedConfigId(restored.configId())
                .previousConfigId(deactivatedConfigId)
                .backupRef(backupRef)
                .outcome(DeploymentOutcome.ROLLED_BACK)
                .rollbackReason(reason)
                .deployedAt(now)
                .build());
        return toRecord(entry);
    }

    @Transactional(readOnly = true)
    public List<DeploymentRecord> findLedger(String horizon) {
        return deploymentLedgerRepository.findByHorizonOrderByIdAsc(horizon).stream()
                .map(DeploymentLedgerService::toRecord)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<String> replayActiveConfigId(String horizon) {
        String active = null;
        for (DeploymentLedgerEntry entry : deploymentLedgerRepository.findByHorizonOrderByIdAsc(horizon)) {
            active = entry.getDeployedConfigId();
        }
        return Optional.ofNullable(active);
    }

    private void archive(ModelConfiguration configuration, String activatedBy, Instant now) {
        ConfigVersion version = configVersionRepository.findByConfigId(configuration.configId())
                .orElseGet(() -> ConfigVersion.builder()
                        .configId(configuration.configId())
                        .horizon(configuration.horizon())
                        .payload(toJson(configuration))
                        .build());
        version.setStatus(ConfigStatus.ACTIVE);
        version.setActivatedBy(activatedBy);
        version.setActivatedAt(now);
        configVersionRepository.save(version);
    }

    private void markStatus(String configId, ConfigStatus status) {
        if (configId == null) {
            return;
        }
        configVersionRepository.findByConfigId(configId).ifPresentOrElse(
                version -> {
                    version.setStatus(status);
                    configVersionRepository.save(version);
                },
                () -> log.warn("event=config_version_missing config_id={} status={}", configId, status)
        );
    }

    private String toJson(ModelConfiguration configuration) {
        try {
            return objectMapper.writeValueAsString(configuration);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration " + configuration.configId(), e);
        }
    }

    static DeploymentRecord toRecord(DeploymentLedgerEntry entry) {
        return new DeploymentRecord(
                entry.getId(),
                entry.getHorizon(),
                entry.getAction(),
                entry.getDeployedConfigId(),
                entry.getPreviousConfigId(),
                entry.getBackupRef(),
                entry.getDeployedAt(),
                entry.getOutcome(),
                entry.getRollbackReason()
        );
    }
}
