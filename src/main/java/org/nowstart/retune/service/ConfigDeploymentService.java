package org.nowstart.retune.service;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.BackupSnapshot;
import org.nowstart.retune.data.dto.DeploymentRecord;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.exception.DeploymentFailedException;
import org.nowstart.retune.data.exception.HorizonBusyException;
import org.nowstart.retune.data.type.NotificationType;
import org.nowstart.retune.repository.ConfigurationSlotRepository;
import org.springframework.stereotype.Service;

/**
 * Swaps configurations into a horizon's active slot and back out again.
 *
 * <p>A deployment runs backup, atomic slot write, ledger append and notification, in that order. If the
 * ledger append fails the slot is restored from the backup taken in the first step before the failure is
 * reported, so the slot and the ledger never disagree. Only one deploy or rollback per horizon may be in
 * flight; a concurrent attempt fails with {@link HorizonBusyException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigDeploymentService {

    static final String MANUAL_ROLLBACK_REASON = "manual rollback";

    private final ConfigurationSlotRepository configurationSlotRepository;
    private final DeploymentLedgerService deploymentLedgerService;
    private final OptimizerNotificationService optimizerNotificationService;
    private final HorizonGuard deploymentGuard = new HorizonGuard();

    public DeploymentRecord deploy(ModelConfiguration candidate) {
        String horizon = candidate.horizon();
        if (!deploymentGuard.tryAcquire(horizon)) {
            log.warn("event=deployment_rejected horizon={} config_id={} reason=busy", horizon, candidate.configId());
            throw HorizonBusyException.deployment(horizon);
        }
        try {
            return deployExclusive(candidate);
        } finally {
            deploymentGuard.release(horizon);
        }
    }

    public DeploymentRecord rollback(String horizon) {
        return rollback(horizon, MANUAL_ROLLBACK_REASON);
    }

    public DeploymentRecord rollback(String horizon, String reason) {
        if (!deploymentGuard.tryAcquire(horizon)) {
            log.warn("event=rollback_rejected horizon={} reason=busy", horizon);
            throw HorizonBusyException.deployment(horizon);
        }
        try {
            return rollbackExclusive(horizon, reason == null || reason.isBlank() ? MANUAL_ROLLBACK_REASON : reason);
        } finally {
            deploymentGuard.release(horizon);
        }
    }

    public boolean isBusy(String horizon) {
        return deploymentGuard.isHeld(horizon);
    }

    private DeploymentRecord deployExclusive(ModelConfiguration candidate) {
        String horizon = candidate.horizon();
        Optional<ModelConfiguration> current;
        BackupSnapshot backup;
        try {
            current = configurationSlotRepository.readActive(horizon);
            backup = configurationSlotRepository.backupActive(horizon).orElse(null);
        } catch (RuntimeException e) {
            log.error("event=deployment_failed horizon={} config_id={} step=backup", horizon, candidate.configId(), e);
            throw new DeploymentFailedException("Backup failed for horizon=" + horizon, e);
        }
        String previousConfigId = current.map(ModelConfiguration::configId).orElse(null);

        try {
            configurationSlotRepository.writeActive(candidate);
        } catch (RuntimeException e) {
            log.error("event=deployment_failed horizon={} config_id={} step=write", horizon, candidate.configId(), e);
            DeploymentFailedException failure = new DeploymentFailedException("Slot write failed for horizon=" + horizon, e);
            compensate(horizon, failure, () -> discardBackup(backup));
            throw failure;
        }

        DeploymentRecord record;
        try {
            record = deploymentLedgerService.recordDeployment(
                    candidate,
                    previousConfigId,
                    backup == null ? null : backup.reference()
            );
        } catch (RuntimeException e) {
            log.error("event=deployment_failed horizon={} config_id={} step=ledger", horizon, candidate.configId(), e);
            DeploymentFailedException failure = new DeploymentFailedException("Ledger append failed for horizon=" + horizon, e);
            compensate(horizon, failure, () -> revertSlot(horizon, backup));
            throw failure;
        }

        log.info("event=deployment_succeeded horizon={} config_id={} previous_config_id={} backup_ref={}",
                horizon, candidate.configId(), previousConfigId, record.backupRef());
        optimizerNotificationService.publish(
                NotificationType.DEPLOYMENT_SUCCEEDED,
                horizon,
                "Deployed " + candidate.configId() + " replacing " + previousConfigId
        );
        return record;
    }

    private DeploymentRecord rollbackExclusive(String horizon, String reason) {
        BackupSnapshot backup = configurationSlotRepository.latestBackup(horizon)
                .orElseThrow(() -> DeploymentFailedException.noBackup(horizon));
        ModelConfiguration restored;
        Optional<ModelConfiguration> deactivated;
        try {
            restored = configurationSlotRepository.readBackup(backup);
            deactivated = configurationSlotRepository.readActive(horizon);
            configurationSlotRepository.restore(backup);
        } catch (RuntimeException e) {
            log.error("event=rollback_failed horizon={} backup_ref={} step=restore", horizon, backup.reference(), e);
            throw new DeploymentFailedException("Restore failed for horizon=" + horizon, e);
        }
        String deactivatedConfigId = deactivated.map(ModelConfiguration::configId).orElse(null);

        DeploymentRecord record;
        try {
            record = deploymentLedgerService.recordRollback(restored, deactivatedConfigId, reason, backup.reference());
        } catch (RuntimeException e) {
            log.error("event=rollback_failed horizon={} backup_ref={} step=ledger", horizon, backup.reference(), e);
            DeploymentFailedException failure = new DeploymentFailedException(
                    "Ledger append failed during rollback for horizon=" + horizon, e);
            compensate(horizon, failure, () -> deactivated.ifPresentOrElse(
                    configurationSlotRepository::writeActive,
                    () -> configurationSlotRepository.clearActive(horizon)
            ));
            throw failure;
        }
        try {
            discardBackup(backup);
        } catch (RuntimeException e) {
            log.warn("event=backup_discard_failed horizon={} backup_ref={}", horizon, backup.reference(), e);
        }

        log.error("event=deployment_rolled_back horizon={} restored_config_id={} deactivated_config_id={} reason={}",
                horizon, restored.configId(), deactivatedConfigId, reason);
        optimizerNotificationService.publish(
                NotificationType.DEPLOYMENT_ROLLED_BACK,
                horizon,
                "Rolled back " + deactivatedConfigId + " to " + restored.configId() + ": " + reason
        );
        return record;
    }

    private void compensate(String horizon, DeploymentFailedException failure, Runnable compensation) {
        try {
            compensation.run();
        } catch (RuntimeException e) {
            log.error("event=compensation_failed horizon={}", horizon, e);
            failure.addSuppressed(e);
        }
    }

    private void revertSlot(String horizon, BackupSnapshot backup) {
        if (backup == null) {
            configurationSlotRepository.clearActive(horizon);
            return;
        }
        configurationSlotRepository.restore(backup);
        discardBackup(backup);
    }

    private void discardBackup(BackupSnapshot backup) {
        if (backup != null) {
            configurationSlotRepository.deleteBackup(backup);
        }
    }
}
