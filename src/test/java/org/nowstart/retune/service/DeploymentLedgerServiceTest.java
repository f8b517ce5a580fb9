package org.nowstart.retune.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.retune.data.dto.DeploymentRecord;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.Hyperparameters;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.entity.ConfigVersion;
import org.nowstart.retune.data.entity.DeploymentLedgerEntry;
import org.nowstart.retune.data.type.ConfigStatus;
import org.nowstart.retune.data.type.DeploymentAction;
import org.nowstart.retune.data.type.DeploymentOutcome;
import org.nowstart.retune.repository.ConfigVersionRepository;
import org.nowstart.retune.repository.DeploymentLedgerRepository;

@ExtendWith(MockitoExtension.class)
class DeploymentLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-15T00:00:00Z");

    @Mock
    private DeploymentLedgerRepository deploymentLedgerRepository;
    @Mock
    private ConfigVersionRepository configVersionRepository;

    private DeploymentLedgerService service;

    @BeforeEach
    void setUp() {
        service = new DeploymentLedgerService(
                deploymentLedgerRepository,
                configVersionRepository,
                new ObjectMapper().findAndRegisterModules(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void recordDeployment_archivesConfigurationAndSupersedesPrevious() {
        ModelConfiguration deployed = configuration(180);
        ConfigVersion previous = ConfigVersion.builder()
                .configId("7d-old")
                .horizon("7d")
                .status(ConfigStatus.ACTIVE)
                .build();
        when(configVersionRepository.findByConfigId(deployed.configId())).thenReturn(Optional.empty());
        when(configVersionRepository.findByConfigId("7d-old")).thenReturn(Optional.of(previous));
        when(deploymentLedgerRepository.save(any(DeploymentLedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DeploymentRecord record = service.recordDeployment(deployed, "7d-old", "0000000001_1_7d-old.json");

        assertThat(record.action()).isEqualTo(DeploymentAction.DEPLOY);
        assertThat(record.outcome()).isEqualTo(DeploymentOutcome.DEPLOYED);
        assertThat(record.deployedConfigId()).isEqualTo(deployed.configId());
        assertThat(record.previousConfigId()).isEqualTo("7d-old");
        assertThat(record.deployedAt()).isEqualTo(NOW);
        assertThat(previous.getStatus()).isEqualTo(ConfigStatus.SUPERSEDED);

        ArgumentCaptor<ConfigVersion> versions = ArgumentCaptor.forClass(ConfigVersion.class);
        verify(configVersionRepository, times(2)).save(versions.capture());
        ConfigVersion archived = versions.getAllValues().get(0);
        assertThat(archived.getStatus()).isEqualTo(ConfigStatus.ACTIVE);
        assertThat(archived.getActivatedBy()).isEqualTo("deployment");
        assertThat(archived.getPayload()).contains(deployed.configId());
    }

    @Test
    void recordRollback_marksDeactivatedConfiguration() {
        ModelConfiguration restored = configuration(90);
        ConfigVersion restoredVersion = ConfigVersion.builder()
                .configId(restored.configId())
                .horizon("7d")
                .status(ConfigStatus.SUPERSEDED)
                .build();
        ConfigVersion bad = ConfigVersion.builder()
                .configId("7d-bad")
                .horizon("7d")
                .status(ConfigStatus.ACTIVE)
                .build();
        when(configVersionRepository.findByConfigId(restored.configId())).thenReturn(Optional.of(restoredVersion));
        when(configVersionRepository.findByConfigId("7d-bad")).thenReturn(Optional.of(bad));
        when(deploymentLedgerRepository.save(any(DeploymentLedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DeploymentRecord record = service.recordRollback(restored, "7d-bad", "probe failures", "ref");

        assertThat(record.action()).isEqualTo(DeploymentAction.ROLLBACK);
        assertThat(record.rollbackReason()).isEqualTo("probe failures");
        assertThat(restoredVersion.getStatus()).isEqualTo(ConfigStatus.ACTIVE);
        assertThat(restoredVersion.getActivatedBy()).isEqualTo("rollback");
        assertThat(bad.getStatus()).isEqualTo(ConfigStatus.ROLLED_BACK);
    }

    @Test
    void replayActiveConfigId_followsInsertionOrder() {
        when(deploymentLedgerRepository.findByHorizonOrderByIdAsc("7d")).thenReturn(List.of(
                entry(1L, DeploymentAction.DEPLOY, "a", null),
                entry(2L, DeploymentAction.DEPLOY, "b", "a"),
                entry(3L, DeploymentAction.ROLLBACK, "a", "b")
        ));
        when(deploymentLedgerRepository.findByHorizonOrderByIdAsc("30d")).thenReturn(List.of());

        assertThat(service.replayActiveConfigId("7d")).contains("a");
        assertThat(service.replayActiveConfigId("30d")).isEmpty();
    }

    @Test
    void findLedger_mapsEntriesToRecords() {
        when(deploymentLedgerRepository.findByHorizonOrderByIdAsc("7d"))
                .thenReturn(List.of(entry(7L, DeploymentAction.DEPLOY, "a", null)));

        assertThat(service.findLedger("7d")).singleElement()
                .satisfies(record -> {
                    assertThat(record.sequence()).isEqualTo(7L);
                    assertThat(record.deployedConfigId()).isEqualTo("a");
                });
    }

    private DeploymentLedgerEntry entry(Long id, DeploymentAction action, String deployed, String previous) {
        return DeploymentLedgerEntry.builder()
                .id(id)
                .horizon("7d")
                .action(action)
                .deployedConfigId(deployed)
                .previousConfigId(previous)
                .outcome(action == DeploymentAction.DEPLOY ? DeploymentOutcome.DEPLOYED : DeploymentOutcome.ROLLED_BACK)
                .deployedAt(NOW)
                .build();
    }

    private ModelConfiguration configuration(int contextLength) {
        return ModelConfiguration.create("7d", new Hyperparameters(contextLength, 100, 1.0),
                new ForecastMetrics(9.0, 7.0, 9.0, 2.0, 120.0, 0.93, 0.4), 27, NOW);
    }
}
