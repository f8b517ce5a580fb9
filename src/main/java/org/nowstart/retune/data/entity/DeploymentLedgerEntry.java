package org.nowstart.retune.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.nowstart.retune.data.type.DeploymentAction;
import org.nowstart.retune.data.type.DeploymentOutcome;

@Entity
@Table(name = "deployment_ledger", indexes = @Index(name = "idx_deployment_ledger_horizon", columnList = "horizon"))
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeploymentLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String horizon;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private DeploymentAction action;

    @Column(nullable = false, updatable = false)
    private String deployedConfigId;

    @Column(updatable = false)
    private String previousConfigId;

    @Column(updatable = false)
    private String backupRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private DeploymentOutcome outcome;

    @Column(length = 500, updatable = false)
    private String rollbackReason;

    @Column(nullable = false, updatable = false)
    private Instant deployedAt;
}
