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
import org.nowstart.retune.data.type.PipelineOutcome;
import org.nowstart.retune.data.type.SearchCompletion;

@Entity
@Table(name = "optimization_history", indexes = @Index(name = "idx_optimization_history_horizon", columnList = "horizon"))
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OptimizationHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String horizon;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelineOutcome outcome;

    @Column(updatable = false)
    private boolean success;

    // comma separated trigger reason codes
    @Column(updatable = false)
    private String triggerReasons;

    @Column(updatable = false)
    private boolean searched;

    @Column(updatable = false)
    private String bestConfigId;

    @Column(updatable = false)
    private Double bestPrimaryError;

    @Column(updatable = false)
    private int candidatesEvaluated;

    @Column(updatable = false)
    private int candidatesFailed;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private SearchCompletion searchCompletion;

    @Column(updatable = false)
    private Boolean approved;

    // comma separated criterion codes
    @Column(updatable = false)
    private String rejectionReasons;

    @Column(length = 1000, updatable = false)
    private String detail;

    @Column(nullable = false, updatable = false)
    private Instant startedAt;

    @Column(updatable = false)
    private Instant finishedAt;
}
