package org.nowstart.retune.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.DriftSignal;
import org.nowstart.retune.data.dto.PerformanceSnapshot;
import org.nowstart.retune.data.dto.TriggerReport;
import org.nowstart.retune.data.entity.OptimizationHistoryEntry;
import org.nowstart.retune.data.exception.SignalUnavailableException;
import org.nowstart.retune.data.property.TriggerProperties;
import org.nowstart.retune.data.type.DriftSeverity;
import org.nowstart.retune.data.type.TriggerReason;
import org.nowstart.retune.repository.OptimizationHistoryRepository;
import org.nowstart.retune.service.signal.DriftDetector;
import org.nowstart.retune.service.signal.PerformanceMonitor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class OptimizationTriggerService {

    private final PerformanceMonitor performanceMonitor;
    private final DriftDetector driftDetector;
    private final OptimizationHistoryRepository optimizationHistoryRepository;
    private final TriggerProperties triggerProperties;
    private final Clock clock;

    public TriggerReport evaluate(String horizon) {
        Instant now = clock.instant();
        List<TriggerReason> reasons = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int computedCriteria = 0;

        Double degradationPct = null;
        try {
            degradationPct = degradationPct(horizon, performanceMonitor.fetch(horizon));
            computedCriteria++;
            if (degradationPct >= triggerProperties.degradationThresholdPct()) {
                reasons.add(TriggerReason.PERFORMANCE_DEGRADATION);
            }
        } catch (RuntimeException e) {
            warnings.add("performance signal unavailable: " + e.getMessage());
            log.warn("event=trigger_signal_unavailable horizon={} signal=performance", horizon, e);
        }

        Double driftPValue = null;
        DriftSeverity driftSeverity = null;
        try {
            DriftSignal drift = requireDrift(horizon, driftDetector.detect(horizon));
            driftPValue = drift.pValue();
            driftSeverity = drift.severity();
            computedCriteria++;
            if (driftPValue < triggerProperties.driftPValueThreshold()
                    && driftSeverity.isAtLeast(triggerProperties.minDriftSeverity())) {
                reasons.add(TriggerReason.DATA_DRIFT);
            }
        } catch (RuntimeException e) {
            warnings.add("drift signal unavailable: " + e.getMessage());
            log.warn("event=trigger_signal_unavailable horizon={} signal=drift", horizon, e);
        }

        Long daysSinceLast = null;
        Optional<OptimizationHistoryEntry> lastSearch = optimizationHistoryRepository
                .findTopByHorizonAndSearchedTrueOrderByStartedAtDesc(horizon);
        if (lastSearch.isPresent()) {
            Duration elapsed = Duration.between(lastSearch.get().getStartedAt(), now);
            daysSinceLast = elapsed.toDays();
            computedCriteria++;
            if (elapsed.compareTo(triggerProperties.fallbackInterval()) >= 0) {
                reasons.add(TriggerReason.TIME_FALLBACK);
            }
        } else if (computedCriteria > 0) {
            // horizon was never searched
            reasons.add(TriggerReason.INITIAL_OPTIMIZATION);
        } else {
            warnings.add("no optimization history");
        }

        boolean skipped = computedCriteria == 0;
        boolean shouldOptimize = !skipped && !reasons.isEmpty();
        TriggerReport report = new TriggerReport(
                horizon,
                shouldOptimize,
                List.copyOf(reasons),
                now,
                degradationPct,
                driftPValue,
                driftSeverity,
                daysSinceLast,
                List.copyOf(warnings),
                skipped
        );

        log.info(
                "event=trigger_evaluated horizon={} should_optimize={} reasons={} degradation_pct={} drift_p_value={} drift_severity={} days_since_last={} skipped={} warnings={}",
                horizon,
                shouldOptimize,
                reasons,
                degradationPct,
                driftPValue,
                driftSeverity,
                daysSinceLast,
                skipped,
                warnings.size()
        );
        return report;
    }

    private double degradationPct(String horizon, PerformanceSnapshot snapshot) {
        if (snapshot == null || snapshot.recentError() == null || snapshot.baselineError() == null) {
            throw new SignalUnavailableException("performance", horizon, "missing error values");
        }
        double baseline = snapshot.baselineError();
        double recent = snapshot.recentError();
        if (!Double.isFinite(baseline) || !Double.isFinite(recent) || baseline <= 0.0) {
            throw new SignalUnavailableException("performance", horizon, "baseline error must be positive");
        }
        return (recent - baseline) / baseline * 100.0;
    }

    private DriftSignal requireDrift(String horizon, DriftSignal drift) {
        if (drift == null || drift.pValue() == null || drift.severity() == null || !Double.isFinite(drift.pValue())) {
            throw new SignalUnavailableException("drift", horizon, "missing p-value or severity");
        }
        return drift;
    }
}
