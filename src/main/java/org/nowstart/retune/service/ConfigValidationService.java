package org.nowstart.retune.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.CriterionResult;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.dto.ValidationReport;
import org.nowstart.retune.data.property.ValidationProperties;
import org.nowstart.retune.data.type.ValidationCriterion;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Gates a candidate against the active baseline on five critical criteria. Approval requires all five.
 * Without a baseline the relative criteria (accuracy, stability, latency) pass; coverage and bias are
 * always enforced. A value that cannot be computed fails its criterion.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class ConfigValidationService {

    static final String NO_BASELINE = "no baseline";
    static final String INSUFFICIENT_DATA = "insufficient data";

    private static final int PCT_SCALE = 12;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ValidationProperties validationProperties;
    private final Clock clock;

    public ValidationReport validate(ModelConfiguration candidate, ModelConfiguration baseline) {
        ForecastMetrics current = candidate.validationMetrics();
        ForecastMetrics previous = baseline == null ? null : baseline.validationMetrics();

        List<CriterionResult> results = List.of(
                accuracy(current, previous, baseline != null),
                relativeIncrease(ValidationCriterion.STABILITY,
                        value(current, Metric.STD_DEV), value(previous, Metric.STD_DEV),
                        validationProperties.maxStdDevIncreasePct(), baseline != null),
                relativeIncrease(ValidationCriterion.LATENCY,
                        value(current, Metric.LATENCY), value(previous, Metric.LATENCY),
                        validationProperties.maxLatencyIncreasePct(), baseline != null),
                coverage(current),
                bias(current)
        );

        List<ValidationCriterion> rejectionReasons = new ArrayList<>();
        for (CriterionResult result : results) {
            if (!result.passed()) {
                rejectionReasons.add(result.criterion());
            }
        }
        boolean approved = rejectionReasons.isEmpty();

        log.info("event=validation_completed horizon={} candidate={} baseline={} approved={} rejection_reasons={}",
                candidate.horizon(),
                candidate.configId(),
                baseline == null ? null : baseline.configId(),
                approved,
                rejectionReasons);
        return new ValidationReport(
                candidate,
                baseline,
                results,
                approved,
                List.copyOf(rejectionReasons),
                clock.instant()
        );
    }

    private CriterionResult accuracy(ForecastMetrics current, ForecastMetrics previous, boolean hasBaseline) {
        double primaryThreshold = validationProperties.minPrimaryImprovementPct();
        if (!hasBaseline) {
            return new CriterionResult(ValidationCriterion.ACCURACY, null, primaryThreshold, true, null, NO_BASELINE);
        }
        Double previousPrimary = value(previous, Metric.PRIMARY);
        Double previousSecondary = value(previous, Metric.SECONDARY);
        BigDecimal primary = changePct(previousPrimary, value(current, Metric.PRIMARY), previousPrimary);
        BigDecimal secondary = changePct(previousSecondary, value(current, Metric.SECONDARY), previousSecondary);
        if (primary == null && secondary == null) {
            return new CriterionResult(ValidationCriterion.ACCURACY, null, primaryThreshold, false, null, INSUFFICIENT_DATA);
        }

        BigDecimal primaryMin = BigDecimal.valueOf(primaryThreshold);
        BigDecimal secondaryMin = BigDecimal.valueOf(validationProperties.minSecondaryImprovementPct());
        boolean primaryPassed = primary != null && primary.compareTo(primaryMin) >= 0;
        boolean secondaryPassed = secondary != null && secondary.compareTo(secondaryMin) >= 0;
        String detail = String.format(Locale.ROOT,
                "primary_improvement_pct=%s (min %.2f) secondary_improvement_pct=%s (min %.2f)",
                format(primary), primaryThreshold, format(secondary), validationProperties.minSecondaryImprovementPct());
        Double margin = primary == null ? null : primary.subtract(primaryMin).doubleValue();
        if (!primaryPassed && secondaryPassed) {
            margin = secondary.subtract(secondaryMin).doubleValue();
        }
        return new CriterionResult(
                ValidationCriterion.ACCURACY,
                (primary != null ? primary : secondary).doubleValue(),
                primaryThreshold,
                primaryPassed || secondaryPassed,
                margin,
                detail
        );
    }

    private CriterionResult relativeIncrease(
            ValidationCriterion criterion,
            Double current,
            Double previous,
            double maxIncreasePct,
            boolean hasBaseline
    ) {
        if (!hasBaseline) {
            return new CriterionResult(criterion, null, maxIncreasePct, true, null, NO_BASELINE);
        }
        BigDecimal increase = changePct(current, previous, previous);
        if (increase == null) {
            return new CriterionResult(criterion, null, maxIncreasePct, false, null, INSUFFICIENT_DATA);
        }
        BigDecimal max = BigDecimal.valueOf(maxIncreasePct);
        return new CriterionResult(
                criterion,
                increase.doubleValue(),
                maxIncreasePct,
                increase.compareTo(max) <= 0,
                max.subtract(increase).doubleValue(),
                String.format(Locale.ROOT, "increase_pct=%s (max %.2f)", format(increase), maxIncreasePct)
        );
    }

    private CriterionResult coverage(ForecastMetrics current) {
        double minCoverage = validationProperties.minCoverage();
        Double coverage = value(current, Metric.COVERAGE);
        if (coverage == null) {
            return new CriterionResult(ValidationCriterion.COVERAGE, null, minCoverage, false, null, INSUFFICIENT_DATA);
        }
        return new CriterionResult(
                ValidationCriterion.COVERAGE,
                coverage,
                minCoverage,
                coverage >= minCoverage,
                coverage - minCoverage,
                String.format(Locale.ROOT, "ci95_coverage=%.4f (min %.4f)", coverage, minCoverage)
        );
    }

    private CriterionResult bias(ForecastMetrics current) {
        double maxAbsBias = validationProperties.maxAbsBias();
        Double bias = value(current, Metric.BIAS);
        if (bias == null) {
            return new CriterionResult(ValidationCriterion.BIAS, null, maxAbsBias, false, null, INSUFFICIENT_DATA);
        }
        double absBias = Math.abs(bias);
        return new CriterionResult(
                ValidationCriterion.BIAS,
                bias,
                maxAbsBias,
                absBias < maxAbsBias,
                maxAbsBias - absBias,
                String.format(Locale.ROOT, "abs_mean_signed_error=%.4f (max %.4f, exclusive)", absBias, maxAbsBias)
        );
    }

    // (from - to) / reference * 100 in decimal so thresholds hold exactly at the boundary
    private BigDecimal changePct(Double from, Double to, Double reference) {
        if (from == null || to == null || reference == null || reference <= 0.0) {
            return null;
        }
        return BigDecimal.valueOf(from)
                .subtract(BigDecimal.valueOf(to))
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(reference), PCT_SCALE, RoundingMode.HALF_UP);
    }

    private Double value(ForecastMetrics metrics, Metric metric) {
        if (metrics == null) {
            return null;
        }
        Double value = switch (metric) {
            case PRIMARY -> metrics.primaryError();
            case SECONDARY -> metrics.secondaryError();
            case STD_DEV -> metrics.stdDev();
            case LATENCY -> metrics.latencyMillis();
            case COVERAGE -> metrics.ci95Coverage();
            case BIAS -> metrics.meanSignedError();
        };
        return value == null || !Double.isFinite(value) ? null : value;
    }

    private String format(BigDecimal value) {
        return value == null ? "n/a" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private enum Metric {
        PRIMARY,
        SECONDARY,
        STD_DEV,
        LATENCY,
        COVERAGE,
        BIAS
    }
}
