package org.nowstart.retune.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.nowstart.retune.data.dto.CriterionResult;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.Hyperparameters;
import org.nowstart.retune.data.dto.ModelConfiguration;
import org.nowstart.retune.data.dto.ValidationReport;
import org.nowstart.retune.data.property.ValidationProperties;
import org.nowstart.retune.data.type.ValidationCriterion;

class ConfigValidationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private final ConfigValidationService service = new ConfigValidationService(
            new ValidationProperties(5.0, 3.0, 10.0, 50.0, 0.90, 5.0),
            Clock.fixed(NOW, ZoneOffset.UTC)
    );

    @Test
    void validate_approvesCandidateThatImprovesOnEveryCriterion() {
        ModelConfiguration baseline = configuration(metrics(10.0, 8.0, 2.0, 100.0, 0.92, 1.0));
        ModelConfiguration candidate = configuration(metrics(9.0, 7.9, 2.1, 120.0, 0.93, 2.0));

        ValidationReport report = service.validate(candidate, baseline);

        assertThat(report.approved()).isTrue();
        assertThat(report.rejectionReasons()).isEmpty();
        assertThat(report.results()).hasSize(5).allMatch(CriterionResult::passed);
        assertThat(report.validatedAt()).isEqualTo(NOW);
        CriterionResult accuracy = report.results().get(0);
        assertThat(accuracy.criterion()).isEqualTo(ValidationCriterion.ACCURACY);
        assertThat(accuracy.observed()).isCloseTo(10.0, within(1e-9));
        assertThat(accuracy.margin()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void validate_rejectsOnCoverageOnlyWhenCoverageBelowMinimum() {
        ModelConfiguration baseline = configuration(metrics(10.0, 8.0, 2.0, 100.0, 0.92, 1.0));
        ModelConfiguration candidate = configuration(metrics(9.0, 7.9, 2.1, 120.0, 0.85, 2.0));

        ValidationReport report = service.validate(candidate, baseline);

        assertThat(report.approved()).isFalse();
        assertThat(report.rejectionReasons()).containsExactly(ValidationCriterion.COVERAGE);
    }

    @Test
    void validate_acceptsSecondaryImprovementWhenPrimaryImprovementTooSmall() {
        ModelConfiguration baseline = configuration(metrics(10.0, 10.0, 2.0, 100.0, 0.92, 1.0));
        ModelConfiguration candidate = configuration(metrics(9.8, 9.6, 2.0, 100.0, 0.92, 1.0));

        ValidationReport report = service.validate(candidate, baseline);

        assertThat(report.approved()).isTrue();
    }

    @Test
    void validate_neverApprovesWhenNeitherErrorImprovesEnough() {
        ModelConfiguration baseline = configuration(metrics(10.0, 10.0, 2.0, 100.0, 0.99, 0.0));
        ModelConfiguration candidate = configuration(metrics(9.6, 9.8, 1.0, 50.0, 0.99, 0.0));

        ValidationReport report = service.validate(candidate, baseline);

        assertThat(report.approved()).isFalse();
        assertThat(report.rejectionReasons()).containsExactly(ValidationCriterion.ACCURACY);
    }

    @Test
    void validate_rejectsStabilityAndLatencyRegressions() {
        ModelConfiguration baseline = configuration(metrics(10.0, 8.0, 2.0, 100.0, 0.92, 1.0));
        ModelConfiguration candidate = configuration(metrics(9.0, 7.0, 2.4, 160.0, 0.92, 1.0));

        ValidationReport report = service.validate(candidate, baseline);

        assertThat(report.rejectionReasons())
                .containsExactly(ValidationCriterion.STABILITY, ValidationCriterion.LATENCY);
    }

    @Test
    void validate_acceptsPrimaryImprovementExactlyAtMinimum() {
        ModelConfiguration baseline = configuration(metrics(3.0, 3.0, 2.0, 100.0, 0.92, 1.0));
        ModelConfiguration candidate = configuration(metrics(2.85, 2.95, 2.0, 100.0, 0.92, 1.0));

        ValidationReport report = service.validate(candidate, baseline);

        CriterionResult accuracy = report.results().get(0);
        assertThat(accuracy.observed()).isEqualTo(5.0);
        assertThat(accuracy.margin()).isEqualTo(0.0);
        assertThat(accuracy.passed()).isTrue();
        assertThat(report.approved()).isTrue();
    }

    @Test
    void validate_acceptsStdDevIncreaseExactlyAtMaximum() {
        ModelConfiguration baseline = configuration(metrics(10.0, 10.0, 1.0, 100.0, 0.92, 1.0));
        ModelConfiguration candidate = configuration(metrics(9.0, 9.0, 1.1, 100.0, 0.92, 1.0));

        ValidationReport report = service.validate(candidate, baseline);

        CriterionResult stability = report.results().get(1);
        assertThat(stability.criterion()).isEqualTo(ValidationCriterion.STABILITY);
        assertThat(stability.observed()).isEqualTo(10.0);
        assertThat(stability.passed()).isTrue();
        assertThat(stability.detail()).isEqualTo("increase_pct=10.00 (max 10.00)");
        assertThat(report.approved()).isTrue();
    }

    @Test
    void validate_biasThresholdIsExclusive() {
        ModelConfiguration candidate = configuration(metrics(9.0, 7.0, 2.0, 100.0, 0.95, -5.0));

        ValidationReport report = service.validate(candidate, null);

        assertThat(report.rejectionReasons()).containsExactly(ValidationCriterion.BIAS);
    }

    @Test
    void validate_withoutBaselineDependsOnlyOnCoverageAndBias() {
        ModelConfiguration passing = configuration(metrics(50.0, null, 30.0, 9000.0, 0.91, 4.9));
        ModelConfiguration failing = configuration(metrics(1.0, 1.0, 0.1, 1.0, 0.89, 0.0));

        ValidationReport passed = service.validate(passing, null);
        ValidationReport rejected = service.validate(failing, null);

        assertThat(passed.approved()).isTrue();
        assertThat(passed.results().subList(0, 3))
                .allSatisfy(result -> {
                    assertThat(result.passed()).isTrue();
                    assertThat(result.detail()).isEqualTo(ConfigValidationService.NO_BASELINE);
                });
        assertThat(rejected.rejectionReasons()).containsExactly(ValidationCriterion.COVERAGE);
    }

    @Test
    void validate_failsClosedWhenValuesCannotBeComputed() {
        ModelConfiguration baseline = configuration(metrics(0.0, null, 0.0, null, 0.92, 1.0));
        ModelConfiguration candidate = configuration(metrics(9.0, 7.0, 2.0, 100.0, null, Double.NaN));

        ValidationReport report = service.validate(candidate, baseline);

        assertThat(report.approved()).isFalse();
        assertThat(report.rejectionReasons()).containsExactly(
                ValidationCriterion.ACCURACY,
                ValidationCriterion.STABILITY,
                ValidationCriterion.LATENCY,
                ValidationCriterion.COVERAGE,
                ValidationCriterion.BIAS
        );
        assertThat(report.results())
                .allSatisfy(result -> assertThat(result.detail()).isEqualTo(ConfigValidationService.INSUFFICIENT_DATA));
    }

    private ForecastMetrics metrics(
            Double primary,
            Double secondary,
            Double stdDev,
            Double latency,
            Double coverage,
            Double bias
    ) {
        return new ForecastMetrics(primary, secondary, primary, stdDev, latency, coverage, bias);
    }

    private ModelConfiguration configuration(ForecastMetrics metrics) {
        return ModelConfiguration.create("7d", new Hyperparameters(180, 100, 1.0), metrics, 27, NOW);
    }
}
