package com.folio.backend.service.analytics;

import com.folio.backend.model.ReturnSeries;
import org.junit.jupiter.api.Test;

import static com.folio.backend.util.TestPriceBars.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskMetricsCalculatorTest {

    private final RiskMetricsCalculator calculator = new RiskMetricsCalculator();
    private final ReturnSeries sample = series(0.01, -0.02, 0.03, -0.01, 0.02);

    @Test
    void valueAtRiskInterpolatesBetweenOrderStatistics() {
        assertThat(calculator.valueAtRisk(sample, 0.95)).isCloseTo(-0.018, within(1e-12));
        assertThat(calculator.valueAtRisk(sample, 0.99)).isCloseTo(-0.0196, within(1e-12));
    }

    @Test
    void conditionalValueAtRiskNeverExceedsValueAtRisk() {
        for (double confidence : new double[]{0.9, 0.95, 0.99}) {
            assertThat(calculator.conditionalValueAtRisk(sample, confidence))
                    .isLessThanOrEqualTo(calculator.valueAtRisk(sample, confidence));
        }
        assertThat(calculator.conditionalValueAtRisk(sample, 0.95)).isCloseTo(-0.02, within(1e-12));
    }

    @Test
    void tailAveragesEveryReturnAtOrBelowCutoff() {
        ReturnSeries wide = series(-0.05, -0.04, -0.01, 0.0, 0.01, 0.02, 0.02, 0.03, 0.03, 0.04);

        double var = calculator.valueAtRisk(wide, 0.8);
        assertThat(var).isCloseTo(-0.04 + 0.8 * 0.03, within(1e-12));
        assertThat(calculator.conditionalValueAtRisk(wide, 0.8)).isCloseTo(-0.045, within(1e-12));
    }

    @Test
    void emptySeriesHasZeroTailRisk() {
        assertThat(calculator.valueAtRisk(ReturnSeries.empty(), 0.95)).isZero();
        assertThat(calculator.conditionalValueAtRisk(ReturnSeries.empty(), 0.99)).isZero();
    }

    @Test
    void trackingErrorIsZeroAgainstItself() {
        assertThat(calculator.trackingError(sample, sample)).isZero();
    }

    @Test
    void trackingErrorUsesSharedDatesOnly() {
        ReturnSeries benchmark = series(0.0, 0.0, 0.0);
        double expected = Math.sqrt(0.0019 / 3) * Math.sqrt(252);

        assertThat(calculator.trackingError(sample, benchmark)).isCloseTo(expected, within(1e-12));
    }
}
