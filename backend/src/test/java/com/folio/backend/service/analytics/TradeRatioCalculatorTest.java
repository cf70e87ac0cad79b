package com.folio.backend.service.analytics;

import com.folio.backend.exception.NoOverlapException;
import com.folio.backend.model.PriceBar;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.folio.backend.util.TestPriceBars.START;
import static com.folio.backend.util.TestPriceBars.bar;
import static com.folio.backend.util.TestPriceBars.bars;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TradeRatioCalculatorTest {

    private final TradeRatioCalculator calculator = new TradeRatioCalculator();

    @Test
    void ratioTimesSecondCloseReproducesFirstClose() {
        List<PriceBar> first = bars(100.0, 102.0, 101.0, 104.0);
        List<PriceBar> second = bars(50.0, 51.5, 49.0, 52.0);

        TradeRatioCalculator.Result result = calculator.calculate(first, second, 2);

        Map<LocalDate, PriceBar> firstByDate = first.stream()
                .collect(Collectors.toMap(PriceBar::getDate, Function.identity()));
        for (int i = 0; i < result.points().size(); i++) {
            TradeRatioCalculator.Point point = result.points().get(i);
            assertThat(point.ratio() * second.get(i).getClose())
                    .isCloseTo(firstByDate.get(point.date()).getClose(), within(1e-9));
        }
        assertThat(result.currentRatio()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void movingAverageIsNullUntilWindowFills() {
        List<PriceBar> first = new ArrayList<>();
        List<PriceBar> second = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            first.add(bar(START.plusDays(i), 100.0 + i));
            second.add(bar(START.plusDays(i), 100.0));
        }

        TradeRatioCalculator.Result result = calculator.calculate(first, second, 20);

        assertThat(result.points()).hasSize(25);
        assertThat(result.points().subList(0, 19)).allMatch(point -> point.movingAverage() == null);
        // mean of 1.00 .. 1.19
        assertThat(result.points().get(19).movingAverage()).isCloseTo(1.095, within(1e-12));
        assertThat(result.points().get(24).movingAverage()).isCloseTo(1.145, within(1e-12));
    }

    @Test
    void onlySharedDatesAreCompared() {
        List<PriceBar> first = bars(START, 10.0, 11.0, 12.0, 13.0);
        List<PriceBar> second = bars(START.plusDays(2), 6.0, 6.5, 7.0);

        TradeRatioCalculator.Result result = calculator.calculate(first, second, 20);

        assertThat(result.points()).extracting(TradeRatioCalculator.Point::date)
                .containsExactly(START.plusDays(2), START.plusDays(3));
    }

    @Test
    void zeroDenominatorDatesAreSkipped() {
        TradeRatioCalculator.Result result = calculator.calculate(bars(10.0, 12.0), bars(0.0, 6.0), 1);

        assertThat(result.points()).hasSize(1);
        assertThat(result.currentRatio()).isEqualTo(2.0);
    }

    @Test
    void disjointCalendarsHaveNoOverlap() {
        List<PriceBar> first = bars(START, 10.0, 11.0);
        List<PriceBar> second = bars(START.plusDays(10), 5.0, 6.0);

        assertThatThrownBy(() -> calculator.calculate(first, second, 20))
                .isInstanceOf(NoOverlapException.class);
    }

    @Test
    void zScoreIsZeroForConstantRatio() {
        TradeRatioCalculator.Result result = calculator.calculate(bars(10.0, 20.0, 30.0), bars(5.0, 10.0, 15.0), 20);

        assertThat(result.standardDeviation()).isZero();
        assertThat(result.zScore()).isZero();
        assertThat(result.mean()).isCloseTo(2.0, within(1e-12));
    }
}
