package com.folio.backend.service;

import com.folio.backend.config.AnalyticsProperties;
import com.folio.backend.dto.RatioSeries;
import com.folio.backend.exception.BadRequestException;
import com.folio.backend.model.PriceBar;
import com.folio.backend.service.analytics.TradeRatioCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeRatioService {

    private final PriceHistoryService priceHistoryService;
    private final TradeRatioCalculator ratioCalculator;
    private final MetricsService metricsService;
    private final AnalyticsProperties analyticsProperties;
    private final Clock clock;

    /**
     * Price of {@code tickerA} expressed in units of {@code tickerB} over the
     * last {@code lookbackDays} calendar days.
     *
     * @param lookbackDays window length; the configured default when null
     */
    public RatioSeries ratio(String tickerA, String tickerB, Integer lookbackDays) {
        String first = PriceHistoryService.normalize(tickerA);
        String second = PriceHistoryService.normalize(tickerB);
        int days = lookbackDays != null ? lookbackDays : analyticsProperties.getRatio().getDefaultLookbackDays();
        if (days < 1) {
            throw new BadRequestException("lookbackDays must be positive");
        }
        int window = analyticsProperties.getRatio().getMovingAverageWindow();
        LocalDate end = LocalDate.now(clock);
        LocalDate start = end.minusDays(days);

        return metricsService.timeReport("ratio", () -> {
            List<PriceBar> barsA = priceHistoryService.getPriceHistory(first, start, end);
            List<PriceBar> barsB = priceHistoryService.getPriceHistory(second, start, end);
            TradeRatioCalculator.Result result = ratioCalculator.calculate(barsA, barsB, window);
            log.debug("Ratio {}/{} over {} shared dates", first, second, result.points().size());
            return RatioSeries.builder()
                    .tickerA(first)
                    .tickerB(second)
                    .startDate(start)
                    .endDate(end)
                    .movingAverageWindow(window)
                    .currentRatio(result.currentRatio())
                    .mean(result.mean())
                    .standardDeviation(result.standardDeviation())
                    .zScore(result.zScore())
                    .points(result.points().stream()
                            .map(p -> new RatioSeries.RatioPoint(p.date(), p.ratio(), p.movingAverage()))
                            .toList())
                    .build();
        });
    }
}
