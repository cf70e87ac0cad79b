package com.folio.backend.service;

import com.folio.backend.config.AnalyticsProperties;
import com.folio.backend.exception.DataUnavailableException;
import com.folio.backend.model.ReturnSeries;
import com.folio.backend.service.analytics.ReturnsAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class BenchmarkService {

    private final PriceHistoryService priceHistoryService;
    private final ReturnsAggregator returnsAggregator;
    private final AnalyticsProperties analyticsProperties;

    public String benchmarkTicker() {
        return analyticsProperties.getPerformance().getBenchmarkTicker();
    }

    /**
     * Daily returns of the configured benchmark over the window.
     *
     * @throws DataUnavailableException when the benchmark history cannot be obtained
     */
    public ReturnSeries getBenchmarkHistory(LocalDate start, LocalDate end) {
        ReturnSeries returns = returnsAggregator.toReturns(
                priceHistoryService.getPriceHistory(benchmarkTicker(), start, end));
        if (returns.isEmpty()) {
            throw new DataUnavailableException(benchmarkTicker(), "Benchmark " + benchmarkTicker()
                    + " has fewer than two bars between " + start + " and " + end);
        }
        return returns;
    }
}
