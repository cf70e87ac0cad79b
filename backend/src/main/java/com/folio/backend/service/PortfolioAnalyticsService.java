package com.folio.backend.service;

import com.folio.backend.config.AnalyticsProperties;
import com.folio.backend.dto.PerformanceReport;
import com.folio.backend.dto.PortfolioMetrics;
import com.folio.backend.dto.PositionBreakdown;
import com.folio.backend.dto.RiskMetrics;
import com.folio.backend.exception.InsufficientDataException;
import com.folio.backend.model.MetricValue;
import com.folio.backend.model.PortfolioSnapshot;
import com.folio.backend.model.Position;
import com.folio.backend.model.PriceBar;
import com.folio.backend.model.ReturnSeries;
import com.folio.backend.service.analytics.PerformanceMetricsCalculator;
import com.folio.backend.service.analytics.ReturnsAggregator;
import com.folio.backend.service.analytics.RiskMetricsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the performance report of one portfolio: constituent histories are
 * fetched in parallel, combined into a weighted return series and measured
 * against the benchmark when it is available.
 */
@Slf4j
@Service
public class PortfolioAnalyticsService {

    private final PortfolioService portfolioService;
    private final PriceHistoryService priceHistoryService;
    private final BenchmarkService benchmarkService;
    private final ReturnsAggregator returnsAggregator;
    private final PerformanceMetricsCalculator performanceCalculator;
    private final RiskMetricsCalculator riskCalculator;
    private final MetricsService metricsService;
    private final AnalyticsProperties analyticsProperties;
    private final Executor priceFetchExecutor;
    private final Clock clock;

    public PortfolioAnalyticsService(PortfolioService portfolioService,
                                     PriceHistoryService priceHistoryService,
                                     BenchmarkService benchmarkService,
                                     ReturnsAggregator returnsAggregator,
                                     PerformanceMetricsCalculator performanceCalculator,
                                     RiskMetricsCalculator riskCalculator,
                                     MetricsService metricsService,
                                     AnalyticsProperties analyticsProperties,
                                     @Qualifier("priceFetchExecutor") Executor priceFetchExecutor,
                                     Clock clock) {
        this.portfolioService = portfolioService;
        this.priceHistoryService = priceHistoryService;
        this.benchmarkService = benchmarkService;
        this.returnsAggregator = returnsAggregator;
        this.performanceCalculator = performanceCalculator;
        this.riskCalculator = riskCalculator;
        this.metricsService = metricsService;
        this.analyticsProperties = analyticsProperties;
        this.priceFetchExecutor = priceFetchExecutor;
        this.clock = clock;
    }

    /**
     * Assumptions from configuration, with either rate replaced when the
     * caller supplies one.
     */
    public PerformanceMetricsCalculator.Assumptions assumptions(Double riskFreeRate, Double marketReturn) {
        AnalyticsProperties.Performance performance = analyticsProperties.getPerformance();
        return new PerformanceMetricsCalculator.Assumptions(
                riskFreeRate != null ? riskFreeRate : performance.getRiskFreeRate(),
                marketReturn != null ? marketReturn : performance.getAssumedMarketReturn());
    }

    public PerformanceReport computePerformance(Long portfolioId) {
        return computePerformance(portfolioId, assumptions(null, null));
    }

    /**
     * @throws com.folio.backend.exception.NotFoundException when the portfolio does not exist
     * @throws InsufficientDataException when no constituent yields a single return
     */
    public PerformanceReport computePerformance(Long portfolioId, PerformanceMetricsCalculator.Assumptions assumptions) {
        return metricsService.timeReport("performance", () -> buildReport(portfolioId, assumptions));
    }

    private PerformanceReport buildReport(Long portfolioId, PerformanceMetricsCalculator.Assumptions assumptions) {
        PortfolioSnapshot snapshot = portfolioService.loadSnapshot(portfolioId);
        LocalDate end = LocalDate.now(clock);
        LocalDate start = end.minusDays(analyticsProperties.getPerformance().getLookbackDays());

        Map<String, List<PriceBar>> histories = fetchConstituents(snapshot.weights().keySet(), start, end);
        List<String> unavailable = snapshot.weights().keySet().stream()
                .filter(ticker -> !histories.containsKey(ticker))
                .sorted()
                .toList();

        ReturnSeries returns = returnsAggregator.aggregate(histories, snapshot.weights());
        if (returns.isEmpty()) {
            throw new InsufficientDataException("Portfolio " + portfolioId
                    + " has no return data between " + start + " and " + end);
        }

        ReturnSeries benchmark = fetchBenchmark(portfolioId, start, end);
        PerformanceMetricsCalculator.Result result = performanceCalculator.calculate(returns, benchmark, assumptions);

        List<PositionBreakdown> positions = breakdown(snapshot, histories);
        double totalValue = positions.stream().mapToDouble(PositionBreakdown::getValue).sum();
        positions.forEach(p -> p.setWeight(totalValue == 0.0 ? 0.0 : p.getValue() / totalValue));
        Map<String, Double> sectors = new TreeMap<>();
        positions.forEach(p -> sectors.merge(p.getSector(), p.getValue(), Double::sum));

        log.info("Portfolio {} report: {} observations, {} unavailable constituents, benchmark {}",
                portfolioId, returns.size(), unavailable.size(), benchmark == null ? "unavailable" : "ok");

        return PerformanceReport.builder()
                .portfolioId(snapshot.portfolioId())
                .portfolioName(snapshot.name())
                .startDate(start)
                .endDate(end)
                .totalValue(totalValue)
                .positions(positions)
                .sectorAllocation(sectors)
                .dailyReturns(returns.points())
                .observations(returns.size())
                .unavailableTickers(unavailable)
                .metrics(toMetrics(result))
                .riskMetrics(riskMetrics(returns, benchmark))
                .build();
    }

    /**
     * Runs every fetch on the shared executor and waits for all of them under
     * one deadline. A ticker that fails or misses the deadline is left out of
     * the returned map.
     */
    private Map<String, List<PriceBar>> fetchConstituents(Iterable<String> tickers, LocalDate start, LocalDate end) {
        Map<String, CompletableFuture<List<PriceBar>>> futures = new LinkedHashMap<>();
        for (String ticker : tickers) {
            futures.put(ticker, CompletableFuture.supplyAsync(
                    () -> priceHistoryService.getPriceHistory(ticker, start, end), priceFetchExecutor));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(analyticsProperties.getFetch().getTimeoutMs());
        Map<String, List<PriceBar>> histories = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<List<PriceBar>>> entry : futures.entrySet()) {
            String ticker = entry.getKey();
            CompletableFuture<List<PriceBar>> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                histories.put(ticker, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Price history for {} timed out, excluded from aggregate", ticker);
                metricsService.recordConstituentFailure();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Price history for {} unavailable, excluded from aggregate: {}", ticker, cause.getMessage());
                metricsService.recordConstituentFailure();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(pending -> pending.cancel(true));
                throw new IllegalStateException("Interrupted while fetching price histories", e);
            }
        }
        return histories;
    }

    private ReturnSeries fetchBenchmark(Long portfolioId, LocalDate start, LocalDate end) {
        try {
            return benchmarkService.getBenchmarkHistory(start, end);
        } catch (RuntimeException e) {
            log.warn("Benchmark {} unavailable for portfolio {}, relative metrics omitted: {}",
                    benchmarkService.benchmarkTicker(), portfolioId, e.getMessage());
            metricsService.recordBenchmarkDegradation();
            return null;
        }
    }

    private List<PositionBreakdown> breakdown(PortfolioSnapshot snapshot, Map<String, List<PriceBar>> histories) {
        List<PositionBreakdown> rows = new ArrayList<>();
        snapshot.weights().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    String ticker = entry.getKey();
                    PortfolioSnapshot.Holding holding = snapshot.holdings().get(ticker);
                    double shares = holding == null ? 0.0 : holding.shares();
                    double price = latestPrice(histories.get(ticker), holding);
                    rows.add(PositionBreakdown.builder()
                            .ticker(ticker)
                            .shares(shares)
                            .price(price)
                            .value(shares * price)
                            .allocation(entry.getValue())
                            .sector(holding == null ? Position.UNKNOWN_SECTOR : holding.sector())
                            .build());
                });
        return rows;
    }

    private double latestPrice(List<PriceBar> bars, PortfolioSnapshot.Holding holding) {
        if (bars != null && !bars.isEmpty()) {
            return bars.get(bars.size() - 1).getClose();
        }
        if (holding != null && holding.currentPrice() != null) {
            return holding.currentPrice();
        }
        return 0.0;
    }

    private PortfolioMetrics toMetrics(PerformanceMetricsCalculator.Result result) {
        return PortfolioMetrics.builder()
                .totalReturn(result.totalReturn())
                .annualizedReturn(result.annualizedReturn())
                .volatility(result.volatility())
                .sharpeRatio(result.sharpeRatio())
                .sortinoRatio(result.sortinoRatio())
                .calmarRatio(result.calmarRatio())
                .maxDrawdown(result.maxDrawdown())
                .beta(result.beta())
                .alpha(result.alpha())
                .build();
    }

    private RiskMetrics riskMetrics(ReturnSeries returns, ReturnSeries benchmark) {
        return RiskMetrics.builder()
                .var95(riskCalculator.valueAtRisk(returns, 0.95))
                .var99(riskCalculator.valueAtRisk(returns, 0.99))
                .cvar95(riskCalculator.conditionalValueAtRisk(returns, 0.95))
                .cvar99(riskCalculator.conditionalValueAtRisk(returns, 0.99))
                .trackingError(benchmark == null
                        ? MetricValue.unavailable()
                        : MetricValue.computed(riskCalculator.trackingError(returns, benchmark)))
                .build();
    }
}
