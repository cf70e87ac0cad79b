package com.folio.backend.service;

import com.folio.backend.dto.ComparisonReport;
import com.folio.backend.dto.PerformanceReport;
import com.folio.backend.exception.BadRequestException;
import com.folio.backend.exception.InsufficientDataException;
import com.folio.backend.model.ReturnPoint;
import com.folio.backend.model.ReturnSeries;
import com.folio.backend.service.analytics.CorrelationService;
import com.folio.backend.service.analytics.PerformanceMetricsCalculator;
import com.folio.backend.service.analytics.ReturnsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioComparisonService {

    private final PortfolioAnalyticsService analyticsService;
    private final ReturnsAggregator returnsAggregator;
    private final CorrelationService correlationService;
    private final MetricsService metricsService;

    /**
     * Side-by-side metrics, return correlations and growth curves for two or
     * more portfolios. Portfolios whose report cannot be built are listed as
     * skipped instead of failing the comparison.
     *
     * @throws BadRequestException       when fewer than two distinct ids are given
     * @throws InsufficientDataException when fewer than two reports could be built
     */
    public ComparisonReport compare(Collection<Long> portfolioIds, PerformanceMetricsCalculator.Assumptions assumptions) {
        LinkedHashSet<Long> ids = portfolioIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(portfolioIds);
        ids.remove(null);
        if (ids.size() < 2) {
            throw new BadRequestException("At least two portfolios are required for a comparison");
        }
        return metricsService.timeReport("comparison", () -> buildComparison(ids, assumptions));
    }

    private ComparisonReport buildComparison(Collection<Long> ids, PerformanceMetricsCalculator.Assumptions assumptions) {
        List<PerformanceReport> reports = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        for (Long id : ids) {
            try {
                reports.add(analyticsService.computePerformance(id, assumptions));
            } catch (RuntimeException e) {
                log.warn("Portfolio {} skipped from comparison: {}", id, e.getMessage());
                skipped.add(id);
            }
        }
        if (reports.size() < 2) {
            throw new InsufficientDataException("Only " + reports.size()
                    + " of " + ids.size() + " portfolios have usable return data");
        }

        Map<String, ReturnSeries> seriesByLabel = new LinkedHashMap<>();
        Map<String, List<ReturnPoint>> curves = new LinkedHashMap<>();
        List<ComparisonReport.ComparisonRow> rows = new ArrayList<>();
        for (PerformanceReport report : reports) {
            String label = report.getPortfolioName();
            ReturnSeries returns = ReturnSeries.of(report.getDailyReturns());
            seriesByLabel.put(label, returns);
            curves.put(label, returnsAggregator.cumulative(returns).points());
            rows.add(ComparisonReport.ComparisonRow.builder()
                    .portfolioId(report.getPortfolioId())
                    .portfolioName(label)
                    .totalValue(report.getTotalValue())
                    .observations(report.getObservations())
                    .metrics(report.getMetrics())
                    .riskMetrics(report.getRiskMetrics())
                    .build());
        }
        CorrelationService.Matrix matrix = correlationService.buildMatrix(seriesByLabel);

        return ComparisonReport.builder()
                .rows(rows)
                .skippedPortfolioIds(skipped)
                .correlationLabels(matrix.labels())
                .correlationMatrix(matrix.values())
                .cumulativeReturns(curves)
                .build();
    }
}
