package com.folio.backend.dto;

import com.folio.backend.model.ReturnPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonReport {
    private List<ComparisonRow> rows;
    private List<Long> skippedPortfolioIds;
    private List<String> correlationLabels;
    private double[][] correlationMatrix;
    private Map<String, List<ReturnPoint>> cumulativeReturns;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ComparisonRow {
        private Long portfolioId;
        private String portfolioName;
        private double totalValue;
        private int observations;
        private PortfolioMetrics metrics;
        private RiskMetrics riskMetrics;
    }
}
