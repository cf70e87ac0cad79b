package com.folio.backend.dto;

import com.folio.backend.model.ReturnPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceReport {
    private Long portfolioId;
    private String portfolioName;
    private LocalDate startDate;
    private LocalDate endDate;
    private double totalValue;
    private List<PositionBreakdown> positions;
    private Map<String, Double> sectorAllocation;
    private List<ReturnPoint> dailyReturns;
    private int observations;
    /** Constituents whose history could not be fetched; they contribute 0 to every date. */
    private List<String> unavailableTickers;
    private PortfolioMetrics metrics;
    private RiskMetrics riskMetrics;
}
