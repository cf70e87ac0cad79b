package com.folio.backend.dto;

import com.folio.backend.model.MetricValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioMetrics {
    private double totalReturn;
    private double annualizedReturn;
    private double volatility;
    private double sharpeRatio;
    private double sortinoRatio;
    private double calmarRatio;
    private double maxDrawdown;
    private MetricValue beta;
    private MetricValue alpha;
}
