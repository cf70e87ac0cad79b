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
public class RiskMetrics {
    private double var95;
    private double var99;
    private double cvar95;
    private double cvar99;
    private MetricValue trackingError;
}
