package com.folio.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RatioSeries {
    private String tickerA;
    private String tickerB;
    private LocalDate startDate;
    private LocalDate endDate;
    private int movingAverageWindow;
    private double currentRatio;
    private double mean;
    private double standardDeviation;
    @JsonProperty("zScore")
    private double zScore;
    private List<RatioPoint> points;

    public record RatioPoint(LocalDate date, double ratio, Double movingAverage) {}
}
