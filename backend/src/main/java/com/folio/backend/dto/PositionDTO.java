package com.folio.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionDTO {
    private String ticker;
    private double shares;
    private Double currentPrice;
    private Double marketCap;
    private String sector;
    private Instant lastUpdated;
}
