package com.folio.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionBreakdown {
    private String ticker;
    private double shares;
    private double price;
    private double value;
    private double weight;
    private double allocation;
    private String sector;
}
