package com.folio.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PortfolioStockRequest {
    @NotBlank
    private String ticker;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double allocation;
}
