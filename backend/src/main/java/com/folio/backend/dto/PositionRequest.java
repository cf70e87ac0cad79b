package com.folio.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class PositionRequest {
    @NotBlank
    private String ticker;

    @PositiveOrZero
    private double shares;

    private String sector;

    @PositiveOrZero
    private Double marketCap;
}
