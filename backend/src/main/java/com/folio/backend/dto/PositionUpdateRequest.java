package com.folio.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class PositionUpdateRequest {
    @NotNull
    @PositiveOrZero
    private Double shares;

    private String sector;
}
