package com.folio.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Set;

@Data
public class CompareRequest {
    @NotNull
    @Size(min = 2, message = "at least two portfolios are required")
    private Set<@NotNull Long> portfolioIds;
}
