package com.folio.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.Map;

@Data
public class RebalanceRequest {
    @NotEmpty
    private Map<String, Double> weights;
}
