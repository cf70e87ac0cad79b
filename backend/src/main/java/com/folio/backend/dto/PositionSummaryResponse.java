package com.folio.backend.dto;

import java.util.List;

public record PositionSummaryResponse(int totalStocks, List<PositionDTO> stocks) {}
