package com.folio.backend.dto;

public record AllocationDTO(String ticker, double weight) {}
