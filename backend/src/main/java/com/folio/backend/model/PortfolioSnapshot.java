package com.folio.backend.model;

import java.util.Map;

/**
 * Immutable view of a portfolio definition, loaded once per computation.
 */
public record PortfolioSnapshot(
        Long portfolioId,
        String name,
        Map<String, Double> weights,
        Map<String, Holding> holdings
) {

    public PortfolioSnapshot {
        weights = Map.copyOf(weights);
        holdings = Map.copyOf(holdings);
    }

    public record Holding(String ticker, double shares, String sector, Double currentPrice) {}
}
