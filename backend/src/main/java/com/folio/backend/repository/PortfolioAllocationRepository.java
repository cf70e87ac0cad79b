package com.folio.backend.repository;

import com.folio.backend.model.PortfolioAllocation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PortfolioAllocationRepository extends JpaRepository<PortfolioAllocation, Long> {
    List<PortfolioAllocation> findByPortfolioIdOrderByTickerAsc(Long portfolioId);
    Optional<PortfolioAllocation> findByPortfolioIdAndTicker(Long portfolioId, String ticker);
    long deleteByPortfolioIdAndTicker(Long portfolioId, String ticker);
    long deleteByPortfolioId(Long portfolioId);
}
