package com.folio.backend.service;

import com.folio.backend.dto.AllocationDTO;
import com.folio.backend.exception.AllocationInvalidException;
import com.folio.backend.model.PortfolioAllocation;
import com.folio.backend.repository.PortfolioAllocationRepository;
import com.folio.backend.service.analytics.AllocationValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class RebalanceService {

    private final PortfolioService portfolioService;
    private final PortfolioAllocationRepository allocationRepository;
    private final AllocationValidator allocationValidator;

    /**
     * Writes the supplied target weights. Tickers not named keep their
     * current weight. A rejected request leaves every allocation untouched.
     *
     * @return all allocations of the portfolio after the update
     * @throws AllocationInvalidException when the weights do not sum to 1 or fall outside [0, 1]
     */
    @Transactional
    public List<AllocationDTO> rebalance(Long portfolioId, Map<String, Double> weights) {
        portfolioService.require(portfolioId);
        List<String> violations = allocationValidator.validate(weights);
        if (!violations.isEmpty()) {
            log.warn("Rejected allocation update for portfolio {}: {}", portfolioId, violations);
            throw new AllocationInvalidException(violations);
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        weights.forEach((ticker, weight) -> normalized.merge(PriceHistoryService.normalize(ticker), weight, Double::sum));
        normalized.forEach((ticker, weight) -> {
            PortfolioAllocation row = allocationRepository.findByPortfolioIdAndTicker(portfolioId, ticker)
                    .orElseGet(() -> PortfolioAllocation.builder().portfolioId(portfolioId).ticker(ticker).build());
            row.setWeight(weight);
            allocationRepository.save(row);
        });
        log.info("Rebalanced portfolio {} across {} tickers", portfolioId, normalized.size());
        return portfolioService.allocations(portfolioId);
    }
}
