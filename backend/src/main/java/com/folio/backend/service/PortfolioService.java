package com.folio.backend.service;

import com.folio.backend.dto.AllocationDTO;
import com.folio.backend.dto.PortfolioCreateRequest;
import com.folio.backend.dto.PortfolioResponse;
import com.folio.backend.exception.ConflictException;
import com.folio.backend.exception.NotFoundException;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.PortfolioAllocation;
import com.folio.backend.model.PortfolioSnapshot;
import com.folio.backend.model.Position;
import com.folio.backend.repository.PortfolioAllocationRepository;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.PositionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    public static final double DEFAULT_ALLOCATION = 1.0;

    private final PortfolioRepository portfolioRepository;
    private final PortfolioAllocationRepository allocationRepository;
    private final PositionRepository positionRepository;

    @Transactional
    public PortfolioResponse create(PortfolioCreateRequest request) {
        String name = request.getName().trim();
        if (portfolioRepository.existsByName(name)) {
            throw new ConflictException("Portfolio '" + name + "' already exists");
        }
        Portfolio portfolio = portfolioRepository.save(Portfolio.builder()
                .name(name)
                .description(request.getDescription())
                .build());
        log.info("Created portfolio {} ({})", portfolio.getId(), name);
        return toResponse(portfolio);
    }

    @Transactional(readOnly = true)
    public List<PortfolioResponse> list() {
        return portfolioRepository.findAll().stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public PortfolioResponse get(Long id) {
        return toResponse(require(id));
    }

    @Transactional
    public void delete(Long id) {
        Portfolio portfolio = require(id);
        allocationRepository.deleteByPortfolioId(id);
        portfolioRepository.delete(portfolio);
        log.info("Deleted portfolio {}", id);
    }

    /**
     * Inserts the ticker into the portfolio or replaces its existing weight.
     */
    @Transactional
    public PortfolioResponse addStock(Long id, String ticker, Double allocation) {
        Portfolio portfolio = require(id);
        String symbol = PriceHistoryService.normalize(ticker);
        double weight = allocation == null ? DEFAULT_ALLOCATION : allocation;
        PortfolioAllocation row = allocationRepository.findByPortfolioIdAndTicker(id, symbol)
                .orElseGet(() -> PortfolioAllocation.builder().portfolioId(id).ticker(symbol).build());
        row.setWeight(weight);
        allocationRepository.save(row);
        return toResponse(portfolio);
    }

    @Transactional
    public PortfolioResponse removeStock(Long id, String ticker) {
        Portfolio portfolio = require(id);
        String symbol = PriceHistoryService.normalize(ticker);
        if (allocationRepository.deleteByPortfolioIdAndTicker(id, symbol) == 0) {
            throw new NotFoundException("Stock " + symbol + " is not part of portfolio " + id);
        }
        return toResponse(portfolio);
    }

    @Transactional(readOnly = true)
    public List<AllocationDTO> allocations(Long id) {
        require(id);
        return allocationRepository.findByPortfolioIdOrderByTickerAsc(id).stream()
                .map(row -> new AllocationDTO(row.getTicker(), row.getWeight()))
                .toList();
    }

    /**
     * Reads the portfolio definition and the positions it refers to in one
     * transaction, so a computation sees a consistent view.
     */
    @Transactional(readOnly = true)
    public PortfolioSnapshot loadSnapshot(Long id) {
        Portfolio portfolio = require(id);
        Map<String, Double> weights = new LinkedHashMap<>();
        allocationRepository.findByPortfolioIdOrderByTickerAsc(id)
                .forEach(row -> weights.put(row.getTicker(), row.getWeight()));
        Map<String, PortfolioSnapshot.Holding> holdings = positionRepository.findByTickerIn(weights.keySet())
                .stream()
                .collect(Collectors.toMap(Position::getTicker, this::toHolding, (a, b) -> a));
        return new PortfolioSnapshot(portfolio.getId(), portfolio.getName(), weights, holdings);
    }

    Portfolio require(Long id) {
        return portfolioRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Portfolio " + id + " not found"));
    }

    private PortfolioSnapshot.Holding toHolding(Position position) {
        return new PortfolioSnapshot.Holding(position.getTicker(), position.getShares(),
                position.getSector(), position.getCurrentPrice());
    }

    private PortfolioResponse toResponse(Portfolio portfolio) {
        List<AllocationDTO> stocks = allocationRepository.findByPortfolioIdOrderByTickerAsc(portfolio.getId())
                .stream()
                .map(row -> new AllocationDTO(row.getTicker(), row.getWeight()))
                .toList();
        return PortfolioResponse.builder()
                .id(portfolio.getId())
                .name(portfolio.getName())
                .description(portfolio.getDescription())
                .createdAt(portfolio.getCreatedAt())
                .stocks(stocks)
                .build();
    }
}
