package com.folio.backend.service;

import com.folio.backend.dto.PositionDTO;
import com.folio.backend.dto.PositionRequest;
import com.folio.backend.dto.PositionSummaryResponse;
import com.folio.backend.dto.PositionUpdateRequest;
import com.folio.backend.dto.RefreshSummary;
import com.folio.backend.exception.DataUnavailableException;
import com.folio.backend.exception.NotFoundException;
import com.folio.backend.model.Position;
import com.folio.backend.repository.PositionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Held quantities per ticker. Prices are taken from the market data provider,
 * never from the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionService {

    private static final int REFRESH_HISTORY_DAYS = 365;

    private final PositionRepository positionRepository;
    private final PriceHistoryService priceHistoryService;
    private final Clock clock;

    /**
     * Adds or replaces a position. The ticker must resolve at the provider;
     * its latest close becomes the current price.
     *
     * @throws DataUnavailableException when the provider knows no recent bars for the ticker
     */
    @Transactional
    public PositionDTO add(PositionRequest request) {
        String ticker = PriceHistoryService.normalize(request.getTicker());
        double price = priceHistoryService.latestClose(ticker, LocalDate.now(clock));
        Position position = positionRepository.findById(ticker)
                .orElseGet(() -> Position.builder().ticker(ticker).build());
        position.setShares(request.getShares());
        if (request.getSector() != null && !request.getSector().isBlank()) {
            position.setSector(request.getSector().trim());
        }
        if (request.getMarketCap() != null) {
            position.setMarketCap(request.getMarketCap());
        }
        position.setCurrentPrice(price);
        Position saved = positionRepository.save(position);
        log.info("Position {} set to {} shares at {}", ticker, saved.getShares(), price);
        return toDto(saved);
    }

    @Transactional
    public PositionDTO update(String ticker, PositionUpdateRequest request) {
        Position position = require(ticker);
        position.setShares(request.getShares());
        if (request.getSector() != null && !request.getSector().isBlank()) {
            position.setSector(request.getSector().trim());
        }
        return toDto(positionRepository.save(position));
    }

    @Transactional
    public void remove(String ticker) {
        Position position = require(ticker);
        positionRepository.delete(position);
        priceHistoryService.evict(position.getTicker());
        log.info("Removed position {}", position.getTicker());
    }

    @Transactional(readOnly = true)
    public PositionDTO get(String ticker) {
        return toDto(require(ticker));
    }

    @Transactional(readOnly = true)
    public PositionSummaryResponse summary() {
        List<PositionDTO> stocks = positionRepository.findAllByOrderByTickerAsc().stream()
                .map(this::toDto)
                .toList();
        return new PositionSummaryResponse(stocks.size(), stocks);
    }

    /**
     * Re-reads a year of history and the latest close for every position.
     * A failing ticker is logged and reported; the others still refresh.
     */
    @Transactional
    public RefreshSummary refreshAll() {
        LocalDate today = LocalDate.now(clock);
        List<Position> positions = positionRepository.findAllByOrderByTickerAsc();
        List<String> refreshed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Position position : positions) {
            try {
                var bars = priceHistoryService.getPriceHistory(position.getTicker(),
                        today.minusDays(REFRESH_HISTORY_DAYS), today);
                position.setCurrentPrice(bars.get(bars.size() - 1).getClose());
                positionRepository.save(position);
                refreshed.add(position.getTicker());
            } catch (DataUnavailableException e) {
                log.warn("Refresh failed for {}: {}", position.getTicker(), e.getMessage());
                failed.add(position.getTicker());
            }
        }
        log.info("Refreshed {} of {} positions", refreshed.size(), positions.size());
        return new RefreshSummary(positions.size(), refreshed, failed);
    }

    private Position require(String ticker) {
        String symbol = PriceHistoryService.normalize(ticker);
        return positionRepository.findById(symbol)
                .orElseThrow(() -> new NotFoundException("Position " + symbol + " not found"));
    }

    private PositionDTO toDto(Position position) {
        return PositionDTO.builder()
                .ticker(position.getTicker())
                .shares(position.getShares())
                .currentPrice(position.getCurrentPrice())
                .marketCap(position.getMarketCap())
                .sector(position.getSector())
                .lastUpdated(position.getLastUpdated())
                .build();
    }
}
