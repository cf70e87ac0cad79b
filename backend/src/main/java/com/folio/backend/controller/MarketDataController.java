package com.folio.backend.controller;

import com.folio.backend.exception.BadRequestException;
import com.folio.backend.model.PriceBar;
import com.folio.backend.service.PriceHistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/market-data")
@RequiredArgsConstructor
@Tag(name = "Market Data")
public class MarketDataController {

    private static final int DEFAULT_HISTORY_DAYS = 365;

    private final PriceHistoryService priceHistoryService;
    private final Clock clock;

    @GetMapping("/{ticker}/history")
    @Operation(summary = "Daily bars for a ticker, one year back by default")
    public ResponseEntity<List<PriceBar>> history(
            @PathVariable String ticker,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        LocalDate to = end != null ? end : LocalDate.now(clock);
        LocalDate from = start != null ? start : to.minusDays(DEFAULT_HISTORY_DAYS);
        if (from.isAfter(to)) {
            throw new BadRequestException("start must not be after end");
        }
        return ResponseEntity.ok(priceHistoryService.getPriceHistory(ticker, from, to));
    }
}
