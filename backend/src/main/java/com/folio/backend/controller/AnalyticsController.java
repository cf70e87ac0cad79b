package com.folio.backend.controller;

import com.folio.backend.dto.CompareRequest;
import com.folio.backend.dto.ComparisonReport;
import com.folio.backend.dto.PerformanceReport;
import com.folio.backend.dto.RatioSeries;
import com.folio.backend.service.PortfolioAnalyticsService;
import com.folio.backend.service.PortfolioComparisonService;
import com.folio.backend.service.TradeRatioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
@Tag(name = "Analytics")
public class AnalyticsController {

    private final PortfolioAnalyticsService analyticsService;
    private final PortfolioComparisonService comparisonService;
    private final TradeRatioService tradeRatioService;

    @GetMapping("/portfolios/{id}/performance")
    @Operation(summary = "Performance and risk report for a portfolio")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = PerformanceReport.class)))
    @ApiResponse(responseCode = "422", description = "No usable return data")
    public ResponseEntity<PerformanceReport> performance(
            @PathVariable Long id,
            @Parameter(description = "Annual risk-free rate; configured default when omitted")
            @RequestParam(required = false) Double riskFreeRate,
            @Parameter(description = "Assumed annual market return; configured default when omitted")
            @RequestParam(required = false) Double marketReturn) {
        return ResponseEntity.ok(analyticsService.computePerformance(id,
                analyticsService.assumptions(riskFreeRate, marketReturn)));
    }

    @PostMapping("/portfolios/compare")
    @Operation(summary = "Compare two or more portfolios")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = ComparisonReport.class)))
    public ResponseEntity<ComparisonReport> compare(@Valid @RequestBody CompareRequest request) {
        return ResponseEntity.ok(comparisonService.compare(request.getPortfolioIds(),
                analyticsService.assumptions(null, null)));
    }

    @GetMapping("/ratio")
    @Operation(summary = "Price ratio of two tickers with moving average")
    @ApiResponse(responseCode = "422", description = "The two tickers share no trading dates")
    public ResponseEntity<RatioSeries> ratio(@RequestParam String tickerA,
                                             @RequestParam String tickerB,
                                             @RequestParam(required = false) Integer lookbackDays) {
        return ResponseEntity.ok(tradeRatioService.ratio(tickerA, tickerB, lookbackDays));
    }
}
