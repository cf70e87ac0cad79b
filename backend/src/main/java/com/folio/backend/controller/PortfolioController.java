package com.folio.backend.controller;

import com.folio.backend.dto.AllocationDTO;
import com.folio.backend.dto.PortfolioCreateRequest;
import com.folio.backend.dto.PortfolioResponse;
import com.folio.backend.dto.PortfolioStockRequest;
import com.folio.backend.dto.RebalanceRequest;
import com.folio.backend.service.PortfolioService;
import com.folio.backend.service.RebalanceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/portfolios")
@RequiredArgsConstructor
@Tag(name = "Portfolios")
public class PortfolioController {

    private final PortfolioService portfolioService;
    private final RebalanceService rebalanceService;

    @PostMapping
    @Operation(summary = "Create a portfolio")
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = PortfolioResponse.class)))
    public ResponseEntity<PortfolioResponse> create(@Valid @RequestBody PortfolioCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(portfolioService.create(request));
    }

    @GetMapping
    @Operation(summary = "List portfolios with their stocks")
    public ResponseEntity<List<PortfolioResponse>> list() {
        return ResponseEntity.ok(portfolioService.list());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a portfolio")
    public ResponseEntity<PortfolioResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(portfolioService.get(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a portfolio and its allocations")
    @ApiResponse(responseCode = "204", content = @Content)
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        portfolioService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/stocks")
    @Operation(summary = "Add a stock to a portfolio, replacing its allocation if present")
    public ResponseEntity<PortfolioResponse> addStock(@PathVariable Long id,
                                                      @Valid @RequestBody PortfolioStockRequest request) {
        return ResponseEntity.ok(portfolioService.addStock(id, request.getTicker(), request.getAllocation()));
    }

    @DeleteMapping("/{id}/stocks/{ticker}")
    @Operation(summary = "Remove a stock from a portfolio")
    public ResponseEntity<PortfolioResponse> removeStock(@PathVariable Long id, @PathVariable String ticker) {
        return ResponseEntity.ok(portfolioService.removeStock(id, ticker));
    }

    @GetMapping("/{id}/allocations")
    @Operation(summary = "Current allocation weights")
    public ResponseEntity<List<AllocationDTO>> allocations(@PathVariable Long id) {
        return ResponseEntity.ok(portfolioService.allocations(id));
    }

    @PutMapping("/{id}/allocations")
    @Operation(summary = "Rebalance to target weights that sum to 1")
    @ApiResponse(responseCode = "422", description = "Weights rejected; nothing was written")
    public ResponseEntity<List<AllocationDTO>> rebalance(@PathVariable Long id,
                                                         @Valid @RequestBody RebalanceRequest request) {
        return ResponseEntity.ok(rebalanceService.rebalance(id, request.getWeights()));
    }
}
