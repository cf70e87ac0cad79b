package com.folio.backend.controller;

import com.folio.backend.dto.PositionDTO;
import com.folio.backend.dto.PositionRequest;
import com.folio.backend.dto.PositionSummaryResponse;
import com.folio.backend.dto.PositionUpdateRequest;
import com.folio.backend.dto.RefreshSummary;
import com.folio.backend.service.PositionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
@Tag(name = "Positions")
public class PositionController {

    private final PositionService positionService;

    @GetMapping
    @Operation(summary = "Summary of all held positions")
    public ResponseEntity<PositionSummaryResponse> summary() {
        return ResponseEntity.ok(positionService.summary());
    }

    @GetMapping("/{ticker}")
    public ResponseEntity<PositionDTO> get(@PathVariable String ticker) {
        return ResponseEntity.ok(positionService.get(ticker));
    }

    @PostMapping
    @Operation(summary = "Add or replace a position, priced at the latest close")
    @ApiResponse(responseCode = "404", description = "Ticker unknown to the market data provider")
    public ResponseEntity<PositionDTO> add(@Valid @RequestBody PositionRequest request) {
        return ResponseEntity.ok(positionService.add(request));
    }

    @PutMapping("/{ticker}")
    @Operation(summary = "Update held shares")
    public ResponseEntity<PositionDTO> update(@PathVariable String ticker,
                                              @Valid @RequestBody PositionUpdateRequest request) {
        return ResponseEntity.ok(positionService.update(ticker, request));
    }

    @DeleteMapping("/{ticker}")
    @Operation(summary = "Remove a position and its cached history")
    @ApiResponse(responseCode = "204", content = @Content)
    public ResponseEntity<Void> remove(@PathVariable String ticker) {
        positionService.remove(ticker);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh history and current price of every position")
    public ResponseEntity<RefreshSummary> refresh() {
        return ResponseEntity.ok(positionService.refreshAll());
    }
}
