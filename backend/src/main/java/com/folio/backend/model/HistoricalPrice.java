package com.folio.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Cached daily bar for a ticker. Only raw provider data is persisted.
 */
@Entity
@Table(name = "historical_prices",
        uniqueConstraints = @UniqueConstraint(columnNames = {"ticker", "trade_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalPrice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String ticker;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "open_price")
    private double open;

    @Column(name = "high_price")
    private double high;

    @Column(name = "low_price")
    private double low;

    @Column(name = "close_price", nullable = false)
    private double close;

    private long volume;

    public PriceBar toBar() {
        return PriceBar.builder()
                .date(tradeDate)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }
}
