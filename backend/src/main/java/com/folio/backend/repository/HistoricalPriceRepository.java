package com.folio.backend.repository;

import com.folio.backend.model.HistoricalPrice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface HistoricalPriceRepository extends JpaRepository<HistoricalPrice, Long> {
    List<HistoricalPrice> findByTickerAndTradeDateBetweenOrderByTradeDateAsc(String ticker, LocalDate start, LocalDate end);
    long deleteByTicker(String ticker);
}
