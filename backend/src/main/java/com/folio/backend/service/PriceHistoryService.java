package com.folio.backend.service;

import com.folio.backend.exception.DataUnavailableException;
import com.folio.backend.model.HistoricalPrice;
import com.folio.backend.model.PriceBar;
import com.folio.backend.repository.HistoricalPriceRepository;
import com.folio.backend.service.marketdata.MarketDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-through store of daily bars: the provider is asked first and whatever
 * it returns is persisted, so a later provider outage can still be served from
 * the database for windows fetched before.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceHistoryService {

    private static final int LATEST_CLOSE_LOOKBACK_DAYS = 10;

    private final MarketDataProvider marketDataProvider;
    private final HistoricalPriceRepository historicalPriceRepository;

    public static String normalize(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("ticker must not be blank");
        }
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    public List<PriceBar> getPriceHistory(String ticker, LocalDate start, LocalDate end) {
        String symbol = normalize(ticker);
        try {
            List<PriceBar> bars = marketDataProvider.getPriceHistory(symbol, start, end);
            store(symbol, bars);
            return bars;
        } catch (DataUnavailableException e) {
            List<PriceBar> cached = getCachedHistory(symbol, start, end);
            if (cached.isEmpty()) {
                throw e;
            }
            log.warn("Provider unavailable for {} ({}), serving {} cached bars", symbol, e.getMessage(), cached.size());
            return cached;
        }
    }

    public List<PriceBar> getCachedHistory(String ticker, LocalDate start, LocalDate end) {
        return historicalPriceRepository
                .findByTickerAndTradeDateBetweenOrderByTradeDateAsc(normalize(ticker), start, end)
                .stream()
                .map(HistoricalPrice::toBar)
                .toList();
    }

    /**
     * Close of the most recent bar up to {@code asOf}.
     */
    public double latestClose(String ticker, LocalDate asOf) {
        List<PriceBar> bars = getPriceHistory(ticker, asOf.minusDays(LATEST_CLOSE_LOOKBACK_DAYS), asOf);
        return bars.get(bars.size() - 1).getClose();
    }

    public void evict(String ticker) {
        long removed = historicalPriceRepository.deleteByTicker(normalize(ticker));
        log.info("Removed {} cached bars for {}", removed, ticker);
    }

    private void store(String ticker, List<PriceBar> bars) {
        if (bars.isEmpty()) {
            return;
        }
        LocalDate first = bars.get(0).getDate();
        LocalDate last = bars.get(bars.size() - 1).getDate();
        try {
            Map<LocalDate, HistoricalPrice> existing = historicalPriceRepository
                    .findByTickerAndTradeDateBetweenOrderByTradeDateAsc(ticker, first, last)
                    .stream()
                    .collect(Collectors.toMap(HistoricalPrice::getTradeDate, Function.identity(), (a, b) -> a));
            List<HistoricalPrice> rows = new ArrayList<>(bars.size());
            for (PriceBar bar : bars) {
                HistoricalPrice row = existing.getOrDefault(bar.getDate(),
                        HistoricalPrice.builder().ticker(ticker).tradeDate(bar.getDate()).build());
                row.setOpen(bar.getOpen());
                row.setHigh(bar.getHigh());
                row.setLow(bar.getLow());
                row.setClose(bar.getClose());
                row.setVolume(bar.getVolume());
                rows.add(row);
            }
            historicalPriceRepository.saveAll(rows);
        } catch (DataAccessException e) {
            log.warn("Could not cache {} bars for {}: {}", bars.size(), ticker, e.getMessage());
        }
    }
}
