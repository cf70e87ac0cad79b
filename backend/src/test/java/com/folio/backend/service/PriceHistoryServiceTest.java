package com.folio.backend.service;

import com.folio.backend.exception.DataUnavailableException;
import com.folio.backend.model.HistoricalPrice;
import com.folio.backend.model.PriceBar;
import com.folio.backend.repository.HistoricalPriceRepository;
import com.folio.backend.service.marketdata.MarketDataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDate;
import java.util.List;

import static com.folio.backend.util.TestPriceBars.START;
import static com.folio.backend.util.TestPriceBars.bars;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PriceHistoryServiceTest {

    private static final LocalDate END = START.plusDays(30);

    private MarketDataProvider provider;
    private HistoricalPriceRepository repository;
    private PriceHistoryService service;

    @BeforeEach
    void setUp() {
        provider = mock(MarketDataProvider.class);
        repository = mock(HistoricalPriceRepository.class);
        service = new PriceHistoryService(provider, repository);
    }

    @Test
    @SuppressWarnings("unchecked")
    void providerBarsAreCachedUnderNormalizedTicker() {
        when(provider.getPriceHistory("AAPL", START, END)).thenReturn(bars(100.0, 101.0));
        HistoricalPrice stale = HistoricalPrice.builder().id(7L).ticker("AAPL").tradeDate(START).close(90.0).build();
        when(repository.findByTickerAndTradeDateBetweenOrderByTradeDateAsc("AAPL", START, START.plusDays(1)))
                .thenReturn(List.of(stale));

        List<PriceBar> result = service.getPriceHistory(" aapl ", START, END);

        assertThat(result).hasSize(2);
        ArgumentCaptor<List<HistoricalPrice>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(saved.capture());
        assertThat(saved.getValue()).hasSize(2);
        assertThat(saved.getValue().get(0)).isSameAs(stale);
        assertThat(stale.getClose()).isEqualTo(100.0);
        assertThat(saved.getValue().get(1).getTicker()).isEqualTo("AAPL");
    }

    @Test
    void providerOutageFallsBackToCachedBars() {
        when(provider.getPriceHistory(eq("AAPL"), any(), any()))
                .thenThrow(new DataUnavailableException("AAPL", "down"));
        when(repository.findByTickerAndTradeDateBetweenOrderByTradeDateAsc("AAPL", START, END))
                .thenReturn(List.of(HistoricalPrice.builder().ticker("AAPL").tradeDate(START).close(99.0).build()));

        List<PriceBar> result = service.getPriceHistory("AAPL", START, END);

        assertThat(result).singleElement().extracting(PriceBar::getClose).isEqualTo(99.0);
    }

    @Test
    void providerOutageWithEmptyCacheIsRethrown() {
        when(provider.getPriceHistory(eq("AAPL"), any(), any()))
                .thenThrow(new DataUnavailableException("AAPL", "down"));
        when(repository.findByTickerAndTradeDateBetweenOrderByTradeDateAsc(any(), any(), any())).thenReturn(List.of());

        assertThatThrownBy(() -> service.getPriceHistory("AAPL", START, END))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("down");
    }

    @Test
    void cacheWriteFailureDoesNotFailTheRead() {
        when(provider.getPriceHistory("AAPL", START, END)).thenReturn(bars(100.0, 101.0));
        when(repository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(service.getPriceHistory("AAPL", START, END)).hasSize(2);
    }

    @Test
    void latestCloseIsLastBar() {
        when(provider.getPriceHistory(eq("AAPL"), any(), eq(END))).thenReturn(bars(100.0, 101.0, 103.5));

        assertThat(service.latestClose("AAPL", END)).isEqualTo(103.5);
    }

    @Test
    void blankTickerIsRejected() {
        assertThatThrownBy(() -> PriceHistoryService.normalize("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
