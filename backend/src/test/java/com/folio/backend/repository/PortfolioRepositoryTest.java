package com.folio.backend.repository;

import com.folio.backend.model.HistoricalPrice;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.PortfolioAllocation;
import com.folio.backend.model.Position;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class PortfolioRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private PortfolioRepository portfolioRepository;

    @Autowired
    private PortfolioAllocationRepository allocationRepository;

    @Autowired
    private PositionRepository positionRepository;

    @Autowired
    private HistoricalPriceRepository historicalPriceRepository;

    @Test
    void portfolioNamesAreLookedUpExactly() {
        Portfolio saved = portfolioRepository.save(Portfolio.builder().name("Retirement").build());
        entityManager.flush();

        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(portfolioRepository.existsByName("Retirement")).isTrue();
        assertThat(portfolioRepository.findByName("retirement")).isEmpty();
    }

    @Test
    void allocationsAreScopedToPortfolioAndOrderedByTicker() {
        Portfolio first = entityManager.persist(Portfolio.builder().name("First").build());
        Portfolio second = entityManager.persist(Portfolio.builder().name("Second").build());
        entityManager.persist(PortfolioAllocation.builder().portfolioId(first.getId()).ticker("MSFT").weight(0.4).build());
        entityManager.persist(PortfolioAllocation.builder().portfolioId(first.getId()).ticker("AAPL").weight(0.6).build());
        entityManager.persist(PortfolioAllocation.builder().portfolioId(second.getId()).ticker("TLT").weight(1.0).build());
        entityManager.flush();

        assertThat(allocationRepository.findByPortfolioIdOrderByTickerAsc(first.getId()))
                .extracting(PortfolioAllocation::getTicker)
                .containsExactly("AAPL", "MSFT");
        assertThat(allocationRepository.findByPortfolioIdAndTicker(second.getId(), "AAPL")).isEmpty();

        assertThat(allocationRepository.deleteByPortfolioIdAndTicker(first.getId(), "MSFT")).isEqualTo(1L);
        assertThat(allocationRepository.findByPortfolioIdOrderByTickerAsc(first.getId())).hasSize(1);
    }

    @Test
    void positionsDefaultToUnknownSector() {
        positionRepository.save(Position.builder().ticker("VTI").shares(4).sector(null).build());
        positionRepository.save(Position.builder().ticker("AAPL").shares(2).sector("Tech").build());
        entityManager.flush();
        entityManager.clear();

        List<Position> positions = positionRepository.findAllByOrderByTickerAsc();
        assertThat(positions).extracting(Position::getTicker).containsExactly("AAPL", "VTI");
        assertThat(positions.get(1).getSector()).isEqualTo(Position.UNKNOWN_SECTOR);
        assertThat(positions.get(1).getLastUpdated()).isNotNull();
        assertThat(positionRepository.findByTickerIn(List.of("VTI", "XXX"))).hasSize(1);
    }

    @Test
    void pricesAreReadByWindowAndEvictedByTicker() {
        LocalDate day = LocalDate.of(2024, 1, 2);
        for (int i = 0; i < 5; i++) {
            entityManager.persist(HistoricalPrice.builder()
                    .ticker("SPY").tradeDate(day.plusDays(i))
                    .open(470).high(472).low(468).close(470 + i).volume(1_000L)
                    .build());
        }
        entityManager.persist(HistoricalPrice.builder()
                .ticker("QQQ").tradeDate(day).open(400).high(401).low(399).close(400).volume(10L)
                .build());
        entityManager.flush();

        assertThat(historicalPriceRepository.findByTickerAndTradeDateBetweenOrderByTradeDateAsc("SPY", day.plusDays(1), day.plusDays(3)))
                .extracting(HistoricalPrice::getClose)
                .containsExactly(471.0, 472.0, 473.0);
        assertThat(historicalPriceRepository.deleteByTicker("SPY")).isEqualTo(5L);
        assertThat(historicalPriceRepository.findAll()).extracting(HistoricalPrice::getTicker).containsExactly("QQQ");
    }
}
