package com.folio.backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.folio.backend.exception.DataUnavailableException;
import com.folio.backend.model.PriceBar;
import com.folio.backend.service.marketdata.MarketDataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AnalyticsControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private MarketDataProvider marketDataProvider;

    @BeforeEach
    void setUp() {
        when(marketDataProvider.getPriceHistory(anyString(), any(), any())).thenAnswer(invocation -> {
            String ticker = invocation.getArgument(0);
            LocalDate end = invocation.getArgument(2);
            return switch (ticker) {
                case "AAA" -> trailingBars(end, 30, 100.0, 0.010);
                case "BBB" -> trailingBars(end, 30, 50.0, -0.004);
                case "WKD" -> offsetBars(end);
                default -> throw new DataUnavailableException(ticker, "No price history for " + ticker);
            };
        });
    }

    @Test
    void performanceReportDegradesWithoutBenchmark() throws Exception {
        long id = createPortfolio();
        addStock(id, "AAA", 0.5);
        addStock(id, "BBB", 0.5);
        addStock(id, "GHOST", 0.0);

        mockMvc.perform(get("/api/analytics/portfolios/{id}/performance", id).param("riskFreeRate", "0.03"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.portfolioId").value(id))
                .andExpect(jsonPath("$.observations").value(29))
                .andExpect(jsonPath("$.unavailableTickers[0]").value("GHOST"))
                .andExpect(jsonPath("$.metrics.beta.status").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.metrics.alpha.status").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.riskMetrics.trackingError.status").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.metrics.totalReturn").isNumber())
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void performanceWithoutAnyDataIsUnprocessable() throws Exception {
        long id = createPortfolio();
        addStock(id, "GHOST", 1.0);

        mockMvc.perform(get("/api/analytics/portfolios/{id}/performance", id))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_DATA"));
    }

    @Test
    void unknownPortfolioIsNotFound() throws Exception {
        mockMvc.perform(get("/api/analytics/portfolios/{id}/performance", 987654))
                .andExpect(status().isNotFound());
    }

    @Test
    void compareTwoPortfolios() throws Exception {
        long first = createPortfolio();
        addStock(first, "AAA", 1.0);
        long second = createPortfolio();
        addStock(second, "BBB", 1.0);

        String body = "{\"portfolioIds\":[" + first + "," + second + "]}";
        mockMvc.perform(post("/api/analytics/portfolios/compare").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows.length()").value(2))
                .andExpect(jsonPath("$.correlationMatrix[0][0]").value(1.0))
                .andExpect(jsonPath("$.skippedPortfolioIds").isEmpty());
    }

    @Test
    void compareNeedsTwoPortfolios() throws Exception {
        mockMvc.perform(post("/api/analytics/portfolios/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"portfolioIds\":[1]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void ratioOfTwoTickers() throws Exception {
        String json = mockMvc.perform(get("/api/analytics/ratio")
                        .param("tickerA", "aaa")
                        .param("tickerB", "BBB")
                        .param("lookbackDays", "60"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tickerA").value("AAA"))
                .andExpect(jsonPath("$.movingAverageWindow").value(20))
                .andExpect(jsonPath("$.points.length()").value(30))
                .andExpect(jsonPath("$.points[0].movingAverage").value(nullValue()))
                .andExpect(jsonPath("$.points[19].movingAverage").isNumber())
                .andReturn().getResponse().getContentAsString();

        JsonNode root = objectMapper.readTree(json);
        assertThat(root.has("zScore")).isTrue();
        JsonNode last = root.path("points").path(29);
        assertThat(root.path("currentRatio").asDouble()).isEqualTo(last.path("ratio").asDouble());
    }

    @Test
    void ratioOfDisjointCalendarsIsNoOverlap() throws Exception {
        mockMvc.perform(get("/api/analytics/ratio").param("tickerA", "AAA").param("tickerB", "WKD"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("NO_OVERLAP"));
    }

    @Test
    void ratioOfUnknownTickerIsNotFound() throws Exception {
        mockMvc.perform(get("/api/analytics/ratio").param("tickerA", "AAA").param("tickerB", "NOPE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("DATA_UNAVAILABLE"));
    }

    @Test
    void rebalanceRejectsOverAllocationAndKeepsWeights() throws Exception {
        long id = createPortfolio();
        addStock(id, "AAA", 0.5);
        addStock(id, "BBB", 0.5);

        mockMvc.perform(put("/api/portfolios/{id}/allocations", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weights\":{\"AAA\":0.6,\"BBB\":0.5}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("ALLOCATION_INVALID"))
                .andExpect(jsonPath("$.details").isNotEmpty());

        mockMvc.perform(get("/api/portfolios/{id}/allocations", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].weight").value(0.5))
                .andExpect(jsonPath("$[1].weight").value(0.5));
    }

    @Test
    void rebalanceUpsertsSuppliedWeights() throws Exception {
        long id = createPortfolio();
        addStock(id, "AAA", 0.5);
        addStock(id, "BBB", 0.5);

        mockMvc.perform(put("/api/portfolios/{id}/allocations", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weights\":{\"AAA\":0.75,\"CCC\":0.25}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].ticker").value("AAA"))
                .andExpect(jsonPath("$[0].weight").value(0.75))
                .andExpect(jsonPath("$[1].weight").value(0.5))
                .andExpect(jsonPath("$[2].ticker").value("CCC"));
    }

    @Test
    void duplicatePortfolioNameIsConflict() throws Exception {
        String name = "dup-" + UUID.randomUUID();
        String body = "{\"name\":\"" + name + "\"}";
        mockMvc.perform(post("/api/portfolios").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/portfolios").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict());
    }

    @Test
    void positionIsPricedFromProvider() throws Exception {
        mockMvc.perform(post("/api/positions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticker\":\"aaa\",\"shares\":3,\"sector\":\"Tech\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ticker").value("AAA"))
                .andExpect(jsonPath("$.currentPrice").isNumber());

        mockMvc.perform(post("/api/positions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticker\":\"NOPE\",\"shares\":1}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void historyIsServedForKnownTicker() throws Exception {
        mockMvc.perform(get("/api/market-data/{ticker}/history", "BBB"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(30));
    }

    private long createPortfolio() throws Exception {
        String body = objectMapper.writeValueAsString(
                Map.of("name", "portfolio-" + UUID.randomUUID(), "description", "test"));
        String json = mockMvc.perform(post("/api/portfolios").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(json).path("id").asLong();
    }

    private void addStock(long id, String ticker, double allocation) throws Exception {
        mockMvc.perform(post("/api/portfolios/{id}/stocks", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticker\":\"" + ticker + "\",\"allocation\":" + allocation + "}"))
                .andExpect(status().isOk());
    }

    private static List<PriceBar> trailingBars(LocalDate end, int count, double startPrice, double drift) {
        List<PriceBar> bars = new ArrayList<>();
        double price = startPrice;
        for (int i = count - 1; i >= 0; i--) {
            double wobble = (i % 3 == 0) ? -0.5 * drift : drift;
            price = price * (1.0 + wobble);
            bars.add(PriceBar.builder().date(end.minusDays(i)).open(price).high(price).low(price)
                    .close(price).volume(1_000L).build());
        }
        return bars;
    }

    private static List<PriceBar> offsetBars(LocalDate end) {
        // dates that never coincide with trailingBars: before its 30-day window
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 40; i < 45; i++) {
            bars.add(PriceBar.builder().date(end.minusDays(i)).open(10).high(10).low(10).close(10).volume(1L).build());
        }
        return bars;
    }
}
