package com.folio.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.folio.backend.exception.DataUnavailableException;
import com.folio.backend.exception.MarketDataApiException;
import com.folio.backend.model.PriceBar;
import com.folio.backend.service.MarketDataHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Reads daily OHLCV history from a Yahoo-style chart endpoint
 * ({@code /v8/finance/chart/{ticker}}).
 */
@Slf4j
@Service
public class YahooChartMarketDataProvider implements MarketDataProvider {

    private final MarketDataHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public YahooChartMarketDataProvider(MarketDataHttpClient httpClient,
                                        ObjectMapper objectMapper,
                                        @Value("${market-data.base-url:https://query1.finance.yahoo.com}") String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public List<PriceBar> getPriceHistory(String ticker, LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new DataUnavailableException(ticker, "Empty window " + start + ".." + end + " for " + ticker);
        }
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/v8/finance/chart/{ticker}")
                .queryParam("period1", start.atStartOfDay(ZoneOffset.UTC).toEpochSecond())
                .queryParam("period2", end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond())
                .queryParam("interval", "1d")
                .queryParam("events", "history")
                .buildAndExpand(ticker)
                .toUriString();

        String body;
        try {
            body = httpClient.get(url);
        } catch (MarketDataApiException e) {
            throw new DataUnavailableException(ticker, "No market data for " + ticker + ": " + e.getMessage(), e);
        }

        List<PriceBar> bars = parse(ticker, body).stream()
                .filter(bar -> !bar.getDate().isBefore(start) && !bar.getDate().isAfter(end))
                .toList();
        if (bars.isEmpty()) {
            throw new DataUnavailableException(ticker, "No price history for " + ticker + " between " + start + " and " + end);
        }
        log.debug("Fetched {} bars for {} ({}..{})", bars.size(), ticker, start, end);
        return bars;
    }

    List<PriceBar> parse(String ticker, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new DataUnavailableException(ticker, "Malformed market data payload for " + ticker, e);
        }
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new DataUnavailableException(ticker, "Provider error for " + ticker + ": "
                    + error.path("description").asText(error.path("code").asText("unknown")));
        }
        JsonNode result = chart.path("result").path(0);
        if (result.isMissingNode() || result.isNull()) {
            return List.of();
        }
        ZoneId zone = resolveZone(result.path("meta").path("exchangeTimezoneName").asText(null));
        JsonNode timestamps = result.path("timestamp");
        JsonNode quote = result.path("indicators").path("quote").path(0);

        // later bars win when two timestamps fall on the same exchange date
        TreeMap<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode close = quote.path("close").path(i);
            if (close.isMissingNode() || close.isNull()) {
                continue;
            }
            LocalDate date = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            double closeValue = close.asDouble();
            byDate.put(date, PriceBar.builder()
                    .date(date)
                    .open(valueOr(quote.path("open").path(i), closeValue))
                    .high(valueOr(quote.path("high").path(i), closeValue))
                    .low(valueOr(quote.path("low").path(i), closeValue))
                    .close(closeValue)
                    .volume(quote.path("volume").path(i).asLong(0))
                    .build());
        }
        return new ArrayList<>(byDate.values());
    }

    private double valueOr(JsonNode node, double fallback) {
        return node.isMissingNode() || node.isNull() ? fallback : node.asDouble();
    }

    private ZoneId resolveZone(String zoneName) {
        if (zoneName == null || zoneName.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zoneName);
        } catch (DateTimeException e) {
            log.debug("Unknown exchange time zone {}, using UTC", zoneName);
            return ZoneOffset.UTC;
        }
    }
}
