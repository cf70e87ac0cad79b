package com.folio.backend.service;

import com.folio.backend.exception.MarketDataApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * GET-only HTTP access to the market-data provider, guarded by retry and a
 * circuit breaker. Every failure surfaces as {@link MarketDataApiException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataHttpClient {

    private final RestTemplate marketDataRestTemplate;
    private final CircuitBreaker marketDataCircuitBreaker;
    private final Retry marketDataRetry;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    void init() {
        marketDataCircuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Market data circuit {} -> {}",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()));
        Gauge.builder("market_data_circuit_state", marketDataCircuitBreaker, breaker -> mapState(breaker.getState()))
                .register(meterRegistry);
    }

    public String get(String url) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(url);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(marketDataRetry, supplier);
            decorated = CircuitBreaker.decorateSupplier(marketDataCircuitBreaker, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            metricsService.incrementMarketDataErrors();
            log.warn("Market data circuit open, rejecting {}", url);
            throw new MarketDataApiException("Market data circuit breaker open", e);
        } catch (MarketDataApiException e) {
            metricsService.incrementMarketDataErrors();
            log.warn("Market data request failed url={} status={} message={}", url, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (ResourceAccessException | HttpServerErrorException e) {
            metricsService.incrementMarketDataErrors();
            log.warn("Market data request failed after retries url={} message={}", url, e.getMessage());
            throw new MarketDataApiException("Market data provider unreachable: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("market_data_call_latency")
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String url) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, "Mozilla/5.0 (compatible; folio-analytics/1.0)");
        try {
            ResponseEntity<String> response = marketDataRestTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException e) {
            throw new MarketDataApiException("Market data API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        }
    }

    private int mapState(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
            default -> 3;
        };
    }
}
