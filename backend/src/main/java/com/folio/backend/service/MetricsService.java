package com.folio.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter benchmarkDegradationsCounter;
    private Counter constituentFailuresCounter;
    private Counter marketDataErrorsCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        benchmarkDegradationsCounter = Counter.builder("benchmark_degradations_total")
                .description("Reports built without benchmark-relative metrics")
                .register(meterRegistry);
        constituentFailuresCounter = Counter.builder("constituent_fetch_failures_total")
                .description("Portfolio constituents dropped from an aggregate because their history was unavailable")
                .register(meterRegistry);
        marketDataErrorsCounter = Counter.builder("market_data_errors_total")
                .register(meterRegistry);
    }

    public <T> T timeReport(String type, Supplier<T> work) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            T result = work.get();
            outcome = "success";
            return result;
        } finally {
            sample.stop(Timer.builder("analytics_report_duration")
                    .tag("type", type)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
            Counter.builder("analytics_reports_total")
                    .tag("type", type)
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .increment();
        }
    }

    public void recordBenchmarkDegradation() {
        if (benchmarkDegradationsCounter != null) {
            benchmarkDegradationsCounter.increment();
        }
    }

    public void recordConstituentFailure() {
        if (constituentFailuresCounter != null) {
            constituentFailuresCounter.increment();
        }
    }

    public void incrementMarketDataErrors() {
        if (marketDataErrorsCounter != null) {
            marketDataErrorsCounter.increment();
        }
    }
}
