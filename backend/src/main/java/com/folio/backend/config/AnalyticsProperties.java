package com.folio.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "analytics")
@Data
@Validated
public class AnalyticsProperties {

    private Performance performance = new Performance();
    private Ratio ratio = new Ratio();
    private Fetch fetch = new Fetch();

    @Data
    public static class Performance {
        private double riskFreeRate = 0.02;

        private double assumedMarketReturn = 0.10;

        @Min(2)
        private int lookbackDays = 365;

        @NotBlank
        private String benchmarkTicker = "SPY";
    }

    @Data
    public static class Ratio {
        @Min(1)
        private int movingAverageWindow = 20;

        @Min(1)
        private int defaultLookbackDays = 365;
    }

    @Data
    public static class Fetch {
        @Min(100)
        private long timeoutMs = 15000;
    }
}
