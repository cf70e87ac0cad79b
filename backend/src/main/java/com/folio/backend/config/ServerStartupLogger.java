package com.folio.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final AnalyticsProperties analyticsProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        String baseUrl = String.format("http://localhost:%d%s", port, contextPath);
        AnalyticsProperties.Performance performance = analyticsProperties.getPerformance();
        log.info("Analytics API listening on {} (docs at {}/swagger-ui.html)", baseUrl, baseUrl);
        log.info("Benchmark {}, lookback {} days, risk-free rate {}, market return {}",
                performance.getBenchmarkTicker(), performance.getLookbackDays(),
                performance.getRiskFreeRate(), performance.getAssumedMarketReturn());
    }
}
