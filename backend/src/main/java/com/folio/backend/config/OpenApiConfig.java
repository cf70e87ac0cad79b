package com.folio.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI folioOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Folio Portfolio Analytics API")
                        .description("Portfolio performance, risk, comparison and trade ratio analytics")
                        .version("1.0"));
    }
}
