package com.ledgerlens.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    static final String USER_HEADER = "X-User-Id";

    @Bean
    public OpenAPI ledgerLensOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("LedgerLens Import API")
                        .description("Bank statement ingestion: CSV, spreadsheet, JSON, text and PDF exports "
                                + "normalized into deduplicated, categorized transactions.")
                        .version("v1"))
                // user identity arrives as a header; authentication is handled upstream
                .components(new Components()
                        .addParameters(USER_HEADER, new HeaderParameter()
                                .name(USER_HEADER)
                                .required(true)
                                .description("UUID of the user owning the imported transactions")
                                .schema(new StringSchema().format("uuid"))));
    }
}
