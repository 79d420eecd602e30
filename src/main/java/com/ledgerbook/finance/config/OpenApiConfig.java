package com.ledgerbook.finance.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI ledgerbookOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Ledgerbook Finance API")
                        .description("Income statement, cashflow statement, expenses and money accounts.")
                        .version("v1")
                        .contact(new Contact()
                                .name("Ledgerbook")
                                .email("support@ledgerbook.dev")
                        )
                );
    }
}
