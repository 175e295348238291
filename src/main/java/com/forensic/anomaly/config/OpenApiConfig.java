package com.forensic.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI anomalyServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Transaction Anomaly Service API")
                        .description("Screens batches of financial transactions for duplicate payments, " +
                                "near-duplicate vendors, weekend timing, round amounts, approval-threshold " +
                                "avoidance and leading-digit irregularities.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Forensic Audit Team")
                                .email("audit@example.com")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development server")
                ));
    }
}
