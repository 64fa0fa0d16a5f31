package com.labelbridge.shipmentprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
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
    public OpenAPI shipmentProcessorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Shipment Processor API")
                        .description("""
                                Turns shop and agency spreadsheet exports into carrier shipments.
                                
                                **Pipeline:**
                                - Layout detection (OLD, NEW, AGENCY) from the header rows or the file name.
                                - Address normalization through the geocoding provider, with per-row failure kinds.
                                - Abbreviation to the carrier's field widths (street 35, locality 30, notes 40).
                                - Upload in batches of at most 400, with a durable ledger that prevents duplicates
                                  across retries, restarts and concurrent runs.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
