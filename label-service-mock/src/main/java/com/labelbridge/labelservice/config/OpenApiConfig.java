package com.labelbridge.labelservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8083}")
    private String serverPort;

    @Bean
    public OpenAPI labelServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Label Service Mock API")
                        .description("""
                                In-memory stand-in for the carrier label service.
                                
                                **Features:**
                                - Batch parcel submission (at most **400** parcels per call) with one outcome per parcel.
                                - Parcel lookup by reference, used by the uploader to resolve unknown outcomes.
                                - Work-day closing: every open parcel of a site becomes final.
                                - Each request incurs a configurable simulated latency (default **200 ms**).
                                
                                **Parcel outcomes:**
                                - `ACCEPTED`: parcel stored, shipment number assigned
                                - `REJECTED`: business error (`DUPLICATE_REFERENCE`, `INVALID_CONTRACT_CODE`, `FIELD_TOO_LONG`, ...)
                                - `TEMPORARY_FAILURE`: not stored, safe to resend
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
