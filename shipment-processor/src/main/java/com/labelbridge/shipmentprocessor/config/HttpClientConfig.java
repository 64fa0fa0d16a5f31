package com.labelbridge.shipmentprocessor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * One {@link RestClient} per collaborator, each with its own base URL and timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean("geocodingRestClient")
    public RestClient geocodingRestClient(RestClient.Builder builder, ShipmentProperties properties) {
        ShipmentProperties.Geocoding geocoding = properties.getGeocoding();
        return builder.clone()
                .baseUrl(geocoding.getBaseUrl())
                .requestFactory(requestFactory(geocoding.getConnectTimeout(), geocoding.getReadTimeout()))
                .build();
    }

    @Bean("labelServiceRestClient")
    public RestClient labelServiceRestClient(RestClient.Builder builder, ShipmentProperties properties) {
        ShipmentProperties.Carrier carrier = properties.getCarrier();
        return builder.clone()
                .baseUrl(carrier.getBaseUrl())
                .requestFactory(requestFactory(carrier.getConnectTimeout(), carrier.getReadTimeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
