package com.labelbridge.shipmentprocessor.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.labelbridge.shipmentprocessor.address.AddressQuery;
import com.labelbridge.shipmentprocessor.address.GeocodingCandidate;
import com.labelbridge.shipmentprocessor.address.GeocodingProvider;
import com.labelbridge.shipmentprocessor.address.GeocodingStatus;
import com.labelbridge.shipmentprocessor.address.GeocodingUnavailableException;
import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.domain.Confidence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Objects;

/**
 * Google Geocoding API client ({@code GET /maps/api/geocode/json}).
 *
 * <p>Confidence comes from {@code geometry.location_type}: {@code ROOFTOP} and
 * {@code RANGE_INTERPOLATED} are HIGH, {@code GEOMETRIC_CENTER} MEDIUM, {@code APPROXIMATE} LOW;
 * a {@code partial_match} lowers it one level. {@code OVER_QUERY_LIMIT}, {@code UNKNOWN_ERROR},
 * 5xx and I/O errors are transient and raise {@link GeocodingUnavailableException}.
 */
@Slf4j
@Component
public class GoogleGeocodingClient implements GeocodingProvider {

    private static final String PATH = "/maps/api/geocode/json";

    private final RestClient restClient;
    private final ShipmentProperties.Geocoding properties;

    public GoogleGeocodingClient(@Qualifier("geocodingRestClient") RestClient restClient, ShipmentProperties properties) {
        this.restClient = restClient;
        this.properties = properties.getGeocoding();
    }

    @Override
    public GeocodingCandidate geocode(AddressQuery query) {
        String text = query.toSingleLine();
        GeocodeResponse response;
        try {
            response = restClient.get()
                    .uri(b -> b.path(PATH)
                            .queryParam("address", text)
                            .queryParam("language", properties.getLanguage())
                            .queryParam("region", "it")
                            .queryParam("components", "country:IT")
                            .queryParam("key", properties.getApiKey())
                            .build())
                    .retrieve()
                    .body(GeocodeResponse.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429) {
                throw new GeocodingUnavailableException("Geocoding HTTP " + e.getStatusCode().value(), e);
            }
            log.warn("Geocoding request for '{}' refused with HTTP {}", text, e.getStatusCode().value());
            return GeocodingCandidate.failed(GeocodingStatus.INVALID_REQUEST, e.getStatusText());
        } catch (RestClientException e) {
            throw new GeocodingUnavailableException("Geocoding call failed: " + e.getMessage(), e);
        }

        if (response == null || response.status() == null) {
            throw new GeocodingUnavailableException("Empty geocoding response");
        }
        switch (response.status()) {
            case "OK":
                break;
            case "ZERO_RESULTS":
                return GeocodingCandidate.failed(GeocodingStatus.ZERO_RESULTS, response.errorMessage());
            case "REQUEST_DENIED":
                return GeocodingCandidate.failed(GeocodingStatus.REQUEST_DENIED, response.errorMessage());
            case "INVALID_REQUEST":
                return GeocodingCandidate.failed(GeocodingStatus.INVALID_REQUEST, response.errorMessage());
            default:
                // OVER_QUERY_LIMIT, OVER_DAILY_LIMIT, UNKNOWN_ERROR
                throw new GeocodingUnavailableException(response.status()
                        + (response.errorMessage() != null ? ": " + response.errorMessage() : ""));
        }
        if (response.results() == null || response.results().isEmpty()) {
            return GeocodingCandidate.failed(GeocodingStatus.ZERO_RESULTS, null);
        }
        return toCandidate(response.results());
    }

    private GeocodingCandidate toCandidate(List<Result> results) {
        Result best = results.get(0);
        Confidence confidence = confidence(best);
        String locality = longName(best, "locality");
        if (locality == null) {
            locality = longName(best, "administrative_area_level_3");
        }
        return GeocodingCandidate.builder()
                .status(GeocodingStatus.OK)
                .route(longName(best, "route"))
                .streetNumber(longName(best, "street_number"))
                .locality(locality)
                .province(shortName(best, "administrative_area_level_2"))
                .postalCode(longName(best, "postal_code"))
                .confidence(confidence)
                .ambiguous(isAmbiguous(results))
                .formattedAddress(best.formattedAddress())
                .build();
    }

    static Confidence confidence(Result result) {
        String locationType = result.geometry() != null ? result.geometry().locationType() : null;
        Confidence confidence;
        if ("ROOFTOP".equals(locationType) || "RANGE_INTERPOLATED".equals(locationType)) {
            confidence = Confidence.HIGH;
        } else if ("GEOMETRIC_CENTER".equals(locationType)) {
            confidence = Confidence.MEDIUM;
        } else {
            confidence = Confidence.LOW;
        }
        return Boolean.TRUE.equals(result.partialMatch()) ? confidence.lower() : confidence;
    }

    /** Several results that disagree on postal code or municipality. */
    private static boolean isAmbiguous(List<Result> results) {
        if (results.size() < 2) {
            return false;
        }
        Result first = results.get(0);
        Result second = results.get(1);
        return !Objects.equals(longName(first, "postal_code"), longName(second, "postal_code"))
                || !Objects.equals(longName(first, "locality"), longName(second, "locality"));
    }

    private static String longName(Result result, String type) {
        AddressComponent c = component(result, type);
        return c == null ? null : c.longName();
    }

    private static String shortName(Result result, String type) {
        AddressComponent c = component(result, type);
        return c == null ? null : c.shortName();
    }

    private static AddressComponent component(Result result, String type) {
        if (result.addressComponents() == null) {
            return null;
        }
        return result.addressComponents().stream()
                .filter(c -> c.types() != null && c.types().contains(type))
                .findFirst()
                .orElse(null);
    }

    // ─── Response records ────────────────────────────────────────────────────

    public record GeocodeResponse(
            String status,
            List<Result> results,
            @JsonProperty("error_message") String errorMessage) {}

    public record Result(
            @JsonProperty("address_components") List<AddressComponent> addressComponents,
            @JsonProperty("formatted_address") String formattedAddress,
            Geometry geometry,
            @JsonProperty("partial_match") Boolean partialMatch) {}

    public record AddressComponent(
            @JsonProperty("long_name") String longName,
            @JsonProperty("short_name") String shortName,
            List<String> types) {}

    public record Geometry(@JsonProperty("location_type") String locationType) {}
}
