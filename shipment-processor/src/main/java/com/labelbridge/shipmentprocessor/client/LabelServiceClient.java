package com.labelbridge.shipmentprocessor.client;

import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;
import com.labelbridge.shipmentprocessor.upload.CarrierGateway;
import com.labelbridge.shipmentprocessor.upload.CarrierOutcome;
import com.labelbridge.shipmentprocessor.upload.CarrierRejectedException;
import com.labelbridge.shipmentprocessor.upload.CarrierShipmentState;
import com.labelbridge.shipmentprocessor.upload.CarrierUnavailableException;
import com.labelbridge.shipmentprocessor.upload.OutcomeStatus;
import com.labelbridge.shipmentprocessor.upload.WorkDayClosure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * REST client for the carrier label service.
 *
 * <ul>
 *   <li>{@code POST /api/v1/parcels/batch}: submit up to 400 parcels, one result per parcel</li>
 *   <li>{@code GET  /api/v1/parcels?reference=}: look a parcel up by its Bda reference</li>
 *   <li>{@code POST /api/v1/work-day/close}: confirm the site's open parcels</li>
 * </ul>
 * Credentials travel as headers on every call. 5xx, 429 and I/O errors become
 * {@link CarrierUnavailableException}; other 4xx answers become {@link CarrierRejectedException}
 * carrying the service's error code.
 */
@Slf4j
@Component
public class LabelServiceClient implements CarrierGateway {

    static final String HEADER_SITE = "X-Carrier-Site";
    static final String HEADER_CUSTOMER = "X-Carrier-Customer";
    static final String HEADER_PASSWORD = "X-Carrier-Password";
    static final String PARCEL_NOT_FOUND = "PARCEL_NOT_FOUND";

    private final RestClient restClient;
    private final ShipmentProperties.Carrier carrier;

    public LabelServiceClient(@Qualifier("labelServiceRestClient") RestClient restClient, ShipmentProperties properties) {
        this.restClient = restClient;
        this.carrier = properties.getCarrier();
    }

    @Override
    public List<CarrierOutcome> submit(List<ShipmentRecord> batch) {
        List<ParcelPayload> parcels = batch.stream().map(LabelServiceClient::toPayload).toList();
        ParcelBatchResponse response = call("submit", () -> restClient.post()
                .uri("/api/v1/parcels/batch")
                .headers(this::credentials)
                .body(new ParcelBatchRequest(carrier.getContractCode(), parcels))
                .retrieve()
                .body(ParcelBatchResponse.class));

        if (response == null || response.results() == null) {
            throw new CarrierUnavailableException("Label service returned no results for " + batch.size() + " parcels");
        }
        log.debug("Label service accepted {} / rejected {} of {} parcels",
                response.accepted(), response.rejected(), batch.size());
        return response.results().stream()
                .map(r -> new CarrierOutcome(r.reference(), r.shipmentNumber(), outcomeStatus(r.status()),
                        r.errorCode(), r.message()))
                .toList();
    }

    @Override
    public Optional<CarrierShipmentState> queryStatus(String reference) {
        try {
            ParcelStatusResponse response = call("queryStatus", () -> restClient.get()
                    .uri(b -> b.path("/api/v1/parcels").queryParam("reference", reference).build())
                    .headers(this::credentials)
                    .retrieve()
                    .body(ParcelStatusResponse.class));
            return Optional.ofNullable(response)
                    .map(r -> new CarrierShipmentState(r.reference(), r.shipmentNumber(), r.status()));
        } catch (CarrierRejectedException e) {
            if (PARCEL_NOT_FOUND.equals(e.getErrorCode())) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public WorkDayClosure confirmOpenShipments(String site) {
        WorkDayCloseResponse response = call("closeWorkDay", () -> restClient.post()
                .uri(b -> b.path("/api/v1/work-day/close").queryParam("site", site).build())
                .headers(this::credentials)
                .retrieve()
                .body(WorkDayCloseResponse.class));
        if (response == null) {
            throw new CarrierUnavailableException("Label service returned no close-work-day result");
        }
        return new WorkDayClosure(response.site(), response.closedParcels(), response.message());
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (e.getStatusCode().is5xxServerError() || status == 429) {
                log.warn("Label service {} failed with HTTP {}", operation, status);
                throw new CarrierUnavailableException("Label service " + operation + " HTTP " + status, e);
            }
            ErrorResponse error = e instanceof HttpClientErrorException ? errorBody(e) : null;
            String code = error != null && error.errorCode() != null ? error.errorCode() : "HTTP_" + status;
            String message = error != null && error.message() != null ? error.message() : e.getStatusText();
            throw new CarrierRejectedException(code, message);
        } catch (RestClientException e) {
            log.warn("Label service {} failed: {}", operation, e.getMessage());
            throw new CarrierUnavailableException("Label service " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static ErrorResponse errorBody(RestClientResponseException e) {
        try {
            return e.getResponseBodyAs(ErrorResponse.class);
        } catch (RestClientException | IllegalStateException parseFailure) {
            log.debug("Unreadable error body from label service: {}", e.getResponseBodyAsString());
            return null;
        }
    }

    private void credentials(HttpHeaders headers) {
        headers.set(HEADER_SITE, carrier.getSite());
        headers.set(HEADER_CUSTOMER, carrier.getCustomerCode());
        if (carrier.getPassword() != null) {
            headers.set(HEADER_PASSWORD, carrier.getPassword());
        }
    }

    private static OutcomeStatus outcomeStatus(String status) {
        if (status == null) {
            return OutcomeStatus.TEMPORARY_FAILURE;
        }
        try {
            return OutcomeStatus.valueOf(status);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown parcel status '{}', treating as temporary", status);
            return OutcomeStatus.TEMPORARY_FAILURE;
        }
    }

    private static ParcelPayload toPayload(ShipmentRecord r) {
        return new ParcelPayload(r.getReference(), r.getRecipientName(), r.getAddress(), r.getLocality(),
                r.getProvince(), r.getPostalCode(), r.getPackageCount(), r.getWeightKg(), r.getPortType(),
                r.getPackageType(), r.getShipmentType(), r.getCashOnDeliveryType(), r.getNotes(), r.getPhone(),
                r.getEmail(), r.getPdfFormat());
    }

    // ─── Request / Response records ──────────────────────────────────────────

    public record ParcelPayload(
            String reference,
            String recipientName,
            String address,
            String locality,
            String province,
            String postalCode,
            int packages,
            BigDecimal weightKg,
            String portType,
            String packageType,
            String shipmentType,
            String cashOnDeliveryType,
            String notes,
            String phone,
            String email,
            String pdfFormat) {}

    public record ParcelBatchRequest(String contractCode, List<ParcelPayload> parcels) {}

    public record ParcelResult(
            String reference,
            String shipmentNumber,
            String status,
            String errorCode,
            String message) {}

    public record ParcelBatchResponse(int accepted, int rejected, List<ParcelResult> results) {}

    public record ParcelStatusResponse(String reference, String shipmentNumber, String status) {}

    public record WorkDayCloseResponse(String site, int closedParcels, String message) {}

    public record ErrorResponse(String errorCode, String message) {}
}
