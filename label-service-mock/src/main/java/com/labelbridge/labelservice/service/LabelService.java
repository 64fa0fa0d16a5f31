package com.labelbridge.labelservice.service;

import com.labelbridge.labelservice.config.MockCarrierProperties;
import com.labelbridge.labelservice.config.MockCarrierProperties.CarrierAccount;
import com.labelbridge.labelservice.dto.ParcelBatchRequest;
import com.labelbridge.labelservice.dto.ParcelBatchResponse;
import com.labelbridge.labelservice.dto.ParcelRequest;
import com.labelbridge.labelservice.dto.ParcelResult;
import com.labelbridge.labelservice.dto.ParcelStatusResponse;
import com.labelbridge.labelservice.dto.WorkDayCloseResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * In-memory carrier: stores parcels per site, assigns shipment numbers and closes work days.
 *
 * <p>Every call applies a configurable blocking delay ({@code mock.latency-ms}) to mimic the
 * round-trip of the real label service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LabelService {

    static final String ACCEPTED = "ACCEPTED";
    static final String REJECTED = "REJECTED";
    static final String TEMPORARY_FAILURE = "TEMPORARY_FAILURE";
    static final String OPEN = "OPEN";
    static final String CLOSED = "CLOSED";

    private static final Pattern POSTAL_CODE = Pattern.compile("\\d{5}");

    private final MockCarrierProperties properties;

    /** Keyed by {@code site + "|" + reference}. */
    private final Map<String, StoredParcel> parcels = new ConcurrentHashMap<>();
    private final AtomicLong shipmentSequence = new AtomicLong();
    private final AtomicLong submittedCount = new AtomicLong();

    // ─── Public API ──────────────────────────────────────────────────────────────

    public CarrierAccount authenticate(String site, String customerCode, String password) {
        return properties.getAccounts().stream()
                .filter(a -> a.getSite().equalsIgnoreCase(site)
                        && a.getCustomerCode().equals(customerCode)
                        && Objects.equals(a.getPassword(), password))
                .findFirst()
                .orElseThrow(() -> new CarrierException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS",
                        "Unknown site/customer or wrong password"));
    }

    /**
     * Validates and stores every parcel of the batch independently; one bad parcel never
     * rejects its siblings. A single latency delay covers the whole batch.
     */
    public ParcelBatchResponse submitBatch(CarrierAccount account, ParcelBatchRequest request) {
        applyLatency();
        int size = request.getParcels().size();
        if (size > properties.getMaxBatchSize()) {
            throw new CarrierException(HttpStatus.UNPROCESSABLE_ENTITY, "BATCH_SIZE_EXCEEDED",
                    "Batch of %d parcels exceeds the limit of %d".formatted(size, properties.getMaxBatchSize()));
        }

        boolean contractValid = properties.getContractCodes().contains(request.getContractCode());
        Set<String> seenInBatch = new HashSet<>();
        List<ParcelResult> results = new ArrayList<>(size);
        for (ParcelRequest parcel : request.getParcels()) {
            results.add(submitOne(account.getSite(), parcel, contractValid, seenInBatch));
        }

        int accepted = (int) results.stream().filter(r -> ACCEPTED.equals(r.getStatus())).count();
        int rejected = (int) results.stream().filter(r -> REJECTED.equals(r.getStatus())).count();
        log.info("Batch from site {}: {} parcels, {} accepted, {} rejected", account.getSite(), size, accepted, rejected);
        return ParcelBatchResponse.builder()
                .accepted(accepted)
                .rejected(rejected)
                .results(results)
                .build();
    }

    public ParcelStatusResponse findByReference(CarrierAccount account, String reference) {
        applyLatency();
        StoredParcel parcel = parcels.get(key(account.getSite(), reference));
        if (parcel == null) {
            throw new CarrierException(HttpStatus.NOT_FOUND, "PARCEL_NOT_FOUND",
                    "No parcel with reference '%s' for site %s".formatted(reference, account.getSite()));
        }
        return ParcelStatusResponse.builder()
                .reference(parcel.reference())
                .shipmentNumber(parcel.shipmentNumber())
                .status(parcel.status())
                .build();
    }

    /** Confirms every OPEN parcel of {@code site}; closing a day with nothing open is not an error. */
    public WorkDayCloseResponse closeWorkDay(CarrierAccount account, String site) {
        applyLatency();
        if (!account.getSite().equalsIgnoreCase(site)) {
            throw new CarrierException(HttpStatus.FORBIDDEN, "SITE_MISMATCH",
                    "Credentials of site %s cannot close site %s".formatted(account.getSite(), site));
        }
        int closed = 0;
        for (Map.Entry<String, StoredParcel> e : parcels.entrySet()) {
            StoredParcel parcel = e.getValue();
            if (parcel.site().equalsIgnoreCase(site) && OPEN.equals(parcel.status())
                    && parcels.replace(e.getKey(), parcel, parcel.withStatus(CLOSED))) {
                closed++;
            }
        }
        log.info("Work day closed for site {}: {} parcel(s)", site, closed);
        return WorkDayCloseResponse.builder()
                .site(site)
                .closedParcels(closed)
                .message(closed == 0 ? "No open parcels" : "Closed %d parcel(s)".formatted(closed))
                .build();
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    private ParcelResult submitOne(String site, ParcelRequest parcel, boolean contractValid, Set<String> seenInBatch) {
        String reference = parcel.getReference();
        if (!contractValid) {
            return rejected(reference, "INVALID_CONTRACT_CODE", "Contract code is not enabled for this customer");
        }
        if (!seenInBatch.add(reference)) {
            return rejected(reference, "DUPLICATE_REFERENCE", "Reference repeated within the batch");
        }
        String fieldError = fieldError(parcel);
        if (fieldError != null) {
            return rejected(reference, "FIELD_TOO_LONG", fieldError);
        }
        if (parcel.getPostalCode() == null || !POSTAL_CODE.matcher(parcel.getPostalCode()).matches()) {
            return rejected(reference, "INVALID_POSTAL_CODE", "Postal code must be 5 digits: " + parcel.getPostalCode());
        }
        if (parcel.getPackages() <= 0) {
            return rejected(reference, "INVALID_PACKAGES", "Package count must be positive");
        }

        int every = properties.getTemporaryFailureEvery();
        if (every > 0 && submittedCount.incrementAndGet() % every == 0) {
            return ParcelResult.builder()
                    .reference(reference)
                    .status(TEMPORARY_FAILURE)
                    .errorCode("SERVICE_BUSY")
                    .message("Parcel not stored, retry later")
                    .build();
        }

        String number = "%s%09d".formatted(site.toUpperCase(), shipmentSequence.incrementAndGet());
        StoredParcel previous = parcels.putIfAbsent(key(site, reference), new StoredParcel(site, reference, number, OPEN));
        if (previous != null) {
            return rejected(reference, "DUPLICATE_REFERENCE",
                    "Reference already used by shipment " + previous.shipmentNumber());
        }
        return ParcelResult.builder()
                .reference(reference)
                .shipmentNumber(number)
                .status(ACCEPTED)
                .build();
    }

    private String fieldError(ParcelRequest parcel) {
        MockCarrierProperties.FieldLimits limits = properties.getFieldLimits();
        if (tooLong(parcel.getRecipientName(), limits.getRecipientName())) {
            return "recipientName longer than " + limits.getRecipientName();
        }
        if (tooLong(parcel.getAddress(), limits.getAddress())) {
            return "address longer than " + limits.getAddress();
        }
        if (tooLong(parcel.getLocality(), limits.getLocality())) {
            return "locality longer than " + limits.getLocality();
        }
        if (tooLong(parcel.getNotes(), limits.getNotes())) {
            return "notes longer than " + limits.getNotes();
        }
        return null;
    }

    private static boolean tooLong(String value, int max) {
        return value != null && value.length() > max;
    }

    private static ParcelResult rejected(String reference, String errorCode, String message) {
        log.debug("Parcel '{}' rejected: {}", reference, errorCode);
        return ParcelResult.builder()
                .reference(reference)
                .status(REJECTED)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    private static String key(String site, String reference) {
        return site.toUpperCase() + "|" + reference;
    }

    private void applyLatency() {
        long latencyMs = properties.getLatencyMs();
        if (latencyMs <= 0) return;
        try {
            log.trace("Applying simulated latency of {} ms", latencyMs);
            Thread.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Latency simulation interrupted", e);
        }
    }

    private record StoredParcel(String site, String reference, String shipmentNumber, String status) {

        StoredParcel withStatus(String newStatus) {
            return new StoredParcel(site, reference, shipmentNumber, newStatus);
        }
    }
}
