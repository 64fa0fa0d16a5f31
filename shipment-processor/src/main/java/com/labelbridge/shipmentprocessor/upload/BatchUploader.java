package com.labelbridge.shipmentprocessor.upload;

import com.labelbridge.shipmentprocessor.domain.CarrierFieldLimits;
import com.labelbridge.shipmentprocessor.domain.PreparedShipment;
import com.labelbridge.shipmentprocessor.ledger.DuplicateTracker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sends admitted shipments to the carrier in batches of at most 400, one batch at a time.
 *
 * <h3>Per batch</h3>
 * <ol>
 *   <li>The ledger records every member as SUBMITTED (forced to disk).</li>
 *   <li>Attempt 1 submits the batch. Accepted records are CONFIRMED, business rejections FAILED.</li>
 *   <li>Records still open (temporary failure, missing outcome, transport error) are retried by
 *       the carrier {@link Retry} with exponential backoff and jitter. Each later attempt first
 *       asks the carrier about every open record by reference and only resubmits those the
 *       carrier does not know, so a record is never created twice.</li>
 *   <li>Records still open when attempts run out stay SUBMITTED and are reported unresolved.</li>
 * </ol>
 * A submit rejected as a whole ({@link CarrierRejectedException}) fails all its open records. A
 * refused status query does not: the records it was asked about stay SUBMITTED.
 * The stop signal is checked between batches only; a started batch always runs to an outcome.
 */
@Slf4j
public class BatchUploader {

    private final CarrierGateway carrier;
    private final DuplicateTracker tracker;
    private final Retry retry;
    private final int batchSize;

    public BatchUploader(CarrierGateway carrier, DuplicateTracker tracker, Retry retry, int batchSize) {
        this.carrier = carrier;
        this.tracker = tracker;
        this.retry = retry;
        this.batchSize = Math.max(1, Math.min(batchSize, CarrierFieldLimits.MAX_BATCH_SIZE));
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * @param admitted      shipments already admitted by the {@link DuplicateTracker}, in input order
     * @param stopRequested polled before each batch
     */
    public UploadReport upload(List<PreparedShipment> admitted, BooleanSupplier stopRequested) {
        requireUniqueReferences(admitted);
        List<List<PreparedShipment>> batches = partition(admitted, batchSize);
        UploadReport report = new UploadReport();
        log.info("Uploading {} shipments in {} batch(es) of at most {}", admitted.size(), batches.size(), batchSize);

        int started = 0;
        try {
            for (List<PreparedShipment> batch : batches) {
                if (stopRequested.getAsBoolean()) {
                    log.warn("Stop requested, {} batch(es) not dispatched", batches.size() - started);
                    report.cancelled();
                    break;
                }
                started++;
                dispatch(started, batches.size(), batch, report);
            }
        } finally {
            List<String> notStarted = batches.subList(started, batches.size()).stream()
                    .flatMap(List::stream)
                    .map(PreparedShipment::fingerprint)
                    .toList();
            if (!notStarted.isEmpty()) {
                tracker.release(notStarted);
                report.released(notStarted);
            }
        }

        log.info("Upload finished: confirmed={}, failed={}, unresolved={}, released={}",
                report.getConfirmed().size(), report.getFailed().size(),
                report.getUnresolved().size(), report.getReleased().size());
        return report;
    }

    /** Consecutive slices of {@code size}, order preserved; the last one may be shorter. */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        List<List<T>> slices = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            slices.add(List.copyOf(items.subList(from, Math.min(from + size, items.size()))));
        }
        return slices;
    }

    // ─── One batch ───────────────────────────────────────────────────────────

    private void dispatch(int number, int total, List<PreparedShipment> batch, UploadReport report) {
        report.batchDispatched(batch.size());
        try {
            tracker.markSubmitted(batch);
        } catch (RuntimeException e) {
            List<String> fingerprints = batch.stream().map(PreparedShipment::fingerprint).toList();
            tracker.release(fingerprints);
            report.released(fingerprints);
            throw e;
        }

        Map<String, PreparedShipment> open = new LinkedHashMap<>();
        batch.forEach(s -> open.put(s.fingerprint(), s));
        AtomicInteger attempts = new AtomicInteger();
        try {
            retry.executeRunnable(() -> attempt(attempts.incrementAndGet(), open, report));
            log.info("Batch {}/{} done: {} records in {} attempt(s)", number, total, batch.size(), attempts.get());
        } catch (CarrierRejectedException e) {
            log.warn("Batch {}/{} rejected by carrier: {}", number, total, e.getMessage());
            Map<String, String> reasons = new LinkedHashMap<>();
            open.keySet().forEach(fp -> reasons.put(fp, e.getMessage()));
            tracker.markFailed(reasons);
            reasons.forEach(report::failed);
            open.clear();
        } catch (CarrierUnavailableException e) {
            log.warn("Batch {}/{}: {} record(s) unresolved after {} attempt(s): {}",
                    number, total, open.size(), attempts.get(), e.getMessage());
        } finally {
            if (!open.isEmpty()) {
                List<String> fingerprints = List.copyOf(open.keySet());
                tracker.leaveUnresolved(fingerprints);
                report.unresolved(fingerprints);
            }
        }
    }

    private void attempt(int attempt, Map<String, PreparedShipment> open, UploadReport report) {
        if (attempt > 1) {
            Map<String, String> known = new LinkedHashMap<>();
            try {
                for (PreparedShipment shipment : open.values()) {
                    carrier.queryStatus(shipment.reference())
                            .ifPresent(state -> known.put(shipment.fingerprint(), state.shipmentNumber()));
                }
            } catch (CarrierRejectedException e) {
                // the earlier submit may have reached the carrier: outcome stays unknown
                throw new CarrierUnavailableException("Status query refused on attempt " + attempt + ": "
                        + e.getMessage(), e);
            }
            if (!known.isEmpty()) {
                log.info("Attempt {}: {} record(s) already present at carrier, not resubmitted", attempt, known.size());
                confirm(known, open, report);
            }
            if (open.isEmpty()) {
                return;
            }
        }

        List<CarrierOutcome> outcomes = carrier.submit(open.values().stream().map(PreparedShipment::shipment).toList());
        Map<String, CarrierOutcome> byReference = outcomes.stream()
                .filter(o -> o.reference() != null)
                .collect(Collectors.toMap(CarrierOutcome::reference, Function.identity(), (a, b) -> a));

        Map<String, String> accepted = new LinkedHashMap<>();
        Map<String, String> rejected = new LinkedHashMap<>();
        for (PreparedShipment shipment : open.values()) {
            CarrierOutcome outcome = byReference.get(shipment.reference());
            if (outcome == null || outcome.status() == OutcomeStatus.TEMPORARY_FAILURE) {
                continue;
            }
            if (outcome.status() == OutcomeStatus.ACCEPTED) {
                accepted.put(shipment.fingerprint(), outcome.shipmentNumber());
            } else {
                log.debug("Reference '{}' rejected: {}", shipment.reference(), outcome.describe());
                rejected.put(shipment.fingerprint(), outcome.describe());
            }
        }
        confirm(accepted, open, report);
        if (!rejected.isEmpty()) {
            tracker.markFailed(rejected);
            rejected.forEach(report::failed);
            open.keySet().removeAll(rejected.keySet());
        }

        if (!open.isEmpty()) {
            throw new CarrierUnavailableException(open.size() + " record(s) without a final outcome on attempt " + attempt);
        }
    }

    private void confirm(Map<String, String> shipmentNumbers, Map<String, PreparedShipment> open, UploadReport report) {
        if (shipmentNumbers.isEmpty()) {
            return;
        }
        tracker.markConfirmed(shipmentNumbers);
        shipmentNumbers.forEach((fp, number) ->
                report.confirmed(fp, number, open.remove(fp).shipment().getPackageCount()));
    }

    private static void requireUniqueReferences(List<PreparedShipment> shipments) {
        Set<String> seen = new HashSet<>();
        for (PreparedShipment shipment : shipments) {
            if (!seen.add(shipment.reference())) {
                throw new IllegalArgumentException("Duplicate reference in upload: " + shipment.reference());
            }
        }
    }

    // ─── Close work day ──────────────────────────────────────────────────────

    /** Follow-up to an upload: confirms the site's open shipments at the carrier. */
    public WorkDayClosure closeWorkDay(String site) {
        log.info("Closing work day for site '{}'", site);
        WorkDayClosure closure = carrier.confirmOpenShipments(site);
        log.info("Work day closed for site '{}': {} shipment(s)", site, closure.closedShipments());
        return closure;
    }
}
