package com.labelbridge.shipmentprocessor.upload;

import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory carrier with scriptable failures.
 *
 * <ul>
 *   <li>{@link #rejectReference}: business rejection for one record</li>
 *   <li>{@link #temporarilyFail}: TEMPORARY_FAILURE outcome for one record, {@code n} times</li>
 *   <li>{@link #failNextSubmits}: the next {@code n} submits throw before storing anything</li>
 *   <li>{@link #loseNextResponses}: the next {@code n} submits store the batch, then throw</li>
 *   <li>{@link #rejectNextSubmit}: the next submit is refused as a whole</li>
 *   <li>{@link #refuseQueries}: every status query is refused with a business error</li>
 * </ul>
 */
public class SimulatedCarrier implements CarrierGateway {

    private final String site;
    private final Map<String, CarrierShipmentState> shipments = new LinkedHashMap<>();
    private final Map<String, Integer> submissionsByReference = new HashMap<>();
    private final Set<String> rejectedReferences = new HashSet<>();
    private final Map<String, Integer> temporaryFailures = new HashMap<>();
    private final List<Integer> submittedBatchSizes = new ArrayList<>();
    private int failNextSubmits;
    private int loseNextResponses;
    private CarrierRejectedException nextRejection;
    private boolean queriesUnavailable;
    private String queryRefusal;
    private int queries;
    private long sequence;

    public SimulatedCarrier(String site) {
        this.site = site;
    }

    public SimulatedCarrier() {
        this("MI");
    }

    // ─── scripting ───────────────────────────────────────────────────────────

    public synchronized SimulatedCarrier rejectReference(String reference) {
        rejectedReferences.add(reference);
        return this;
    }

    public synchronized SimulatedCarrier temporarilyFail(String reference, int times) {
        temporaryFailures.put(reference, times);
        return this;
    }

    public synchronized SimulatedCarrier failNextSubmits(int times) {
        failNextSubmits = times;
        return this;
    }

    public synchronized SimulatedCarrier loseNextResponses(int times) {
        loseNextResponses = times;
        return this;
    }

    public synchronized SimulatedCarrier rejectNextSubmit(String errorCode, String message) {
        nextRejection = new CarrierRejectedException(errorCode, message);
        return this;
    }

    public synchronized SimulatedCarrier queriesUnavailable(boolean unavailable) {
        queriesUnavailable = unavailable;
        return this;
    }

    public synchronized SimulatedCarrier refuseQueries(String errorCode) {
        queryRefusal = errorCode;
        return this;
    }

    /** A shipment the carrier already holds, e.g. created by a run that crashed. */
    public synchronized SimulatedCarrier preload(String reference) {
        store(reference);
        return this;
    }

    // ─── CarrierGateway ──────────────────────────────────────────────────────

    @Override
    public synchronized List<CarrierOutcome> submit(List<ShipmentRecord> batch) {
        if (batch.size() > 400) {
            throw new CarrierRejectedException("BATCH_SIZE_EXCEEDED", batch.size() + " parcels");
        }
        if (nextRejection != null) {
            CarrierRejectedException rejection = nextRejection;
            nextRejection = null;
            throw rejection;
        }
        if (failNextSubmits > 0) {
            failNextSubmits--;
            throw new CarrierUnavailableException("simulated connection reset");
        }
        submittedBatchSizes.add(batch.size());

        List<CarrierOutcome> outcomes = new ArrayList<>(batch.size());
        for (ShipmentRecord record : batch) {
            String reference = record.getReference();
            submissionsByReference.merge(reference, 1, Integer::sum);
            int pending = temporaryFailures.getOrDefault(reference, 0);
            if (pending > 0) {
                temporaryFailures.put(reference, pending - 1);
                outcomes.add(new CarrierOutcome(reference, null, OutcomeStatus.TEMPORARY_FAILURE, "SERVICE_BUSY", "retry"));
            } else if (rejectedReferences.contains(reference)) {
                outcomes.add(new CarrierOutcome(reference, null, OutcomeStatus.REJECTED, "INVALID_POSTAL_CODE",
                        "postal code not served"));
            } else if (shipments.containsKey(reference)) {
                outcomes.add(new CarrierOutcome(reference, null, OutcomeStatus.REJECTED, "DUPLICATE_REFERENCE",
                        "reference already used"));
            } else {
                outcomes.add(new CarrierOutcome(reference, store(reference).shipmentNumber(), OutcomeStatus.ACCEPTED,
                        null, null));
            }
        }
        if (loseNextResponses > 0) {
            loseNextResponses--;
            throw new CarrierUnavailableException("simulated read timeout after the carrier stored the batch");
        }
        return outcomes;
    }

    @Override
    public synchronized Optional<CarrierShipmentState> queryStatus(String reference) {
        queries++;
        if (queriesUnavailable) {
            throw new CarrierUnavailableException("simulated status query timeout");
        }
        if (queryRefusal != null) {
            throw new CarrierRejectedException(queryRefusal, "status query forbidden");
        }
        return Optional.ofNullable(shipments.get(reference));
    }

    @Override
    public synchronized WorkDayClosure confirmOpenShipments(String site) {
        int closed = 0;
        for (Map.Entry<String, CarrierShipmentState> e : shipments.entrySet()) {
            CarrierShipmentState state = e.getValue();
            if ("OPEN".equals(state.status())) {
                e.setValue(new CarrierShipmentState(state.reference(), state.shipmentNumber(), "CLOSED"));
                closed++;
            }
        }
        return new WorkDayClosure(site, closed, closed + " parcels closed");
    }

    // ─── inspection ──────────────────────────────────────────────────────────

    public synchronized int shipmentCount() {
        return shipments.size();
    }

    public synchronized int submissionsOf(String reference) {
        return submissionsByReference.getOrDefault(reference, 0);
    }

    public synchronized List<Integer> submittedBatchSizes() {
        return List.copyOf(submittedBatchSizes);
    }

    public synchronized int queries() {
        return queries;
    }

    public synchronized Optional<CarrierShipmentState> shipment(String reference) {
        return Optional.ofNullable(shipments.get(reference));
    }

    private CarrierShipmentState store(String reference) {
        CarrierShipmentState state = new CarrierShipmentState(reference, "%s%09d".formatted(site, ++sequence), "OPEN");
        shipments.put(reference, state);
        return state;
    }
}
