package com.labelbridge.shipmentprocessor.ledger;

import com.labelbridge.shipmentprocessor.domain.PreparedShipment;
import com.labelbridge.shipmentprocessor.upload.CarrierGateway;
import com.labelbridge.shipmentprocessor.upload.CarrierRejectedException;
import com.labelbridge.shipmentprocessor.upload.CarrierShipmentState;
import com.labelbridge.shipmentprocessor.upload.CarrierUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Gatekeeper between built shipments and the carrier, backed by the durable upload ledger.
 *
 * <h3>Transitions</h3>
 * <pre>
 *   (none) | FAILED ──admit──► PENDING ──markSubmitted──► SUBMITTED ──► CONFIRMED
 *                                 │                          │
 *                              release                       └──────────► FAILED
 * </pre>
 * <ul>
 *   <li>{@link #admit} is atomic per fingerprint: of two concurrent callers exactly one wins.</li>
 *   <li>SUBMITTED is written and forced to disk before the network call, so a crash leaves a
 *       trace. A SUBMITTED entry nobody in this process is working on is resolved by
 *       {@link #reconcile} through a carrier status query, never resent blindly.</li>
 *   <li>CONFIRMED is final.</li>
 * </ul>
 * Writes are serialized on the tracker; reads go straight to the concurrent map.
 */
@Slf4j
public class DuplicateTracker {

    public static final String NOT_FOUND_AT_CARRIER = "NOT_FOUND_AT_CARRIER: no shipment for reference after restart";

    private final LedgerStore store;
    private final Clock clock;
    private final ConcurrentHashMap<String, LedgerEntry> entries;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public DuplicateTracker(LedgerStore store) {
        this(store, Clock.systemUTC());
    }

    public DuplicateTracker(LedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.entries = new ConcurrentHashMap<>(store.loadAll());
        log.info("DuplicateTracker ready: {}", countByStatus());
    }

    // ─── Admission ───────────────────────────────────────────────────────────

    public Admission admit(String fingerprint) {
        AtomicReference<Admission> decision = new AtomicReference<>();
        entries.compute(fingerprint, (key, current) -> {
            if (current == null) {
                decision.set(Admission.admit(null));
                return LedgerEntry.builder().fingerprint(key).status(LedgerStatus.PENDING).updatedAt(now()).build();
            }
            if (current.getStatus() == LedgerStatus.FAILED) {
                decision.set(Admission.admit(LedgerStatus.FAILED));
                return current.toBuilder().status(LedgerStatus.PENDING).updatedAt(now()).build();
            }
            decision.set(Admission.skip(current.getStatus()));
            return current;
        });
        return decision.get();
    }

    /**
     * Gives back admitted fingerprints that were never sent. A previously failed entry returns to
     * FAILED, a first sighting is forgotten.
     */
    public void release(Collection<String> fingerprints) {
        for (String fingerprint : fingerprints) {
            entries.computeIfPresent(fingerprint, (key, current) -> {
                if (current.getStatus() != LedgerStatus.PENDING) {
                    return current;
                }
                return current.getAttempts() > 0 ? current.toBuilder().status(LedgerStatus.FAILED).build() : null;
            });
        }
    }

    // ─── Commits ─────────────────────────────────────────────────────────────

    public synchronized void markSubmitted(List<PreparedShipment> batch) {
        Instant now = now();
        List<LedgerEntry> next = new ArrayList<>(batch.size());
        for (PreparedShipment shipment : batch) {
            LedgerEntry current = entries.get(shipment.fingerprint());
            if (current == null || current.getStatus() != LedgerStatus.PENDING) {
                throw new IllegalStateException("Fingerprint " + shipment.fingerprint() + " was not admitted: " + current);
            }
            next.add(current.toBuilder()
                    .status(LedgerStatus.SUBMITTED)
                    .reference(shipment.reference())
                    .sourceId(shipment.sourceId())
                    .lineNumber(shipment.lineNumber())
                    .attempts(current.getAttempts() + 1)
                    .failureReason(null)
                    .updatedAt(now)
                    .build());
        }
        List<String> fingerprints = next.stream().map(LedgerEntry::getFingerprint).toList();
        // claimed before SUBMITTED becomes visible, so a concurrent reconcile leaves them alone
        inFlight.addAll(fingerprints);
        try {
            commit(next);
        } catch (RuntimeException e) {
            fingerprints.forEach(inFlight::remove);
            throw e;
        }
    }

    public void markConfirmed(String fingerprint, String shipmentNumber) {
        markConfirmed(Collections.singletonMap(fingerprint, shipmentNumber));
    }

    /** @param shipmentNumbers fingerprint to carrier shipment number */
    public synchronized void markConfirmed(Map<String, String> shipmentNumbers) {
        Instant now = now();
        List<LedgerEntry> next = new ArrayList<>(shipmentNumbers.size());
        shipmentNumbers.forEach((fingerprint, number) -> next.add(resolved(fingerprint).toBuilder()
                .status(LedgerStatus.CONFIRMED)
                .shipmentNumber(number)
                .failureReason(null)
                .updatedAt(now)
                .build()));
        commit(next);
        inFlight.removeAll(shipmentNumbers.keySet());
    }

    public void markFailed(String fingerprint, String reason) {
        markFailed(Collections.singletonMap(fingerprint, reason));
    }

    /** @param reasons fingerprint to failure reason */
    public synchronized void markFailed(Map<String, String> reasons) {
        Instant now = now();
        List<LedgerEntry> next = new ArrayList<>(reasons.size());
        reasons.forEach((fingerprint, reason) -> next.add(resolved(fingerprint).toBuilder()
                .status(LedgerStatus.FAILED)
                .failureReason(reason)
                .updatedAt(now)
                .build()));
        commit(next);
        inFlight.removeAll(reasons.keySet());
    }

    /**
     * Stops working on submitted fingerprints whose outcome is unknown. They stay SUBMITTED on
     * disk and are picked up by the next {@link #reconcile}.
     */
    public void leaveUnresolved(Collection<String> fingerprints) {
        if (!fingerprints.isEmpty()) {
            log.warn("{} fingerprint(s) left SUBMITTED with unknown outcome", fingerprints.size());
        }
        inFlight.removeAll(fingerprints);
    }

    // ─── Reconciliation ──────────────────────────────────────────────────────

    /**
     * Re-verifies every SUBMITTED entry that no upload in this process is working on.
     * Found at the carrier means CONFIRMED; unknown means FAILED and therefore admissible again;
     * a failed query leaves the entry SUBMITTED.
     */
    public ReconciliationReport reconcile(CarrierGateway carrier) {
        List<String> stale = entries.values().stream()
                .filter(e -> e.getStatus() == LedgerStatus.SUBMITTED)
                .map(LedgerEntry::getFingerprint)
                .filter(inFlight::add)
                .toList();
        if (stale.isEmpty()) {
            return new ReconciliationReport(List.of(), List.of(), List.of());
        }
        log.info("Reconciling {} SUBMITTED ledger entries against the carrier", stale.size());

        Map<String, String> confirmed = new LinkedHashMap<>();
        Map<String, String> requeued = new LinkedHashMap<>();
        List<String> unresolved = new ArrayList<>();
        for (String fingerprint : stale) {
            String reference = entries.get(fingerprint).getReference();
            if (reference == null) {
                unresolved.add(fingerprint);
                continue;
            }
            try {
                Optional<CarrierShipmentState> state = carrier.queryStatus(reference);
                if (state.isPresent()) {
                    confirmed.put(fingerprint, state.get().shipmentNumber());
                } else {
                    requeued.put(fingerprint, NOT_FOUND_AT_CARRIER);
                }
            } catch (CarrierUnavailableException | CarrierRejectedException e) {
                log.warn("Status query for reference '{}' failed: {}", reference, e.getMessage());
                unresolved.add(fingerprint);
            }
        }

        try {
            markConfirmed(confirmed);
            markFailed(requeued);
        } finally {
            leaveUnresolved(stale.stream().filter(inFlight::contains).toList());
        }
        log.info("Reconciliation done: confirmed={}, requeued={}, unresolved={}",
                confirmed.size(), requeued.size(), unresolved.size());
        return new ReconciliationReport(List.copyOf(confirmed.keySet()), List.copyOf(requeued.keySet()),
                List.copyOf(unresolved));
    }

    // ─── Queries ─────────────────────────────────────────────────────────────

    public Optional<LedgerEntry> find(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    public Map<LedgerStatus, Long> countByStatus() {
        Map<LedgerStatus, Long> counts = new EnumMap<>(LedgerStatus.class);
        for (LedgerStatus status : LedgerStatus.values()) {
            counts.put(status, 0L);
        }
        entries.values().forEach(e -> counts.merge(e.getStatus(), 1L, Long::sum));
        return counts;
    }

    public boolean isInFlight(String fingerprint) {
        return inFlight.contains(fingerprint);
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private LedgerEntry resolved(String fingerprint) {
        LedgerEntry current = entries.get(fingerprint);
        if (current == null || current.getStatus() != LedgerStatus.SUBMITTED) {
            throw new IllegalStateException("Fingerprint " + fingerprint + " is not SUBMITTED: " + current);
        }
        return current;
    }

    private void commit(List<LedgerEntry> next) {
        if (next.isEmpty()) {
            return;
        }
        store.append(next);
        next.forEach(e -> entries.put(e.getFingerprint(), e));
    }

    private Instant now() {
        return clock.instant();
    }
}
