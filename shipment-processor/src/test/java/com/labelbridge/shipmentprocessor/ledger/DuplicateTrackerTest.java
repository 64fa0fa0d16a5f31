package com.labelbridge.shipmentprocessor.ledger;

import com.labelbridge.shipmentprocessor.domain.PreparedShipment;
import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;
import com.labelbridge.shipmentprocessor.upload.SimulatedCarrier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuplicateTrackerTest {

    private InMemoryLedgerStore store;
    private DuplicateTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        tracker = new DuplicateTracker(store);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Admission
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("First sighting is admitted, a second admit of the same fingerprint is skipped")
    void admit_onlyOnce() {
        assertThat(tracker.admit("fp-1")).isEqualTo(Admission.admit(null));
        assertThat(tracker.admit("fp-1")).isEqualTo(Admission.skip(LedgerStatus.PENDING));
    }

    @Test
    @DisplayName("Two concurrent admits of one fingerprint: exactly one wins")
    void admit_concurrentCallersGetOneWinner() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int round = 0; round < 200; round++) {
                String fingerprint = "fp-race-" + round;
                CountDownLatch start = new CountDownLatch(1);
                List<Future<Admission>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    Callable<Admission> call = () -> {
                        start.await();
                        return tracker.admit(fingerprint);
                    };
                    futures.add(pool.submit(call));
                }
                start.countDown();
                int winners = 0;
                for (Future<Admission> f : futures) {
                    if (f.get(5, TimeUnit.SECONDS).admitted()) {
                        winners++;
                    }
                }
                assertThat(winners).as("round %d", round).isEqualTo(1);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("PENDING is never written to the ledger")
    void admit_doesNotPersist() {
        tracker.admit("fp-1");

        assertThat(store.appended()).isEmpty();
    }

    @Test
    void release_forgetsFirstSighting() {
        tracker.admit("fp-1");
        tracker.release(List.of("fp-1"));

        assertThat(tracker.find("fp-1")).isEmpty();
        assertThat(tracker.admit("fp-1").admitted()).isTrue();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Transitions
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("SUBMITTED is persisted before CONFIRMED and CONFIRMED is never admitted again")
    void markSubmittedThenConfirmed() {
        PreparedShipment shipment = shipment("fp-1", "REF-1");
        tracker.admit("fp-1");

        tracker.markSubmitted(List.of(shipment));
        assertThat(store.statusOf("fp-1")).isEqualTo(LedgerStatus.SUBMITTED);
        assertThat(tracker.isInFlight("fp-1")).isTrue();

        tracker.markConfirmed("fp-1", "MI000000001");
        assertThat(store.appended()).extracting(LedgerEntry::getStatus)
                .containsExactly(LedgerStatus.SUBMITTED, LedgerStatus.CONFIRMED);
        assertThat(tracker.isInFlight("fp-1")).isFalse();

        DuplicateTracker restarted = new DuplicateTracker(store);
        assertThat(restarted.admit("fp-1")).isEqualTo(Admission.skip(LedgerStatus.CONFIRMED));
        assertThat(restarted.find("fp-1")).hasValueSatisfying(e -> {
            assertThat(e.getShipmentNumber()).isEqualTo("MI000000001");
            assertThat(e.getReference()).isEqualTo("REF-1");
            assertThat(e.getAttempts()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("FAILED may be admitted again by a later run")
    void failedIsAdmissibleAgain() {
        tracker.admit("fp-1");
        tracker.markSubmitted(List.of(shipment("fp-1", "REF-1")));
        tracker.markFailed("fp-1", "INVALID_POSTAL_CODE");

        DuplicateTracker restarted = new DuplicateTracker(store);
        assertThat(restarted.admit("fp-1")).isEqualTo(Admission.admit(LedgerStatus.FAILED));

        restarted.release(List.of("fp-1"));
        assertThat(restarted.find("fp-1")).hasValueSatisfying(e -> assertThat(e.getStatus()).isEqualTo(LedgerStatus.FAILED));
    }

    @Test
    void markSubmitted_requiresAdmission() {
        assertThatThrownBy(() -> tracker.markSubmitted(List.of(shipment("fp-x", "REF-X"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A failed ledger write leaves the in-memory state untouched")
    void markSubmitted_persistenceFailure() {
        tracker.admit("fp-1");
        store.failWith(new LedgerPersistenceException("disk full", null));

        assertThatThrownBy(() -> tracker.markSubmitted(List.of(shipment("fp-1", "REF-1"))))
                .isInstanceOf(LedgerPersistenceException.class);
        assertThat(tracker.find("fp-1")).hasValueSatisfying(e -> assertThat(e.getStatus()).isEqualTo(LedgerStatus.PENDING));
        assertThat(tracker.isInFlight("fp-1")).isFalse();
    }

    @Test
    @DisplayName("Submitted fingerprints are claimed as in flight before SUBMITTED is written")
    void markSubmitted_claimsBeforeWriting() {
        tracker.admit("fp-1");
        List<Boolean> inFlightWhileWriting = new ArrayList<>();
        store.onAppend(() -> inFlightWhileWriting.add(tracker.isInFlight("fp-1")));

        tracker.markSubmitted(List.of(shipment("fp-1", "REF-1")));

        assertThat(inFlightWhileWriting).containsExactly(true);
    }

    @Test
    void markSubmitted_stampsWithTrackerClock() {
        Instant fixed = Instant.parse("2024-03-18T09:30:00Z");
        DuplicateTracker clocked = new DuplicateTracker(store, Clock.fixed(fixed, ZoneOffset.UTC));
        clocked.admit("fp-1");

        clocked.markSubmitted(List.of(shipment("fp-1", "REF-1")));

        assertThat(store.appended()).extracting(LedgerEntry::getUpdatedAt).containsExactly(fixed);
    }

    @Test
    void countByStatus_coversEveryStatus() {
        tracker.admit("fp-1");
        tracker.admit("fp-2");
        tracker.markSubmitted(List.of(shipment("fp-1", "REF-1")));

        Map<LedgerStatus, Long> counts = tracker.countByStatus();

        assertThat(counts).containsEntry(LedgerStatus.PENDING, 1L)
                .containsEntry(LedgerStatus.SUBMITTED, 1L)
                .containsEntry(LedgerStatus.CONFIRMED, 0L)
                .containsEntry(LedgerStatus.FAILED, 0L);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Reconciliation
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Reconcile after a crash: known at carrier is CONFIRMED, unknown is FAILED, query errors stay SUBMITTED")
    void reconcile_resolvesLeftoverSubmissions() {
        InMemoryLedgerStore crashed = new InMemoryLedgerStore(
                submitted("fp-known", "REF-KNOWN"),
                submitted("fp-lost", "REF-LOST"));
        SimulatedCarrier carrier = new SimulatedCarrier().preload("REF-KNOWN");
        DuplicateTracker restarted = new DuplicateTracker(crashed);

        assertThat(restarted.admit("fp-known")).isEqualTo(Admission.skip(LedgerStatus.SUBMITTED));

        ReconciliationReport report = restarted.reconcile(carrier);

        assertThat(report.confirmed()).containsExactly("fp-known");
        assertThat(report.requeued()).containsExactly("fp-lost");
        assertThat(report.unresolved()).isEmpty();
        assertThat(crashed.statusOf("fp-known")).isEqualTo(LedgerStatus.CONFIRMED);
        assertThat(crashed.statusOf("fp-lost")).isEqualTo(LedgerStatus.FAILED);
        assertThat(restarted.admit("fp-known").admitted()).isFalse();
        assertThat(restarted.admit("fp-lost").admitted()).isTrue();
    }

    @Test
    void reconcile_keepsSubmittedWhenCarrierCannotAnswer() {
        InMemoryLedgerStore crashed = new InMemoryLedgerStore(submitted("fp-1", "REF-1"));
        DuplicateTracker restarted = new DuplicateTracker(crashed);

        ReconciliationReport report = restarted.reconcile(new SimulatedCarrier().queriesUnavailable(true));

        assertThat(report.unresolved()).containsExactly("fp-1");
        assertThat(crashed.statusOf("fp-1")).isEqualTo(LedgerStatus.SUBMITTED);
        assertThat(restarted.isInFlight("fp-1")).isFalse();
    }

    @Test
    @DisplayName("Entries an upload in this process is working on are not reconciled")
    void reconcile_skipsInFlightEntries() {
        tracker.admit("fp-1");
        tracker.markSubmitted(List.of(shipment("fp-1", "REF-1")));
        SimulatedCarrier carrier = new SimulatedCarrier();

        ReconciliationReport report = tracker.reconcile(carrier);

        assertThat(report.total()).isZero();
        assertThat(carrier.queries()).isZero();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Helpers
    // ─────────────────────────────────────────────────────────────────────────

    private static PreparedShipment shipment(String fingerprint, String reference) {
        ShipmentRecord record = ShipmentRecord.builder().reference(reference).recipientName("Bar").packageCount(1).build();
        return new PreparedShipment(fingerprint, "source", 2, record);
    }

    private static LedgerEntry submitted(String fingerprint, String reference) {
        return LedgerEntry.builder()
                .fingerprint(fingerprint)
                .status(LedgerStatus.SUBMITTED)
                .reference(reference)
                .attempts(1)
                .updatedAt(Instant.parse("2024-03-18T08:00:00Z"))
                .build();
    }
}
