package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import com.labelbridge.shipmentprocessor.domain.PreparedShipment;
import com.labelbridge.shipmentprocessor.ledger.LedgerStatus;
import com.labelbridge.shipmentprocessor.ledger.ReconciliationReport;
import com.labelbridge.shipmentprocessor.shipment.ReferenceGenerator;
import com.labelbridge.shipmentprocessor.upload.UploadReport;
import com.labelbridge.shipmentprocessor.upload.WorkDayClosure;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory state of one job execution, shared by its steps.
 *
 * <p>Partition workers stage prepared shipments here concurrently; the upload step then reads
 * them back in line order. Nothing here is persisted: the durable state is the upload ledger.
 */
@Getter
public class ShipmentRun {

    private final long jobExecutionId;
    private final InputSource source;
    private final ReferenceGenerator references;
    private final Integer manualPackageCount;
    private final BigDecimal manualWeightKg;

    private final ConcurrentSkipListMap<Integer, PreparedShipment> staged = new ConcurrentSkipListMap<>();
    private final Map<FailureKind, AtomicLong> rejected = new ConcurrentHashMap<>();
    private final Map<LedgerStatus, AtomicLong> skipped = new ConcurrentHashMap<>();

    private volatile ReconciliationReport reconciliation;
    private volatile UploadReport uploadReport;
    private volatile WorkDayClosure workDayClosure;

    public ShipmentRun(long jobExecutionId, InputSource source, ReferenceGenerator references,
                       Integer manualPackageCount, BigDecimal manualWeightKg) {
        this.jobExecutionId = jobExecutionId;
        this.source = source;
        this.references = references;
        this.manualPackageCount = manualPackageCount;
        this.manualWeightKg = manualWeightKg;
    }

    public LayoutKind getLayout() {
        return source.layout();
    }

    public String getSourceId() {
        return source.sourceId();
    }

    // ─── Preparation ─────────────────────────────────────────────────────────

    public void stage(PreparedShipment shipment) {
        staged.put(shipment.lineNumber(), shipment);
    }

    public List<PreparedShipment> stagedInOrder() {
        return List.copyOf(staged.values());
    }

    public void rejected(FailureKind kind) {
        rejected.computeIfAbsent(kind, k -> new AtomicLong()).incrementAndGet();
    }

    // ─── Upload ──────────────────────────────────────────────────────────────

    /** A staged shipment the ledger would not admit, by the status it already had. */
    public void skipped(LedgerStatus status) {
        skipped.computeIfAbsent(status, k -> new AtomicLong()).incrementAndGet();
    }

    public void recordReconciliation(ReconciliationReport report) {
        this.reconciliation = report;
    }

    public void recordUpload(UploadReport report) {
        this.uploadReport = report;
    }

    public void recordWorkDayClosure(WorkDayClosure closure) {
        this.workDayClosure = closure;
    }

    public long confirmedCount() {
        return uploadReport == null ? 0 : uploadReport.getConfirmed().size();
    }

    public RunSummary summary() {
        Map<FailureKind, Long> rejectedByKind = new EnumMap<>(FailureKind.class);
        rejected.forEach((kind, count) -> rejectedByKind.put(kind, count.get()));
        UploadReport upload = uploadReport != null ? uploadReport : new UploadReport();

        return RunSummary.builder()
                .sourceId(getSourceId())
                .layout(getLayout())
                .prepared(staged.size())
                .rejectedByKind(rejectedByKind)
                .alreadyConfirmed(count(skipped, LedgerStatus.CONFIRMED))
                .inProgressElsewhere(count(skipped, LedgerStatus.PENDING))
                .awaitingReconciliation(count(skipped, LedgerStatus.SUBMITTED))
                .confirmed(upload.getConfirmed().size())
                .carrierFailed(upload.getFailed().size())
                .unresolved(upload.getUnresolved().size())
                .released(upload.getReleased().size())
                .batches(upload.getBatchSizes().size())
                .confirmedPackages(upload.getConfirmedPackages())
                .reconciled(reconciliation == null ? 0 : reconciliation.total())
                .cancelled(upload.isCancelled())
                .workDayClosed(workDayClosure != null)
                .build();
    }

    private static <K> long count(Map<K, AtomicLong> counters, K key) {
        AtomicLong counter = counters.get(key);
        return counter == null ? 0 : counter.get();
    }
}
