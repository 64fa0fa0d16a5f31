package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.domain.FailureCategory;
import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * End-of-run counts, logged and copied into the job execution context.
 */
@Value
@Builder
public class RunSummary {

    String sourceId;
    LayoutKind layout;
    long prepared;
    Map<FailureKind, Long> rejectedByKind;
    /** Skipped: already CONFIRMED in the ledger. */
    long alreadyConfirmed;
    /** Skipped: admitted by another run still in progress. */
    long inProgressElsewhere;
    /** Skipped: still SUBMITTED after reconciliation could not reach the carrier. */
    long awaitingReconciliation;
    long confirmed;
    long carrierFailed;
    long unresolved;
    long released;
    long batches;
    long confirmedPackages;
    long reconciled;
    boolean cancelled;
    boolean workDayClosed;

    public long rejectedTotal() {
        return rejectedByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    /** Rows the geocoder could not reach; they can be retried as they are. */
    public long providerUnavailable() {
        return rejectedByKind.entrySet().stream()
                .filter(e -> e.getKey().getCategory() == FailureCategory.PROVIDER_UNAVAILABLE)
                .mapToLong(Map.Entry::getValue)
                .sum();
    }

    /** At least one row ended rejected, failed or with an unknown outcome. */
    public boolean hasFailures() {
        return rejectedTotal() > 0 || carrierFailed > 0 || unresolved > 0 || awaitingReconciliation > 0;
    }

    public String describe() {
        return ("source=%s layout=%s prepared=%d rejected=%d %s confirmed=%d packages=%d batches=%d "
                + "carrierFailed=%d unresolved=%d alreadyConfirmed=%d inProgressElsewhere=%d "
                + "awaitingReconciliation=%d released=%d reconciled=%d cancelled=%s workDayClosed=%s")
                .formatted(sourceId, layout, prepared, rejectedTotal(), rejectedByKind, confirmed, confirmedPackages,
                        batches, carrierFailed, unresolved, alreadyConfirmed, inProgressElsewhere,
                        awaitingReconciliation, released, reconciled, cancelled, workDayClosed);
    }
}
