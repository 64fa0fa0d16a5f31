package com.labelbridge.shipmentprocessor.upload;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one {@link BatchUploader#upload} call did, record by record.
 */
@Getter
public class UploadReport {

    /** Size of every dispatched batch, in dispatch order. */
    private final List<Integer> batchSizes = new ArrayList<>();
    /** Fingerprint to carrier shipment number. */
    private final Map<String, String> confirmed = new LinkedHashMap<>();
    /** Fingerprint to failure reason. */
    private final Map<String, String> failed = new LinkedHashMap<>();
    /** Sent, outcome unknown; reconciled on the next run. */
    private final List<String> unresolved = new ArrayList<>();
    /** Admitted but never sent (cancellation or local failure). */
    private final List<String> released = new ArrayList<>();
    private long confirmedPackages;
    private boolean cancelled;

    void batchDispatched(int size) {
        batchSizes.add(size);
    }

    void confirmed(String fingerprint, String shipmentNumber, int packageCount) {
        confirmed.put(fingerprint, shipmentNumber);
        confirmedPackages += packageCount;
    }

    void failed(String fingerprint, String reason) {
        failed.put(fingerprint, reason);
    }

    void unresolved(Collection<String> fingerprints) {
        unresolved.addAll(fingerprints);
    }

    void released(Collection<String> fingerprints) {
        released.addAll(fingerprints);
    }

    void cancelled() {
        cancelled = true;
    }

    public boolean hasProblems() {
        return !failed.isEmpty() || !unresolved.isEmpty();
    }
}
