package com.labelbridge.shipmentprocessor.ledger;

import java.util.List;

/**
 * Outcome of re-verifying SUBMITTED entries left by an earlier run.
 *
 * @param confirmed  found at the carrier, now CONFIRMED
 * @param requeued   unknown to the carrier, now FAILED and admissible again
 * @param unresolved the status query itself failed; still SUBMITTED
 */
public record ReconciliationReport(List<String> confirmed, List<String> requeued, List<String> unresolved) {

    public int total() {
        return confirmed.size() + requeued.size() + unresolved.size();
    }
}
