package com.labelbridge.shipmentprocessor.ledger;

import java.util.Collection;
import java.util.Map;

/**
 * Durable fingerprint to {@link LedgerEntry} storage.
 */
public interface LedgerStore {

    /** Latest entry per fingerprint. */
    Map<String, LedgerEntry> loadAll();

    /**
     * Durably records the given entries; returns only once they would survive a crash.
     *
     * @throws LedgerPersistenceException when the entries could not be written
     */
    void append(Collection<LedgerEntry> entries);
}
