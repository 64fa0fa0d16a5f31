package com.labelbridge.shipmentprocessor.ledger;

public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
