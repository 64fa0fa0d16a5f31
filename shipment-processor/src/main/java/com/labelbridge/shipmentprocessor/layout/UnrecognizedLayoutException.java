package com.labelbridge.shipmentprocessor.layout;

/**
 * Thrown when an input source matches none of the known layouts, or lacks a column the
 * detected layout requires.
 */
public class UnrecognizedLayoutException extends RuntimeException {

    public UnrecognizedLayoutException(String message) {
        super(message);
    }
}
