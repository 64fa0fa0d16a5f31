package com.labelbridge.shipmentprocessor.upload;

import lombok.Getter;

/**
 * The carrier refused a whole request for a business reason (invalid credentials,
 * batch size exceeded ...). Not retried.
 */
@Getter
public class CarrierRejectedException extends RuntimeException {

    private final String errorCode;

    public CarrierRejectedException(String errorCode, String message) {
        super(errorCode + ": " + message);
        this.errorCode = errorCode;
    }
}
