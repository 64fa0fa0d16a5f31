package com.labelbridge.labelservice.service;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A request-level refusal, rendered as an {@code ErrorResponse} with the given HTTP status.
 */
@Getter
public class CarrierException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public CarrierException(HttpStatus status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }
}
