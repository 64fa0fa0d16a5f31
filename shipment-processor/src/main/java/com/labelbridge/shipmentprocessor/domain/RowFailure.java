package com.labelbridge.shipmentprocessor.domain;

/**
 * A typed failure for one row, with a human readable detail.
 */
public record RowFailure(FailureKind kind, String detail) {

    public static RowFailure of(FailureKind kind, String detail) {
        return new RowFailure(kind, detail);
    }

    public String suggestion() {
        return kind.getSuggestion();
    }
}
