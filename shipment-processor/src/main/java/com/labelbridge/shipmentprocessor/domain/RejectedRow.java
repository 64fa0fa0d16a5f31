package com.labelbridge.shipmentprocessor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A source row that did not make it to upload, as written to the rejected-rows report.
 */
@Value
@Builder
public class RejectedRow {

    int lineNumber;
    String ordinal;
    String recipientName;
    String address;
    String city;
    String postalCode;
    FailureKind kind;
    String detail;

    public String getSuggestion() {
        return kind.getSuggestion();
    }

    public static RejectedRow of(InputRow row, RowFailure failure) {
        return RejectedRow.builder()
                .lineNumber(row.getLineNumber())
                .ordinal(row.getOrdinal())
                .recipientName(row.getRecipientName())
                .address(row.getAddress())
                .city(row.getCity())
                .postalCode(row.getPostalCode())
                .kind(failure.kind())
                .detail(failure.detail())
                .build();
    }
}
