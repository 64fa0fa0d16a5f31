package com.labelbridge.shipmentprocessor.address;

import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.NormalizedAddress;
import com.labelbridge.shipmentprocessor.domain.RowFailure;

/**
 * Either a {@link NormalizedAddress} or the {@link RowFailure} explaining why there is none.
 */
public record NormalizationResult(NormalizedAddress address, RowFailure failure) {

    public static NormalizationResult ok(NormalizedAddress address) {
        return new NormalizationResult(address, null);
    }

    public static NormalizationResult failed(FailureKind kind, String detail) {
        return new NormalizationResult(null, RowFailure.of(kind, detail));
    }

    public boolean isSuccess() {
        return address != null;
    }
}
