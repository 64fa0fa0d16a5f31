package com.labelbridge.shipmentprocessor.shipment;

import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.RowFailure;
import com.labelbridge.shipmentprocessor.domain.ShipmentRecord;

public record BuildResult(ShipmentRecord record, RowFailure failure) {

    public static BuildResult ok(ShipmentRecord record) {
        return new BuildResult(record, null);
    }

    public static BuildResult failed(FailureKind kind, String detail) {
        return new BuildResult(null, RowFailure.of(kind, detail));
    }

    public boolean isSuccess() {
        return record != null;
    }
}
