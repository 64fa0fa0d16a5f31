package com.labelbridge.shipmentprocessor.domain;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Source layout of a spreadsheet export. Constant for every row of one source.
 */
@Getter
public enum LayoutKind {

    OLD(1, new BigDecimal("3")),
    NEW(2, new BigDecimal("3")),
    /** Agency exports carry no defaults: package count and weight are entered by hand. */
    AGENCY(null, null);

    private final Integer defaultPackageCount;
    private final BigDecimal defaultWeightKg;

    LayoutKind(Integer defaultPackageCount, BigDecimal defaultWeightKg) {
        this.defaultPackageCount = defaultPackageCount;
        this.defaultWeightKg = defaultWeightKg;
    }

    public boolean hasDefaults() {
        return defaultPackageCount != null && defaultWeightKg != null;
    }
}
