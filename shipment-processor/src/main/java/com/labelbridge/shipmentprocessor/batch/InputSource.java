package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import com.labelbridge.shipmentprocessor.layout.LayoutColumns;
import com.labelbridge.shipmentprocessor.layout.LayoutDetection;

/**
 * What the inspector learned about an input file before any row is processed.
 *
 * @param location      Spring resource location as given by the caller
 * @param sourceId      file name without extension; scopes fingerprints
 * @param firstDataLine physical line number of the first row after the header
 * @param dataLineCount number of lines from {@code firstDataLine} to the end of the file
 */
public record InputSource(
        String location,
        String sourceId,
        LayoutDetection detection,
        LayoutColumns columns,
        int firstDataLine,
        int dataLineCount) {

    public LayoutKind layout() {
        return detection.kind();
    }
}
