package com.labelbridge.shipmentprocessor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelbridge.shipmentprocessor.ledger.DuplicateTracker;
import com.labelbridge.shipmentprocessor.ledger.JsonLinesLedgerStore;
import com.labelbridge.shipmentprocessor.ledger.LedgerStore;
import com.labelbridge.shipmentprocessor.upload.BatchUploader;
import com.labelbridge.shipmentprocessor.upload.CarrierGateway;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Ledger and uploader wiring. The tracker is a process-wide singleton so that concurrent runs
 * share one view of in-flight fingerprints.
 */
@Configuration
public class UploadConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public LedgerStore ledgerStore(ShipmentProperties properties, ObjectMapper objectMapper) {
        return new JsonLinesLedgerStore(Path.of(properties.getLedger().getPath()), objectMapper);
    }

    @Bean
    public DuplicateTracker duplicateTracker(LedgerStore ledgerStore, Clock clock) {
        return new DuplicateTracker(ledgerStore, clock);
    }

    @Bean
    public BatchUploader batchUploader(CarrierGateway carrierGateway,
                                       DuplicateTracker duplicateTracker,
                                       @Qualifier("carrierRetry") Retry carrierRetry,
                                       ShipmentProperties properties) {
        return new BatchUploader(carrierGateway, duplicateTracker, carrierRetry, properties.getCarrier().getBatchSize());
    }
}
