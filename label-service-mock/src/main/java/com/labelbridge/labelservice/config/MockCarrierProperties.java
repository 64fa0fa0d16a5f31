package com.labelbridge.labelservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code mock} section from application.yml.
 * <p>
 * Holds the simulated latency, the accepted credentials and contract codes, and the carrier's
 * field and batch limits.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "mock")
public class MockCarrierProperties {

    /**
     * Artificial delay in milliseconds applied to every call. Default: 200 ms.
     */
    private long latencyMs = 200;

    /** Largest batch accepted by {@code POST /api/v1/parcels/batch}. */
    private int maxBatchSize = 400;

    /**
     * When positive, every n-th parcel submitted answers {@code TEMPORARY_FAILURE} instead of
     * being stored. Used to exercise client retries. 0 disables it.
     */
    private int temporaryFailureEvery = 0;

    private List<CarrierAccount> accounts = new ArrayList<>();

    /** Contract codes accepted for any account. */
    private List<String> contractCodes = new ArrayList<>();

    private FieldLimits fieldLimits = new FieldLimits();

    @Getter
    @Setter
    public static class CarrierAccount {
        /** Carrier site ("sede") code, e.g. "MI". */
        private String site;
        private String customerCode;
        private String password;
    }

    @Getter
    @Setter
    public static class FieldLimits {
        private int recipientName = 35;
        private int address = 35;
        private int locality = 30;
        private int notes = 40;
    }
}
