package com.labelbridge.shipmentprocessor.config;

import com.labelbridge.shipmentprocessor.domain.Confidence;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the {@code shipment} section of application.yml.
 *
 * <p>Carrier codes are contract values: they are validated at startup and copied verbatim into
 * every shipment record.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "shipment")
public class ShipmentProperties {

    @Valid
    private Input input = new Input();

    @Valid
    private Output output = new Output();

    @Valid
    private Geocoding geocoding = new Geocoding();

    @Valid
    private Carrier carrier = new Carrier();

    @Valid
    private Ledger ledger = new Ledger();

    @Getter
    @Setter
    public static class Input {
        /** Default source when a run is triggered without {@code inputFile}. */
        private String defaultFile;
        /** Cell delimiter of the CSV export. */
        @NotBlank
        private String delimiter = ",";
    }

    @Getter
    @Setter
    public static class Output {
        /** Directory for prepared-* and rejected-* CSV reports. */
        @NotBlank
        private String dir = System.getProperty("java.io.tmpdir") + "/shipment-output";
    }

    @Getter
    @Setter
    public static class Geocoding {
        @NotBlank
        private String baseUrl = "https://maps.googleapis.com";
        private String apiKey;
        private String language = "it";
        /** Results below this confidence are rejected as ambiguous. */
        @NotNull
        private Confidence minConfidence = Confidence.MEDIUM;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Carrier {
        @NotBlank
        private String baseUrl = "http://localhost:8083";
        /** Carrier site ("sede") code, also the scope of close-work-day. */
        @NotBlank
        private String site;
        @NotBlank
        private String customerCode;
        private String password;
        @NotBlank
        private String contractCode;

        @Pattern(regexp = "[FA]", message = "port type must be F (franco) or A (assegnato)")
        private String portType = "F";
        @Pattern(regexp = "\\d", message = "package type is a single digit")
        private String packageType = "0";
        @Pattern(regexp = "[NP]", message = "shipment type must be N (nazionale) or P (parcel)")
        private String shipmentType = "N";
        @Pattern(regexp = "|CONT|AC|AB|ASS|ASSBB", message = "unknown cash-on-delivery type")
        private String cashOnDeliveryType = "";
        @Pattern(regexp = "A4|A6", message = "pdf format must be A4 or A6")
        private String pdfFormat = "A6";

        /** When set, rows without any phone number fail with NO_PHONE. */
        private boolean phoneRequired = false;

        @Min(1)
        @Max(400)
        private int batchSize = 400;

        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Ledger {
        @NotBlank
        private String path = System.getProperty("user.home") + "/.labelbridge/upload-ledger.jsonl";
    }
}
