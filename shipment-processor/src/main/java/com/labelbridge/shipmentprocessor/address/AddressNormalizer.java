package com.labelbridge.shipmentprocessor.address;

import com.labelbridge.shipmentprocessor.domain.Confidence;
import com.labelbridge.shipmentprocessor.domain.FailureKind;
import com.labelbridge.shipmentprocessor.domain.NormalizedAddress;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Validates a typed address against the geocoding provider and turns the answer into a
 * {@link NormalizedAddress} or a typed failure.
 *
 * <h3>Checks, in order</h3>
 * <ol>
 *   <li>Postal code shape, before any outbound call ({@code INVALID_ZIP}).</li>
 *   <li>Provider status ({@code NOT_FOUND}, {@code PROVIDER_REJECTED}); transient errors are
 *       retried and end as {@code PROVIDER_UNAVAILABLE}.</li>
 *   <li>Municipality agreement ({@code LOCALITY_MISMATCH}). The provider's postal code for the
 *       resolved municipality replaces the typed one; a malformed one is {@code INVALID_ZIP}.</li>
 *   <li>Province shape ({@code INVALID_PROVINCE}).</li>
 *   <li>Address quality: rural areas, state roads without number, {@code snc}, no route.</li>
 *   <li>Confidence below {@code shipment.geocoding.min-confidence} or competing candidates
 *       ({@code AMBIGUOUS}).</li>
 * </ol>
 *
 * <p>Outbound calls go through the geocoding rate limiter, bulkhead and retry, in that
 * nesting: retry outermost.
 */
@Slf4j
@Component
public class AddressNormalizer {

    private static final Pattern RURAL = Pattern.compile(
            "(?<![\\p{L}])(contrada|c\\.da|localit[aà]'?|loc\\.)(?![\\p{L}])", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern STATE_ROAD = Pattern.compile(
            "(?<![\\p{L}])(strada\\s+statale|strada\\s+provinciale|s\\.\\s?s\\.|s\\.\\s?p\\.)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NO_NUMBER = Pattern.compile("(?<![\\p{L}])snc(?![\\p{L}])", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final String[] CITY_PREFIXES = {"comune di ", "citta di ", "citta' di "};

    private final GeocodingProvider provider;
    private final Bulkhead bulkhead;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final Confidence minConfidence;

    public AddressNormalizer(
            GeocodingProvider provider,
            @Qualifier("geocodingBulkhead") Bulkhead bulkhead,
            @Qualifier("geocodingRateLimiter") RateLimiter rateLimiter,
            @Qualifier("geocodingRetry") Retry retry,
            @Value("${shipment.geocoding.min-confidence:MEDIUM}") Confidence minConfidence) {
        this.provider = provider;
        this.bulkhead = bulkhead;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
        this.minConfidence = minConfidence;
    }

    public NormalizationResult normalize(AddressQuery query) {
        Optional<String> postalCode = PostalCodes.normalize(query.postalCode());
        if (postalCode.isEmpty()) {
            return NormalizationResult.failed(FailureKind.INVALID_ZIP,
                    "CAP '%s' non valido".formatted(query.postalCode()));
        }
        if (query.address() == null || query.address().isBlank()) {
            return NormalizationResult.failed(FailureKind.NO_ROUTE, "Indirizzo mancante");
        }

        AddressQuery cleaned = new AddressQuery(query.address().trim(), trim(query.city()), postalCode.get(),
                trim(query.province()));

        GeocodingCandidate candidate;
        try {
            candidate = geocode(cleaned);
        } catch (GeocodingUnavailableException | RequestNotPermitted | BulkheadFullException e) {
            log.warn("Geocoding unavailable for '{}' after {} attempt(s): {}",
                    cleaned.toSingleLine(), retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            return NormalizationResult.failed(FailureKind.PROVIDER_UNAVAILABLE, e.getMessage());
        }

        GeocodingStatus status = candidate.status() != null ? candidate.status() : GeocodingStatus.OK;
        switch (status) {
            case ZERO_RESULTS:
                return NormalizationResult.failed(FailureKind.NOT_FOUND, "Indirizzo non trovato");
            case REQUEST_DENIED:
            case INVALID_REQUEST:
                return NormalizationResult.failed(FailureKind.PROVIDER_REJECTED,
                        "%s: %s".formatted(status, candidate.errorMessage()));
            default:
                break;
        }
        return interpret(cleaned, candidate);
    }

    private NormalizationResult interpret(AddressQuery query, GeocodingCandidate candidate) {
        String locality = candidate.locality() != null ? candidate.locality() : query.city();
        if (query.city() != null && candidate.locality() != null && !sameMunicipality(query.city(), candidate.locality())) {
            return NormalizationResult.failed(FailureKind.LOCALITY_MISMATCH,
                    "Comune diverso: atteso '%s', trovato '%s'".formatted(query.city(), candidate.locality()));
        }

        String postalCode = query.postalCode();
        if (candidate.postalCode() != null) {
            String returned = candidate.postalCode().trim();
            if (!NormalizedAddress.POSTAL_CODE.matcher(returned).matches()) {
                return NormalizationResult.failed(FailureKind.INVALID_ZIP,
                        "CAP restituito '%s' non valido".formatted(returned));
            }
            if (!returned.equals(postalCode)) {
                log.debug("CAP {} corrected to {} for {}", postalCode, returned, locality);
                postalCode = returned;
            }
        }
        if (locality == null || locality.isBlank()) {
            return NormalizationResult.failed(FailureKind.LOCALITY_MISMATCH, "Comune mancante");
        }

        String province = candidate.province() != null ? candidate.province() : query.province();
        province = province == null ? null : province.trim().toUpperCase(Locale.ROOT);
        if (province == null || !NormalizedAddress.PROVINCE.matcher(province).matches()) {
            return NormalizationResult.failed(FailureKind.INVALID_PROVINCE,
                    "Provincia '%s' non valida".formatted(province));
        }

        Confidence confidence = candidate.confidence() != null ? candidate.confidence() : Confidence.LOW;
        String typed = query.address();
        if (RURAL.matcher(typed).find() && (candidate.route() == null || confidence == Confidence.LOW)) {
            return NormalizationResult.failed(FailureKind.GENERIC_RURAL_ADDRESS, "Indirizzo Contrada/Località generico");
        }
        if (STATE_ROAD.matcher(typed).find() && candidate.streetNumber() == null) {
            return NormalizationResult.failed(FailureKind.STATE_ROAD_WITHOUT_NUMBER,
                    "Strada Statale/Provinciale senza riferimento specifico");
        }
        if (NO_NUMBER.matcher(typed).find()) {
            return NormalizationResult.failed(FailureKind.MISSING_HOUSE_NUMBER, "Indirizzo senza numero civico (SNC)");
        }
        if (candidate.route() == null || candidate.route().isBlank()) {
            return NormalizationResult.failed(FailureKind.NO_ROUTE, "Indirizzo generico senza via specifica");
        }

        if (candidate.ambiguous() || !confidence.isAtLeast(minConfidence)) {
            return NormalizationResult.failed(FailureKind.AMBIGUOUS,
                    "Confidenza %s%s, minimo %s".formatted(confidence, candidate.ambiguous() ? " (più risultati)" : "",
                            minConfidence));
        }

        String street = candidate.streetNumber() == null || candidate.streetNumber().isBlank()
                ? candidate.route()
                : candidate.route() + ", " + candidate.streetNumber();
        log.debug("Normalized '{}' -> '{}', {} {} ({})", typed, street, postalCode, locality, confidence);
        return NormalizationResult.ok(new NormalizedAddress(street, locality, province, postalCode, confidence, false));
    }

    private GeocodingCandidate geocode(AddressQuery query) {
        Supplier<GeocodingCandidate> call = () -> provider.geocode(query);
        call = Bulkhead.decorateSupplier(bulkhead, call);
        call = RateLimiter.decorateSupplier(rateLimiter, call);
        call = Retry.decorateSupplier(retry, call);
        return call.get();
    }

    static boolean sameMunicipality(String expected, String actual) {
        return canonicalCity(expected).equals(canonicalCity(actual));
    }

    static String canonicalCity(String city) {
        String s = DIACRITICS.matcher(Normalizer.normalize(city, Normalizer.Form.NFD)).replaceAll("");
        s = s.toLowerCase(Locale.ITALIAN).trim().replaceAll("\\s+", " ");
        for (String prefix : CITY_PREFIXES) {
            if (s.startsWith(prefix)) {
                s = s.substring(prefix.length());
            }
        }
        return s.replace("'", "").replace("’", "").replace('-', ' ').replaceAll("\\s+", " ").trim();
    }

    private static String trim(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
