package com.labelbridge.shipmentprocessor.config;

import com.labelbridge.shipmentprocessor.address.GeocodingUnavailableException;
import com.labelbridge.shipmentprocessor.upload.CarrierUnavailableException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j guards for the two outbound collaborators.
 *
 * <ul>
 *   <li><b>Geocoding</b>: a rate limiter (the provider allows about 40 requests/s), a semaphore
 *       bulkhead bounding concurrent calls from the partition workers, and a retry for
 *       transient failures.</li>
 *   <li><b>Carrier</b>: a retry with exponential backoff and jitter, used per batch by
 *       {@link com.labelbridge.shipmentprocessor.upload.BatchUploader}.</li>
 * </ul>
 *
 * <p>Values come from the {@code resilience4j.*} namespace of application.yml.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    // ── Geocoding: bulkhead ──────────────────────────────────────────────────

    @Value("${resilience4j.bulkhead.instances.geocodingBulkhead.max-concurrent-calls:10}")
    private int geocodingMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.geocodingBulkhead.max-wait-duration:2s}")
    private Duration geocodingMaxWait;

    // ── Geocoding: rate limiter ──────────────────────────────────────────────

    @Value("${resilience4j.ratelimiter.instances.geocodingRateLimiter.limit-for-period:40}")
    private int geocodingLimitForPeriod;

    @Value("${resilience4j.ratelimiter.instances.geocodingRateLimiter.limit-refresh-period:1s}")
    private Duration geocodingRefreshPeriod;

    @Value("${resilience4j.ratelimiter.instances.geocodingRateLimiter.timeout-duration:5s}")
    private Duration geocodingPermitTimeout;

    // ── Geocoding: retry ─────────────────────────────────────────────────────

    @Value("${resilience4j.retry.instances.geocodingRetry.max-attempts:3}")
    private int geocodingMaxAttempts;

    @Value("${resilience4j.retry.instances.geocodingRetry.wait-duration:2s}")
    private Duration geocodingWait;

    // ── Carrier: retry ───────────────────────────────────────────────────────

    @Value("${resilience4j.retry.instances.carrierRetry.max-attempts:3}")
    private int carrierMaxAttempts;

    @Value("${resilience4j.retry.instances.carrierRetry.wait-duration:2s}")
    private Duration carrierInitialWait;

    @Value("${resilience4j.retry.instances.carrierRetry.exponential-backoff-multiplier:2.0}")
    private double carrierMultiplier;

    @Value("${resilience4j.retry.instances.carrierRetry.randomization-factor:0.5}")
    private double carrierRandomization;

    // ─── Registries ──────────────────────────────────────────────────────────

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        return RateLimiterRegistry.ofDefaults();
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    // ─── Beans ───────────────────────────────────────────────────────────────

    @Bean("geocodingBulkhead")
    public Bulkhead geocodingBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(geocodingMaxConcurrent)
                .maxWaitDuration(geocodingMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("geocodingBulkhead", cfg);
        log.info("SemaphoreBulkhead 'geocodingBulkhead' created, maxConcurrent={}, maxWait={}",
                geocodingMaxConcurrent, geocodingMaxWait);
        return bh;
    }

    @Bean("geocodingRateLimiter")
    public RateLimiter geocodingRateLimiter(RateLimiterRegistry registry) {
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(geocodingLimitForPeriod)
                .limitRefreshPeriod(geocodingRefreshPeriod)
                .timeoutDuration(geocodingPermitTimeout)
                .build();
        RateLimiter limiter = registry.rateLimiter("geocodingRateLimiter", cfg);
        log.info("RateLimiter 'geocodingRateLimiter' created, {} calls per {}", geocodingLimitForPeriod, geocodingRefreshPeriod);
        return limiter;
    }

    @Bean("geocodingRetry")
    public Retry geocodingRetry(RetryRegistry registry) {
        RetryConfig cfg = RetryConfig.custom()
                .maxAttempts(geocodingMaxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(geocodingWait, 2.0))
                .retryExceptions(GeocodingUnavailableException.class, RequestNotPermitted.class, BulkheadFullException.class)
                .build();
        Retry retry = registry.retry("geocodingRetry", cfg);
        retry.getEventPublisher().onRetry(e -> log.warn("Geocoding retry #{} in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(), e.getLastThrowable().getMessage()));
        return retry;
    }

    /**
     * Per-batch carrier retry. Only {@link CarrierUnavailableException} is retried; business
     * rejections and anything unexpected propagate on the first occurrence.
     */
    @Bean("carrierRetry")
    public Retry carrierRetry(RetryRegistry registry) {
        RetryConfig cfg = RetryConfig.custom()
                .maxAttempts(carrierMaxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        carrierInitialWait, carrierMultiplier, carrierRandomization))
                .retryExceptions(CarrierUnavailableException.class)
                .build();
        Retry retry = registry.retry("carrierRetry", cfg);
        retry.getEventPublisher().onRetry(e -> log.warn("Carrier retry #{} in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(), e.getLastThrowable().getMessage()));
        log.info("Retry 'carrierRetry' created, maxAttempts={}, initialWait={}, multiplier={}",
                carrierMaxAttempts, carrierInitialWait, carrierMultiplier);
        return retry;
    }
}
