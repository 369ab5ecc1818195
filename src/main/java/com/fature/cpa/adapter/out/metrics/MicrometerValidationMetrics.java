package com.fature.cpa.adapter.out.metrics;

import com.fature.cpa.application.port.out.ValidationMetrics;
import com.fature.cpa.domain.model.ValidationOption;
import com.fature.cpa.domain.model.ValidationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer implementation of the metrics sink.
 * With the Prometheus registry these are scraped as:
 * <ul>
 *   <li>{@code cpa_validations_total{result, option, affiliate_id}}</li>
 *   <li>{@code cpa_validation_duration_seconds{option}} - buckets 0.1, 0.5, 1, 2, 5, 10 s</li>
 *   <li>{@code config_cache_hits_total{key, hit_type}}</li>
 * </ul>
 */
public class MicrometerValidationMetrics implements ValidationMetrics {

    static final String VALIDATIONS = "cpa.validations";
    static final String VALIDATION_DURATION = "cpa.validation.duration";
    static final String CACHE_HITS = "config.cache.hits";

    private static final Duration[] DURATION_BUCKETS = {
            Duration.ofMillis(100),
            Duration.ofMillis(500),
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(5),
            Duration.ofSeconds(10)
    };

    private final MeterRegistry registry;

    public MicrometerValidationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void countValidation(ValidationStatus status, ValidationOption option, String affiliateId) {
        Counter.builder(VALIDATIONS)
                .description("Total number of CPA validations")
                .tag("result", status.getValue())
                .tag("option", option.getValue())
                .tag("affiliate_id", affiliateId != null ? affiliateId : "unknown")
                .register(registry)
                .increment();
    }

    @Override
    public void recordDuration(ValidationOption option, Duration duration) {
        Timer.builder(VALIDATION_DURATION)
                .description("Duration of CPA validations in seconds")
                .tag("option", option.getValue())
                .serviceLevelObjectives(DURATION_BUCKETS)
                .register(registry)
                .record(duration);
    }

    @Override
    public void countCacheLookup(String key, CacheHitType hitType) {
        Counter.builder(CACHE_HITS)
                .description("Total number of config cache hits")
                .tag("key", key)
                .tag("hit_type", hitType.getValue())
                .register(registry)
                .increment();
    }
}
