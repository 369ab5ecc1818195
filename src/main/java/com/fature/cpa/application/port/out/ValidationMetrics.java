package com.fature.cpa.application.port.out;

import com.fature.cpa.domain.model.ValidationOption;
import com.fature.cpa.domain.model.ValidationStatus;

import java.time.Duration;

/**
 * Output port for the metrics sink
 */
public interface ValidationMetrics {

    /**
     * cpa_validations_total{result, option, affiliate_id}
     */
    void countValidation(ValidationStatus status, ValidationOption option, String affiliateId);

    /**
     * cpa_validation_duration_seconds{option}
     */
    void recordDuration(ValidationOption option, Duration duration);

    /**
     * config_cache_hits_total{key, hit_type}
     */
    void countCacheLookup(String key, CacheHitType hitType);

    enum CacheHitType {
        LOCAL("local"),
        REMOTE("remote"),
        ORIGIN("origin"),
        ERROR("error");

        private final String value;

        CacheHitType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }
}
