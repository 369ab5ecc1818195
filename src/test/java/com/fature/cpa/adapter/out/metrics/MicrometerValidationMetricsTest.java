package com.fature.cpa.adapter.out.metrics;

import com.fature.cpa.application.port.out.ValidationMetrics.CacheHitType;
import com.fature.cpa.domain.model.ValidationOption;
import com.fature.cpa.domain.model.ValidationStatus;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerValidationMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerValidationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerValidationMetrics(registry);
    }

    @Test
    void countValidation_tagsByResultOptionAndAffiliate() {
        metrics.countValidation(ValidationStatus.APPROVED, ValidationOption.OPCAO1, "aff-1");
        metrics.countValidation(ValidationStatus.APPROVED, ValidationOption.OPCAO1, "aff-1");
        metrics.countValidation(ValidationStatus.REJECTED, ValidationOption.OPCAO2, null);

        assertEquals(2.0, registry.get(MicrometerValidationMetrics.VALIDATIONS)
                .tags("result", "approved", "option", "opcao1", "affiliate_id", "aff-1")
                .counter().count());
        assertEquals(1.0, registry.get(MicrometerValidationMetrics.VALIDATIONS)
                .tags("result", "rejected", "option", "opcao2", "affiliate_id", "unknown")
                .counter().count());
    }

    @Test
    void recordDuration_perOption() {
        metrics.recordDuration(ValidationOption.OPCAO1, Duration.ofMillis(250));

        Timer timer = registry.get(MicrometerValidationMetrics.VALIDATION_DURATION)
                .tag("option", "opcao1")
                .timer();
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void countCacheLookup_tagsByKeyAndHitType() {
        metrics.countCacheLookup("cpa.validacao.prazo_dias", CacheHitType.LOCAL);
        metrics.countCacheLookup("cpa.validacao.prazo_dias", CacheHitType.ORIGIN);

        assertEquals(1.0, registry.get(MicrometerValidationMetrics.CACHE_HITS)
                .tags("key", "cpa.validacao.prazo_dias", "hit_type", "local")
                .counter().count());
        assertEquals(1.0, registry.get(MicrometerValidationMetrics.CACHE_HITS)
                .tags("key", "cpa.validacao.prazo_dias", "hit_type", "origin")
                .counter().count());
    }
}
