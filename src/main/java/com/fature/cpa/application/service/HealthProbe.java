package com.fature.cpa.application.service;

import com.fature.cpa.application.port.in.HealthCheckUseCase;
import com.fature.cpa.application.port.out.ConfigurationOrigin;
import com.fature.cpa.application.port.out.RemoteConfigCache;
import com.fature.cpa.domain.model.HealthReport;
import com.fature.cpa.domain.model.HealthReport.ComponentHealth;
import com.fature.cpa.domain.model.HealthReport.HealthStatus;
import com.fature.cpa.domain.model.HealthReport.LocalCacheStats;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Reports the state of the configuration origin and both cache tiers.
 * Component failures downgrade the report; check() itself never fails.
 */
@Slf4j
@RequiredArgsConstructor
public class HealthProbe implements HealthCheckUseCase {

    private final ConfigurationOrigin origin;
    private final RemoteConfigCache remoteCache;
    private final LocalConfigCache localCache;
    private final Clock clock;

    @Override
    public Future<HealthReport> check() {
        Future<ComponentHealth> originHealth = probeOrigin();
        Future<ComponentHealth> remoteHealth = probeRemoteCache();

        return originHealth.compose(originStatus -> remoteHealth.map(remoteStatus -> {
            HealthStatus overall = originStatus.isHealthy() && remoteStatus.isHealthy()
                    ? HealthStatus.HEALTHY
                    : HealthStatus.DEGRADED;
            return new HealthReport(
                    overall,
                    originStatus,
                    remoteStatus,
                    new LocalCacheStats(localCache.size(), localCache.ttl()),
                    clock.instant()
            );
        }));
    }

    private Future<ComponentHealth> probeOrigin() {
        String location = origin.location();
        return safely(() -> origin.ping())
                .map(v -> ComponentHealth.healthy(location))
                .otherwise(error -> {
                    log.warn("Configuration origin health check failed: {}", error.getMessage());
                    return ComponentHealth.unhealthy(location, error.getMessage());
                });
    }

    private Future<ComponentHealth> probeRemoteCache() {
        String location = remoteCache.location();
        if (!remoteCache.isAvailable()) {
            return Future.succeededFuture(ComponentHealth.disconnected(location));
        }
        return safely(() -> remoteCache.ping())
                .map(v -> ComponentHealth.healthy(location))
                .otherwise(error -> {
                    log.warn("Remote cache health check failed: {}", error.getMessage());
                    return ComponentHealth.unhealthy(location, error.getMessage());
                });
    }

    private static Future<Void> safely(Supplier<Future<Void>> probe) {
        try {
            return probe.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
