package com.fature.cpa.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only diagnostic of the engine's collaborators
 */
public record HealthReport(
        HealthStatus overall,
        ComponentHealth origin,
        ComponentHealth remoteCache,
        LocalCacheStats localCache,
        Instant timestamp
) {

    public enum HealthStatus {
        HEALTHY("healthy"),
        DEGRADED("degraded");

        private final String value;

        HealthStatus(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    /**
     * status is one of healthy, unhealthy, disconnected
     */
    public record ComponentHealth(String status, String location, String error) {

        public static ComponentHealth healthy(String location) {
            return new ComponentHealth("healthy", location, null);
        }

        public static ComponentHealth unhealthy(String location, String error) {
            return new ComponentHealth("unhealthy", location, error);
        }

        public static ComponentHealth disconnected(String location) {
            return new ComponentHealth("disconnected", location, null);
        }

        public boolean isHealthy() {
            return "healthy".equals(status);
        }
    }

    public record LocalCacheStats(int size, Duration ttl) {
    }
}
