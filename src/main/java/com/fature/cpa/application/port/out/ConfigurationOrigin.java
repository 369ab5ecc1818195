package com.fature.cpa.application.port.out;

import io.vertx.core.Future;

/**
 * Output port for the authoritative configuration service.
 * Part of hexagonal architecture - defines what the application needs
 */
public interface ConfigurationOrigin {

    /**
     * Fetch one configuration entry.
     * @return the service answer; fails on transport errors or unusable responses
     */
    Future<OriginConfiguration> fetch(String key);

    /**
     * Liveness check of the configuration service
     */
    Future<Void> ping();

    String location();

    /**
     * Answer of the configuration service: success flag plus raw value and declared data_type
     */
    record OriginConfiguration(boolean success, String value, String dataType) {

        public static OriginConfiguration notFound() {
            return new OriginConfiguration(false, null, null);
        }
    }
}
