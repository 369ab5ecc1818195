package com.fature.cpa.application.port.in;

import com.fature.cpa.domain.model.HealthReport;
import io.vertx.core.Future;

/**
 * Input port for the engine health diagnostic
 */
public interface HealthCheckUseCase {

    /**
     * @return always a succeeded future; failing components only downgrade the report
     */
    Future<HealthReport> check();
}
