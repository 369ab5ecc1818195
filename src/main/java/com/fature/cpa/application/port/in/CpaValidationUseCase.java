package com.fature.cpa.application.port.in;

import com.fature.cpa.domain.model.ActiveRules;
import com.fature.cpa.domain.model.ValidationInput;
import com.fature.cpa.domain.model.ValidationOption;
import com.fature.cpa.domain.model.ValidationResult;
import io.vertx.core.Future;

/**
 * Input port for CPA eligibility validation
 */
public interface CpaValidationUseCase {

    /**
     * Evaluate the configured criteria for one user.
     * @return always a succeeded future; internal faults become a result with status ERROR
     */
    Future<ValidationResult> validate(ValidationInput input);

    /**
     * Resolve the configuration currently applied to an option
     */
    Future<ActiveRules> getActiveRules(ValidationOption option);
}
