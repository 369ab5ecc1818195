package com.fature.cpa.adapter.in.web.validation;

import com.fature.cpa.application.port.in.CpaValidationUseCase;
import com.fature.cpa.domain.model.ValidationOption;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler listing the configuration in force for a validation option
 * Handles GET /api/v1/integration-service/cpa-rules?option=opcao1
 */
@Slf4j
@RequiredArgsConstructor
public class ActiveRulesHandler implements Handler<RoutingContext> {

    private final CpaValidationUseCase validationUseCase;

    @Override
    public void handle(RoutingContext context) {
        String optionParam = context.request().getParam("option");
        if (optionParam == null || optionParam.isBlank()) {
            optionParam = ValidationOption.DEFAULT.getValue();
        }
        if (!ValidationOption.isValid(optionParam)) {
            context.response()
                    .setStatusCode(400)
                    .putHeader("Content-Type", "application/json")
                    .end(ValidationResponseMapper.error("Validation option must be \"opcao1\" or \"opcao2\"").encode());
            return;
        }

        validationUseCase.getActiveRules(ValidationOption.fromValue(optionParam))
                .onSuccess(rules -> context.response()
                        .putHeader("Content-Type", "application/json")
                        .end(ValidationResponseMapper.success(
                                "CPA rules retrieved",
                                ValidationResponseMapper.toJson(rules)).encode()))
                .onFailure(error -> {
                    log.error("Failed to load active CPA rules", error);
                    context.response()
                            .setStatusCode(500)
                            .putHeader("Content-Type", "application/json")
                            .end(ValidationResponseMapper.error("Failed to load CPA rules")
                                    .put("error", error.getMessage())
                                    .encode());
                });
    }
}
