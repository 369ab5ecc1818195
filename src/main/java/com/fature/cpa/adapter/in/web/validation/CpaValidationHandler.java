package com.fature.cpa.adapter.in.web.validation;

import com.fature.cpa.application.port.in.CpaValidationUseCase;
import com.fature.cpa.domain.model.ValidationInput;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RequestBody;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for CPA validation
 * Handles POST /api/v1/integration-service/validate-cpa
 */
@Slf4j
@RequiredArgsConstructor
public class CpaValidationHandler implements Handler<RoutingContext> {

    private final CpaValidationUseCase validationUseCase;
    private final CpaRequestValidator requestValidator;

    @Override
    public void handle(RoutingContext context) {
        RequestBody body = context.body();
        JsonObject requestBody;
        try {
            requestBody = body.asJsonObject();
        } catch (RuntimeException e) {
            log.warn("Request body is not a JSON object: {}", e.getMessage());
            sendError(context, 400, ValidationResponseMapper.error("Request body must be a JSON object"));
            return;
        }

        if (requestBody == null) {
            log.warn("Request body is null");
            sendError(context, 400, ValidationResponseMapper.error("Request body is required"));
            return;
        }

        ValidationInput input;
        try {
            CpaValidationRequest request = requestBody.mapTo(CpaValidationRequest.class);
            RequestValidation validation = requestValidator.validate(request);
            if (!validation.isValid()) {
                log.warn("Rejected CPA validation request: {}", validation.errors());
                sendError(context, 400, ValidationResponseMapper.error(String.join("; ", validation.errors()))
                        .put("errors", new JsonArray(validation.errors()))
                        .put("required_fields", new JsonArray(CpaRequestValidator.REQUIRED_FIELDS)));
                return;
            }
            input = requestValidator.toInput(request);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            sendError(context, 400, ValidationResponseMapper.error("Invalid request format: " + e.getMessage()));
            return;
        }

        log.info("Received CPA validation request for affiliate {}", input.affiliateId());

        validationUseCase.validate(input)
                .onSuccess(result -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(ValidationResponseMapper.success(
                                "CPA validation executed",
                                ValidationResponseMapper.toJson(result)).encode()))
                .onFailure(error -> {
                    log.error("CPA validation failed for affiliate {}: {}", input.affiliateId(), error.getMessage(), error);
                    sendError(context, 500, ValidationResponseMapper.error("Internal error in CPA validation")
                            .put("error", error.getMessage()));
                });
    }

    private void sendError(RoutingContext context, int statusCode, JsonObject response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(response.encode());
    }
}
