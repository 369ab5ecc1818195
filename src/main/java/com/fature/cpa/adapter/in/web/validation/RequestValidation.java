package com.fature.cpa.adapter.in.web.validation;

import java.util.Collections;
import java.util.List;

/**
 * Result of checking a request before it reaches the engine
 */
public record RequestValidation(boolean isValid, List<String> errors) {

    public static RequestValidation valid() {
        return new RequestValidation(true, Collections.emptyList());
    }

    public static RequestValidation invalid(List<String> errors) {
        return new RequestValidation(false, Collections.unmodifiableList(errors));
    }
}
