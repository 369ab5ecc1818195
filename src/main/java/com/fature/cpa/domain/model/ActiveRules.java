package com.fature.cpa.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration currently in force for a validation option
 */
public record ActiveRules(ValidationOption validationOption, Map<String, Object> rules, Instant timestamp) {

    public ActiveRules {
        rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }
}
