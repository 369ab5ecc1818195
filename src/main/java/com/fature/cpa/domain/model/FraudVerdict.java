package com.fature.cpa.domain.model;

import java.util.Collections;
import java.util.List;

/**
 * Output of the fraud heuristics for one input
 */
public record FraudVerdict(boolean suspicious, List<String> matchedPatterns) {

    public FraudVerdict {
        matchedPatterns = matchedPatterns == null ? Collections.emptyList() : List.copyOf(matchedPatterns);
    }

    public static FraudVerdict clean() {
        return new FraudVerdict(false, Collections.emptyList());
    }

    public static FraudVerdict of(List<String> matchedPatterns) {
        return new FraudVerdict(!matchedPatterns.isEmpty(), matchedPatterns);
    }

    public String message() {
        if (!suspicious) {
            return "No suspicious pattern detected";
        }
        return "FRAUD DETECTED: " + String.join("; ", matchedPatterns);
    }
}
