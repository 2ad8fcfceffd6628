package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * GDPR Article 6 legal bases for processing.
 */
public enum LegalBasis {
    CONSENT("consent"),
    CONTRACT("contract"),
    LEGAL_OBLIGATION("legal_obligation"),
    VITAL_INTERESTS("vital_interests"),
    PUBLIC_INTEREST("public_interest"),
    LEGITIMATE_INTEREST("legitimate_interest");

    private final String value;

    LegalBasis(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static LegalBasis fromValue(String value) {
        return Arrays.stream(values())
                .filter(b -> b.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown legal basis: " + value));
    }
}
