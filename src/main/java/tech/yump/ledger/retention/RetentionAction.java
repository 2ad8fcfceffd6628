package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * What happens to an expired item. {@link #ANONYMIZE} is accepted in policies but not carried out.
 */
public enum RetentionAction {
    DELETE("delete"),
    ARCHIVE("archive"),
    ANONYMIZE("anonymize");

    private final String value;

    RetentionAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RetentionAction fromValue(String value) {
        return Arrays.stream(values())
                .filter(v -> v.value.equalsIgnoreCase(value) || v.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown retention action: " + value));
    }
}
