package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Outcome {
    SUCCESS("success"),
    FAILURE("failure"),
    PENDING("pending");

    private final String value;

    Outcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Outcome of(boolean success) {
        return success ? SUCCESS : FAILURE;
    }

    @JsonCreator
    public static Outcome fromValue(String value) {
        return Arrays.stream(values())
                .filter(o -> o.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown outcome: " + value));
    }
}
