package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Categories of data an event touched.
 */
public enum DataCategory {
    PERSONAL_DATA("personal_data"),
    SENSITIVE_DATA("sensitive_data"),
    CREDENTIALS("credentials"),
    SESSION_DATA("session_data"),
    USAGE_DATA("usage_data"),
    CONFIGURATION("configuration"),
    AUDIT_LOGS("audit_logs");

    private final String value;

    DataCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DataCategory fromValue(String value) {
        return Arrays.stream(values())
                .filter(c -> c.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown data category: " + value));
    }
}
