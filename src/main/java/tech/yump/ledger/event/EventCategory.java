package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Categories of compliance-relevant events recorded in the ledger.
 */
public enum EventCategory {
    CONSENT("consent"),
    DATA_ACCESS("data_access"),
    DATA_EXPORT("data_export"),
    DATA_DELETION("data_deletion"),
    DATA_PROCESSING("data_processing"),
    SECURITY_INCIDENT("security_incident"),
    POLICY_CHANGE("policy_change"),
    ACCESS_CONTROL("access_control"),
    RETENTION("retention"),
    BREACH("breach");

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a category from its wire value ("data_access") or its constant name ("DATA_ACCESS").
     *
     * @throws IllegalArgumentException if the value names no category.
     */
    @JsonCreator
    public static EventCategory fromValue(String value) {
        return Arrays.stream(values())
                .filter(c -> c.value.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event category: " + value));
    }
}
