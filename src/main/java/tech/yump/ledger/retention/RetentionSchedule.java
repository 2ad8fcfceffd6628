package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Minimum interval between two runs of the same policy, in whole days.
 */
public enum RetentionSchedule {
    DAILY("daily", 1),
    WEEKLY("weekly", 7),
    MONTHLY("monthly", 30);

    private final String value;
    private final int intervalDays;

    RetentionSchedule(String value, int intervalDays) {
        this.value = value;
        this.intervalDays = intervalDays;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int intervalDays() {
        return intervalDays;
    }

    @JsonCreator
    public static RetentionSchedule fromValue(String value) {
        return Arrays.stream(values())
                .filter(v -> v.value.equalsIgnoreCase(value) || v.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown retention schedule: " + value));
    }
}
