package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How long an event must be kept: a number of days, or indefinitely.
 * Serialized as a JSON number or the string {@code "indefinite"}.
 */
public record RetentionPeriod(Integer days) {

    public static final String INDEFINITE_VALUE = "indefinite";
    public static final RetentionPeriod INDEFINITE = new RetentionPeriod(null);

    public RetentionPeriod {
        if (days != null && days < 0) {
            throw new IllegalArgumentException("Retention days cannot be negative: " + days);
        }
    }

    public static RetentionPeriod ofDays(int days) {
        return new RetentionPeriod(days);
    }

    public static RetentionPeriod ofYears(int years) {
        return new RetentionPeriod(years * 365);
    }

    public boolean isIndefinite() {
        return days == null;
    }

    @JsonValue
    public Object jsonValue() {
        return days == null ? INDEFINITE_VALUE : days;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RetentionPeriod fromJson(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return ofDays(number.intValue());
        }
        String text = value.toString().trim();
        if (INDEFINITE_VALUE.equalsIgnoreCase(text)) {
            return INDEFINITE;
        }
        try {
            return ofDays(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid retention period: " + value, e);
        }
    }

    @Override
    public String toString() {
        return days == null ? INDEFINITE_VALUE : days + "d";
    }
}
