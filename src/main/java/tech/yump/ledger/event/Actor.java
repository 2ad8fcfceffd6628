package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;

import java.util.Arrays;

/**
 * Who triggered an event. The {@code ip} is stored masked (see {@link EventSanitizer#maskIp(String)}).
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Actor(
        Type type,
        String id,
        String ip
) {

    public Actor {
        if (type == null) {
            type = Type.SYSTEM;
        }
    }

    public static Actor system() {
        return new Actor(Type.SYSTEM, null, null);
    }

    public static Actor user(String id, String ip) {
        return new Actor(Type.USER, id, ip);
    }

    public static Actor admin(String id) {
        return new Actor(Type.ADMIN, id, null);
    }

    public enum Type {
        USER("user"),
        SYSTEM("system"),
        ADMIN("admin");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static Type fromValue(String value) {
            return Arrays.stream(values())
                    .filter(t -> t.value.equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown actor type: " + value));
        }
    }
}
