package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The object an event acted upon, e.g. {@code {type: "configuration", id: "retention_years"}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Resource(
        String type,
        String id
) {

    public static Resource of(String type) {
        return new Resource(type, null);
    }

    public static Resource of(String type, String id) {
        return new Resource(type, id);
    }
}
