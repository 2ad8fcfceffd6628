package tech.yump.ledger.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Irreversibly strips sensitive content from an event before it is hashed and stored.
 * <ul>
 *   <li>detail keys naming a secret (password, secret, token, key, credential, auth) are redacted;</li>
 *   <li>string values mentioning a password, secret or credential are redacted;</li>
 *   <li>string values longer than the configured threshold are redacted;</li>
 *   <li>actor IPs are masked (last IPv4 octet / last IPv6 group zeroed).</li>
 * </ul>
 * Applying the sanitizer to already sanitized data is a no-op.
 */
@Slf4j
public class EventSanitizer {

    public static final String REDACTED = "[REDACTED]";

    private static final Pattern SENSITIVE_KEY = Pattern.compile("password|secret|token|key|credential|auth", Pattern.CASE_INSENSITIVE);
    private static final Pattern SENSITIVE_VALUE = Pattern.compile("password|passwd|secret|credential", Pattern.CASE_INSENSITIVE);
    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final int maxValueLength;

    public EventSanitizer(ObjectMapper objectMapper, int maxValueLength) {
        if (maxValueLength < 1) {
            throw new IllegalArgumentException("Redaction threshold must be positive: " + maxValueLength);
        }
        this.objectMapper = objectMapper;
        this.maxValueLength = maxValueLength;
    }

    public int maxValueLength() {
        return maxValueLength;
    }

    /**
     * Masks an IP address for storage. IPv4 keeps the first three octets, IPv6 has its last group zeroed.
     * Anything unrecognised is returned unchanged; blank input yields null.
     */
    public static String maskIp(String ip) {
        if (!StringUtils.hasText(ip)) {
            return null;
        }
        String trimmed = ip.trim();
        if (trimmed.contains(".") && !trimmed.contains(":")) {
            String[] parts = trimmed.split("\\.", -1);
            if (parts.length == 4) {
                parts[3] = "0";
                return String.join(".", parts);
            }
            return trimmed;
        }
        if (trimmed.contains(":")) {
            String[] parts = trimmed.split(":", -1);
            parts[parts.length - 1] = "0";
            return String.join(":", parts);
        }
        return trimmed;
    }

    public Actor sanitizeActor(Actor actor) {
        if (actor == null) {
            return Actor.system();
        }
        return actor.toBuilder().ip(maskIp(actor.ip())).build();
    }

    /**
     * Returns a redacted copy of the details, with values normalized to the plain JSON types
     * (String, Number, Boolean, List, Map) they will have once read back from disk.
     */
    public Map<String, Object> sanitizeDetails(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        Map<String, Object> redacted = redactMap(details);
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(redacted), DETAILS_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException("Event details are not serializable to JSON: " + e.getMessage(), e);
        }
    }

    public String sanitizeText(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() > maxValueLength || SENSITIVE_VALUE.matcher(value).find()) {
            return REDACTED;
        }
        return value;
    }

    private Map<String, Object> redactMap(Map<String, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            String key = entry.getKey();
            if (key != null && SENSITIVE_KEY.matcher(key).find()) {
                result.put(key, REDACTED);
            } else {
                result.put(key, redactValue(entry.getValue()));
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof CharSequence text) {
            return sanitizeText(text.toString());
        }
        if (value instanceof Map<?, ?> nested) {
            return redactMap((Map<String, ?>) nested);
        }
        if (value instanceof Iterable<?> items) {
            List<Object> copy = new ArrayList<>();
            for (Object item : items) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        if (value instanceof Enum<?> || value instanceof Number || value instanceof Boolean || value == null) {
            return value;
        }
        // POJOs are stored in their JSON form, redacted like any other nested map.
        try {
            String json = objectMapper.writeValueAsString(value);
            Object tree = objectMapper.readValue(json, Object.class);
            return tree instanceof String || tree instanceof Map || tree instanceof List ? redactValue(tree) : tree;
        } catch (JsonProcessingException e) {
            log.debug("Detail value of type {} is not JSON serializable, storing its string form.", value.getClass().getName());
            return sanitizeText(value.toString());
        }
    }
}
