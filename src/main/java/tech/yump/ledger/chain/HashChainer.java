package tech.yump.ledger.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.bouncycastle.util.encoders.Hex;
import tech.yump.ledger.event.LedgerEvent;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Computes the chained SHA-256 hash of a ledger event.
 * <p>
 * The hash covers the canonical JSON form of the event without its {@code hash} member:
 * object members sorted by name at every depth, null members dropped, no whitespace, UTF-8.
 * The same fields and the same {@code previous_hash} always produce the same hash, whether the
 * input is a freshly built {@link LedgerEvent} or a line read back from disk.
 */
public class HashChainer {

    /** {@code previous_hash} of the very first event of a ledger. */
    public static final String GENESIS_HASH = "0".repeat(64);

    static final String HASH_FIELD = "hash";
    static final String PREVIOUS_HASH_FIELD = "previous_hash";

    private static final String SHA_256 = "SHA-256";

    private final ObjectMapper objectMapper;

    public HashChainer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Hash of {@code event} chained onto {@code previousHash}. Any {@code hash} already set on the
     * event is ignored and its {@code previousHash} is replaced by the given one.
     */
    public String compute(LedgerEvent event, String previousHash) {
        LedgerEvent unsigned = event.toBuilder()
                .hash(null)
                .previousHash(previousHash)
                .build();
        return compute(objectMapper.valueToTree(unsigned));
    }

    /**
     * Hash of a stored event as found on disk, {@code previous_hash} included, {@code hash} excluded.
     */
    public String compute(JsonNode storedEvent) {
        if (storedEvent == null || !storedEvent.isObject()) {
            throw new IllegalArgumentException("A ledger event must be a JSON object");
        }
        ObjectNode unsigned = ((ObjectNode) storedEvent).deepCopy();
        unsigned.remove(HASH_FIELD);
        return sha256Hex(canonicalBytes(unsigned));
    }

    /**
     * Canonical JSON text of a node, as hashed by {@link #compute(JsonNode)}.
     */
    public String canonicalize(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write canonical JSON", e);
        }
    }

    private byte[] canonicalBytes(JsonNode node) {
        try {
            return objectMapper.writeValueAsBytes(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write canonical JSON", e);
        }
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                JsonNode child = node.get(name);
                if (child != null && !child.isNull() && !child.isMissingNode()) {
                    copy.set(name, sorted(child));
                }
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                copy.add(sorted(it.next()));
            }
            return copy;
        }
        return node;
    }

    static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance(SHA_256);
            return Hex.toHexString(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
