package tech.yump.secretsync.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.secretsync.provider.error.MalformedPayloadException;
import tech.yump.secretsync.provider.error.PropertyNotFoundException;
import tech.yump.secretsync.provider.error.SourceKeyNotFoundException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts between structured secret payloads and flat key/value data.
 *
 * <p>Flattening descends exactly one level: string leaves are returned as their raw UTF-8 bytes,
 * every other leaf (number, boolean, null, nested object or array) as its compact JSON text.
 */
@Slf4j
public class DataExtractor {

    private final ObjectMapper objectMapper;

    public DataExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Resolves the bytes to push for a {@link PushSpec}.
     *
     * @throws SourceKeyNotFoundException if a source key is set but absent from {@code sourceData}
     */
    public byte[] resolvePushValue(PushSpec spec, Map<String, byte[]> sourceData) throws SourceKeyNotFoundException {
        if (!spec.hasSourceKey()) {
            return toCanonicalJson(sourceData);
        }
        byte[] value = sourceData.get(spec.sourceKey());
        if (value == null) {
            throw new SourceKeyNotFoundException(
                    "Source key '" + spec.sourceKey() + "' not found in source secret for remote key '" + spec.remoteKey() + "'");
        }
        return value;
    }

    /**
     * Serializes a secret data map as JSON with sorted keys and UTF-8 string values.
     */
    public byte[] toCanonicalJson(Map<String, byte[]> data) {
        Map<String, String> sorted = new TreeMap<>();
        data.forEach((key, value) -> sorted.put(key, new String(value, StandardCharsets.UTF_8)));
        try {
            return objectMapper.writeValueAsBytes(sorted);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize secret data with {} keys: {}", sorted.size(), e.getMessage());
            throw new MalformedPayloadException("Failed to serialize secret data as JSON", e);
        }
    }

    /**
     * Flattens a JSON object payload into top-level key/value pairs.
     *
     * @param secretName used in error messages only
     * @throws MalformedPayloadException if the payload is not a JSON object
     */
    public Map<String, byte[]> flatten(String secretName, byte[] payload) throws MalformedPayloadException {
        ObjectNode root = readObject(secretName, payload);
        Map<String, byte[]> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), leafBytes(field.getValue()));
        }
        return result;
    }

    /**
     * Returns one top-level field of a JSON object payload, stringified like {@link #flatten}.
     */
    public byte[] extractProperty(String secretName, byte[] payload, String property)
            throws MalformedPayloadException, PropertyNotFoundException {
        JsonNode value = readObject(secretName, payload).get(property);
        if (value == null) {
            throw new PropertyNotFoundException("Property '" + property + "' not found in secret '" + secretName + "'");
        }
        return leafBytes(value);
    }

    /**
     * Sets {@code property} of the JSON object held in {@code existing} to {@code value} as a string.
     * A missing existing value starts from an empty object.
     */
    public byte[] mergeProperty(String secretName, @Nullable byte[] existing, String property, byte[] value)
            throws MalformedPayloadException {
        ObjectNode root = existing == null ? objectMapper.createObjectNode() : readObject(secretName, existing).deepCopy();
        root.put(property, new String(value, StandardCharsets.UTF_8));
        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Failed to serialize merged payload for secret '" + secretName + "'", e);
        }
    }

    private ObjectNode readObject(String secretName, byte[] payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new MalformedPayloadException("Failed to parse secret '" + secretName + "' as JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("Secret '" + secretName + "' is not a JSON object");
        }
        return (ObjectNode) root;
    }

    private byte[] leafBytes(JsonNode node) {
        String text = node.isTextual() ? node.textValue() : node.toString();
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
