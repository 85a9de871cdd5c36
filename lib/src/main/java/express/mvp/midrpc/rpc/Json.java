package express.mvp.midrpc.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import express.mvp.midrpc.ClientException;
import java.util.List;

/** Shared Jackson mapper and helpers for the wire formats. */
public final class Json {

    /** Thread-safe once configured. */
    public static final ObjectMapper MAPPER =
            new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                    .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private Json() {
        // Utility class
    }

    /**
     * Serializes a value to compact JSON.
     *
     * @param value any Jackson-serializable value
     * @return the JSON text
     * @throws ClientException if the value cannot be serialized
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ClientException("failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses JSON text into a tree.
     *
     * @param text JSON text
     * @return the tree
     * @throws ClientException if the text is not valid JSON
     */
    public static JsonNode read(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            return node == null || node.isMissingNode() ? NullNode.getInstance() : node;
        } catch (JsonProcessingException e) {
            throw new ClientException("invalid JSON response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Like {@link #read(String)} but returns {@code null} instead of failing.
     *
     * @param text candidate JSON text
     * @return the tree, or {@code null} if the text is not a single JSON value
     */
    public static JsonNode tryRead(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Converts call parameters into the positional argument array sent over JSON-RPC.
     *
     * <p>A {@link List} (or a JSON array) is used as is; {@code null} becomes an empty array; any
     * other value becomes a one-element array.
     *
     * @param params call parameters
     * @return the positional arguments
     */
    public static ArrayNode positional(Object params) {
        if (params == null) {
            return MAPPER.createArrayNode();
        }
        if (params instanceof ArrayNode array) {
            return array;
        }
        if (params instanceof List<?>) {
            return MAPPER.valueToTree(params);
        }
        ArrayNode array = MAPPER.createArrayNode();
        array.add(MAPPER.<JsonNode>valueToTree(params));
        return array;
    }
}
