package alpha.nomagicdispatch.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Holder of the engine's shared {@link ObjectMapper}.<p>
 * 
 * An {@code ObjectMapper} is thread-safe once configured, and it is never
 * reconfigured after class initialization.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Json
{
    private Json() {
        // Empty
    }
    
    // A document followed by anything but whitespace is not valid JSON
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    
    /**
     * Parses the given bytes into a JSON tree.
     * 
     * @param bytes to parse (UTF-8, UTF-16 or UTF-32)
     * @return a JSON tree
     * @throws IOException if the bytes are not exactly one JSON value
     *         (surrounding whitespace allowed)
     */
    public static JsonNode read(byte[] bytes) throws IOException {
        JsonNode n = MAPPER.readTree(bytes);
        if (n == null || n.isMissingNode()) {
            throw new IOException("No JSON value in content.");
        }
        return n;
    }
    
    /**
     * Converts the given object into a JSON tree.<p>
     * 
     * {@code String}s, numbers, {@code Map}s, {@code List}s and Java beans
     * are all accepted; whatever Jackson's default mapping can serialize.
     * 
     * @param value to convert (may be {@code null})
     * @return a JSON tree (never {@code null}, but may be a {@code NullNode})
     * @throws IllegalArgumentException if Jackson can not convert the value
     */
    public static JsonNode toTree(Object value) {
        return value instanceof JsonNode n ? n : MAPPER.valueToTree(value);
    }
    
    /**
     * Creates an empty JSON object.
     * 
     * @return an empty JSON object
     */
    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }
    
    /**
     * Serializes the given JSON tree.
     * 
     * @param node to serialize
     * @return the serialized tree, encoded using UTF-8
     */
    public static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            // Writing a tree involves no type introspection and will not fail
            throw new UncheckedIOException(e);
        }
    }
}
