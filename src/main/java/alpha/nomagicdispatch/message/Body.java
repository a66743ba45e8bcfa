package alpha.nomagicdispatch.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * The body of a {@link Request} or a {@link Response}.<p>
 * 
 * A body is one of four kinds, each represented by a nested record: {@link
 * Empty}, {@link Text}, {@link Json} and {@link Bytes}. Clients discriminate
 * using {@code instanceof}:
 * 
 * <pre>{@code
 *   if (request.body() instanceof Body.Json j) {
 *       JsonNode user = j.value();
 *       ...
 *   }
 * }</pre>
 * 
 * Bodies are immutable. The array of {@link Bytes} is copied on the way in
 * and on the way out.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Body
{
    /**
     * Returns the empty body.
     * 
     * @return the empty body
     */
    static Body empty() {
        return Empty.INSTANCE;
    }
    
    /**
     * Creates a text body.
     * 
     * @param text content
     * @return a text body
     * @throws NullPointerException if {@code text} is {@code null}
     */
    static Body text(String text) {
        return new Text(text);
    }
    
    /**
     * Creates a JSON body.
     * 
     * @param node content
     * @return a JSON body
     * @throws NullPointerException if {@code node} is {@code null}
     */
    static Body json(JsonNode node) {
        return new Json(node);
    }
    
    /**
     * Creates a binary body.
     * 
     * @param bytes content
     * @return a binary body
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    static Body bytes(byte[] bytes) {
        return new Bytes(bytes);
    }
    
    /**
     * Returns {@code true} if this is the {@link Empty} body.
     * 
     * @return {@code true} if this is the {@link Empty} body
     */
    default boolean isEmpty() {
        return this instanceof Empty;
    }
    
    /**
     * Returns the wire representation of this body.<p>
     * 
     * Text is encoded using UTF-8, JSON is serialized using the engine's
     * shared {@code ObjectMapper}.
     * 
     * @return the wire representation of this body
     */
    byte[] toBytes();
    
    /**
     * No body.
     */
    record Empty() implements Body {
        private static final Empty INSTANCE = new Empty();
        private static final byte[] NOTHING = new byte[0];
        
        @Override
        public byte[] toBytes() {
            return NOTHING;
        }
    }
    
    /**
     * A text body.
     * 
     * @param value the text
     */
    record Text(String value) implements Body {
        /**
         * Constructs a {@code Text}.
         * 
         * @param value the text
         */
        public Text {
            requireNonNull(value);
        }
        
        @Override
        public byte[] toBytes() {
            return value.getBytes(UTF_8);
        }
    }
    
    /**
     * A structured JSON body.
     * 
     * @param value the JSON tree
     */
    record Json(JsonNode value) implements Body {
        /**
         * Constructs a {@code Json}.
         * 
         * @param value the JSON tree
         */
        public Json {
            requireNonNull(value);
        }
        
        @Override
        public byte[] toBytes() {
            return alpha.nomagicdispatch.util.Json.toBytes(value);
        }
    }
    
    /**
     * A binary body.
     * 
     * @param value the bytes
     */
    record Bytes(byte[] value) implements Body {
        /**
         * Constructs a {@code Bytes}.
         * 
         * @param value the bytes
         */
        public Bytes {
            value = value.clone();
        }
        
        /**
         * Returns a copy of the bytes.
         * 
         * @return a copy of the bytes
         */
        @Override
        public byte[] value() {
            return value.clone();
        }
        
        @Override
        public byte[] toBytes() {
            return value.clone();
        }
        
        @Override
        public boolean equals(Object obj) {
            return obj instanceof Bytes other && Arrays.equals(value, other.value);
        }
        
        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }
        
        @Override
        public String toString() {
            return "Bytes[length=" + value.length + "]";
        }
    }
}
