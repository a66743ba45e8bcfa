package alpha.nomagicdispatch.message;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiConsumer;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Objects.requireNonNull;

/**
 * HTTP headers; a multi-valued map with case-insensitive keys.<p>
 * 
 * Headers of a {@link Response} are mutable. Headers of a {@link Request} are
 * a read-only copy of what the adapter received, and all mutating methods
 * throw {@link UnsupportedOperationException}.<p>
 * 
 * Iteration order is the natural order of the header names, ignoring case.<p>
 * 
 * The implementation is not thread-safe. It is meant to be used by only one
 * dispatch at a time.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Headers
{
    /**
     * Creates an empty and mutable {@code Headers}.
     * 
     * @return an empty and mutable {@code Headers}
     */
    public static Headers empty() {
        return new Headers(false);
    }
    
    /**
     * Creates a read-only copy of the given map.<p>
     * 
     * Values of keys that differ only in case are merged, in iteration order
     * of the given map.
     * 
     * @param map to copy
     * @return a read-only copy of the given map
     * @throws NullPointerException if {@code map}, or any key or value in it,
     *         is {@code null}
     */
    public static Headers copyOf(Map<String, ? extends Collection<String>> map) {
        var h = new Headers(false);
        map.forEach((k, v) -> v.forEach(e -> h.add(k, e)));
        return new Headers(h.map, true);
    }
    
    private final Map<String, List<String>> map;
    private final boolean readOnly;
    
    private Headers(boolean readOnly) {
        this(new TreeMap<>(CASE_INSENSITIVE_ORDER), readOnly);
    }
    
    private Headers(Map<String, List<String>> map, boolean readOnly) {
        this.map = map;
        this.readOnly = readOnly;
    }
    
    /**
     * Returns the first value of the given header.
     * 
     * @param name of header
     * @return the first value (never {@code null})
     */
    public Optional<String> firstValue(String name) {
        var vals = map.get(requireNonNull(name));
        return vals == null || vals.isEmpty() ?
                Optional.empty() : Optional.of(vals.get(0));
    }
    
    /**
     * Returns all values of the given header.
     * 
     * @param name of header
     * @return all values (unmodifiable, never {@code null})
     */
    public List<String> allValues(String name) {
        var vals = map.get(requireNonNull(name));
        return vals == null ? List.of() : Collections.unmodifiableList(vals);
    }
    
    /**
     * Returns {@code true} if the given header is present.
     * 
     * @param name of header
     * @return {@code true} if the given header is present
     */
    public boolean contains(String name) {
        return map.containsKey(requireNonNull(name));
    }
    
    /**
     * Returns {@code true} if no header is present.
     * 
     * @return {@code true} if no header is present
     */
    public boolean isEmpty() {
        return map.isEmpty();
    }
    
    /**
     * Replaces all values of the given header with the given value.
     * 
     * @param name of header
     * @param value of header
     * @return this (for chaining/fluency)
     * @throws UnsupportedOperationException if these headers are read-only
     */
    public Headers set(String name, String value) {
        requireMutable();
        var vals = new ArrayList<String>(1);
        vals.add(requireNonNull(value));
        map.put(requireNonNull(name), vals);
        return this;
    }
    
    /**
     * Adds a value to the given header.
     * 
     * @param name of header
     * @param value to add
     * @return this (for chaining/fluency)
     * @throws UnsupportedOperationException if these headers are read-only
     */
    public Headers add(String name, String value) {
        requireMutable();
        requireNonNull(value);
        map.computeIfAbsent(requireNonNull(name), k -> new ArrayList<>(1))
           .add(value);
        return this;
    }
    
    /**
     * Removes all values of the given header.
     * 
     * @param name of header
     * @return this (for chaining/fluency)
     * @throws UnsupportedOperationException if these headers are read-only
     */
    public Headers remove(String name) {
        requireMutable();
        map.remove(requireNonNull(name));
        return this;
    }
    
    /**
     * Removes all headers.
     * 
     * @return this (for chaining/fluency)
     * @throws UnsupportedOperationException if these headers are read-only
     */
    public Headers clear() {
        requireMutable();
        map.clear();
        return this;
    }
    
    /**
     * Performs the given action for each header name and its values.
     * 
     * @param action to perform
     */
    public void forEach(BiConsumer<String, List<String>> action) {
        map.forEach((k, v) -> action.accept(k, Collections.unmodifiableList(v)));
    }
    
    /**
     * Returns an unmodifiable view of these headers.
     * 
     * @return an unmodifiable view of these headers
     */
    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(map);
    }
    
    private void requireMutable() {
        if (readOnly) {
            throw new UnsupportedOperationException("Headers are read-only.");
        }
    }
    
    @Override
    public String toString() {
        return map.toString();
    }
}
