package alpha.nomagicdispatch.route;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A route's path template; a '/'-separated sequence of static segments and
 * single-segment path parameters.<p>
 * 
 * Path parameters are denoted using the prefix ':'. They match any one
 * segment of the request path, including the empty segment, and the segment
 * value is bound to the parameter name as-is; without percent-decoding.
 * 
 * <pre>
 *   Pattern: /users/:id
 * 
 *   Request path:
 *   /users/42            match, id = 42
 *   /users/me            match, id = me
 *   /users               no match (missing segment)
 *   /users/42/profile    no match (unknown segment "profile")
 * </pre>
 * 
 * There are no catch-all or optional segments. A request path matches only a
 * pattern with the exact same number of segments. Empty segments are
 * significant, so "/users/" does not match "/users" and vice versa. Static
 * segments are compared case-sensitively.<p>
 * 
 * A valid pattern begins with '/', declares unique and non-empty parameter
 * names and does not contain the character '*'.<p>
 * 
 * The implementation is immutable and thread-safe. Matching is a stateless
 * function of the pattern and the request path.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class PathPattern
{
    private static final char PARAM_PREFIX = ':';
    private static final String SEPARATOR = "/";
    
    /**
     * Parses a route pattern.
     * 
     * @param pattern to parse
     * 
     * @return a path pattern
     * 
     * @throws NullPointerException
     *             if {@code pattern} is {@code null}
     * @throws RoutePatternInvalidException
     *             if the pattern does not begin with '/', or
     *             if the pattern contains '*', or
     *             if a parameter name is empty, or
     *             if a parameter name is repeated
     */
    public static PathPattern parse(String pattern) {
        if (!pattern.startsWith(SEPARATOR)) {
            throw new RoutePatternInvalidException(pattern,
                    "Pattern must begin with '/'.");
        }
        if (pattern.indexOf('*') != -1) {
            throw new RoutePatternInvalidException(pattern,
                    "Wildcards are not supported.");
        }
        var segments = split(pattern);
        var names = new ArrayList<String>();
        var unique = new HashSet<String>();
        for (String s : segments) {
            if (!isParam(s)) {
                continue;
            }
            String n = s.substring(1);
            if (n.isEmpty()) {
                throw new RoutePatternInvalidException(pattern,
                        "Empty parameter name.");
            }
            if (!unique.add(n)) {
                throw new RoutePatternInvalidException(pattern,
                        "Duplicated parameter name \"" + n + "\".");
            }
            names.add(n);
        }
        return new PathPattern(pattern, List.copyOf(segments), List.copyOf(names));
    }
    
    /**
     * Matches a request path against a raw route pattern.<p>
     * 
     * The route pattern is not validated. This is the same algorithm used by
     * {@link #match(String)}:
     * 
     * <ol>
     *   <li>If the path is equal to the pattern, the result is a match without
     *       parameters.</li>
     *   <li>Both are split on '/'. If the number of segments differ, the
     *       result is no match.</li>
     *   <li>Segments are compared pairwise. A parameter segment binds the
     *       request path segment to its name. A static segment must be equal
     *       to the request path segment, or else the result is no match.</li>
     * </ol>
     * 
     * If a raw pattern repeats a parameter name, the last bound value wins.
     * 
     * @param actualPath request path
     * @param routePattern route pattern
     * 
     * @return the result (never {@code null})
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static MatchResult match(String actualPath, String routePattern) {
        requireNonNull(actualPath);
        if (actualPath.equals(routePattern)) {
            return MatchResult.matchNoParams();
        }
        return match(actualPath, split(routePattern));
    }
    
    private final String pattern;
    private final List<String> segments;
    private final List<String> names;
    
    private PathPattern(String pattern, List<String> segments, List<String> names) {
        this.pattern  = pattern;
        this.segments = segments;
        this.names    = names;
    }
    
    /**
     * Matches a request path against this pattern.
     * 
     * @param actualPath request path
     * @return the result (never {@code null})
     * @throws NullPointerException if {@code actualPath} is {@code null}
     * @see #match(String, String) 
     */
    public MatchResult match(String actualPath) {
        if (actualPath.equals(pattern)) {
            return MatchResult.matchNoParams();
        }
        return match(actualPath, segments);
    }
    
    /**
     * Returns the declared parameter names, in order of declaration.
     * 
     * @return the declared parameter names (unmodifiable)
     */
    public List<String> paramNames() {
        return names;
    }
    
    /**
     * Returns a new pattern with the given prefix prepended.<p>
     * 
     * If the prefix is "/", this pattern is returned.
     * 
     * @param prefix to prepend
     * @return a new pattern
     * @throws RoutePatternInvalidException if the result is not valid
     */
    public PathPattern prefixed(String prefix) {
        return prefix.equals(SEPARATOR) ? this : parse(prefix + pattern);
    }
    
    /**
     * Returns the pattern as given to {@link #parse(String)}.
     * 
     * @return the pattern as given to {@link #parse(String)}
     */
    @Override
    public String toString() {
        return pattern;
    }
    
    private static MatchResult match(String actualPath, List<String> route) {
        var actual = split(actualPath);
        if (actual.size() != route.size()) {
            return MatchResult.noMatch();
        }
        Map<String, String> params = null;
        for (int i = 0; i < route.size(); ++i) {
            String r = route.get(i), a = actual.get(i);
            if (isParam(r)) {
                if (params == null) {
                    params = new HashMap<>();
                }
                params.put(r.substring(1), a);
            } else if (!r.equals(a)) {
                return MatchResult.noMatch();
            }
        }
        return params == null ? MatchResult.matchNoParams() :
                new MatchResult(true, params);
    }
    
    private static boolean isParam(String segment) {
        return !segment.isEmpty() && segment.charAt(0) == PARAM_PREFIX;
    }
    
    // Unlike String.split, trailing empty segments are kept
    private static List<String> split(String path) {
        var segments = new ArrayList<String>();
        int from = 0, to;
        while ((to = path.indexOf('/', from)) != -1) {
            segments.add(path.substring(from, to));
            from = to + 1;
        }
        segments.add(path.substring(from));
        return segments;
    }
}
