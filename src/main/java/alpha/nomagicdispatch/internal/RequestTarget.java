package alpha.nomagicdispatch.internal;

import java.net.URLDecoder;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;

/**
 * The parsed components of a request-target.<p>
 * 
 * The target may be in the origin form ("/where?q=now") or the absolute form
 * ("http://www.example.com/where?q=now"). A fragment, although illegal in a
 * request-target, is discarded.
 * 
 * @param path  raw path, never empty ("/" at minimum)
 * @param query percent-decoded query parameters, last value wins
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
record RequestTarget(String path, Map<String, String> query)
{
    private static final String SCHEME_END = "://";
    
    static RequestTarget parse(String target) {
        String rest = target;
        int scheme = rest.indexOf(SCHEME_END);
        if (scheme != -1 && rest.indexOf('/') > scheme) {
            // Skip authority
            int end = scheme + SCHEME_END.length();
            while (end < rest.length() && "/?#".indexOf(rest.charAt(end)) == -1) {
                ++end;
            }
            rest = rest.substring(end);
        }
        int hash = rest.indexOf('#');
        if (hash != -1) {
            rest = rest.substring(0, hash);
        }
        int q = rest.indexOf('?');
        String path  = q == -1 ? rest : rest.substring(0, q),
               query = q == -1 ? ""   : rest.substring(q + 1);
        return new RequestTarget(path.isEmpty() ? "/" : path, parseQuery(query));
    }
    
    /**
     * Parses an "application/x-www-form-urlencoded" string.
     * 
     * @param query to parse
     * @return keys and values, decoded (unmodifiable)
     */
    static Map<String, String> parseQuery(String query) {
        if (query.isEmpty()) {
            return Map.of();
        }
        var params = new LinkedHashMap<String, String>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String k = eq == -1 ? pair : pair.substring(0, eq),
                   v = eq == -1 ? ""   : pair.substring(eq + 1);
            params.put(decode(k), decode(v));
        }
        return unmodifiableMap(params);
    }
    
    private static String decode(String str) {
        try {
            return URLDecoder.decode(str, UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escape, e.g. "%G1". Keep as-is.
            return str;
        }
    }
}
