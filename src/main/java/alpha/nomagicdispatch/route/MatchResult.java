package alpha.nomagicdispatch.route;

import java.util.Map;

/**
 * The result of matching a request path against a {@link PathPattern}.
 * 
 * @param matched    {@code true} if the path matched
 * @param parameters extracted path parameters (unmodifiable, empty if no match)
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record MatchResult(boolean matched, Map<String, String> parameters)
{
    private static final MatchResult
            NO_MATCH = new MatchResult(false, Map.of()),
            MATCH_NO_PARAMS = new MatchResult(true, Map.of());
    
    /**
     * Constructs a {@code MatchResult}.
     * 
     * @param matched    {@code true} if the path matched
     * @param parameters extracted path parameters
     */
    public MatchResult {
        parameters = Map.copyOf(parameters);
    }
    
    /**
     * Returns a result representing no match.
     * 
     * @return a result representing no match
     */
    public static MatchResult noMatch() {
        return NO_MATCH;
    }
    
    /**
     * Returns a result representing a match without parameters.
     * 
     * @return a result representing a match without parameters
     */
    public static MatchResult matchNoParams() {
        return MATCH_NO_PARAMS;
    }
}
