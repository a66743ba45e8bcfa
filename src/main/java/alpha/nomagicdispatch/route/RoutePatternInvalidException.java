package alpha.nomagicdispatch.route;

/**
 * Thrown by {@link PathPattern#parse(String)} if a route pattern is invalid.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class RoutePatternInvalidException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    private final String pattern;
    
    /**
     * Constructs this object.
     * 
     * @param pattern the offending pattern
     * @param message explaining what is wrong
     */
    public RoutePatternInvalidException(String pattern, String message) {
        super(message + " Pattern: \"" + pattern + "\"");
        this.pattern = pattern;
    }
    
    /**
     * Returns the offending pattern.
     * 
     * @return the offending pattern
     */
    public String getPattern() {
        return pattern;
    }
}
