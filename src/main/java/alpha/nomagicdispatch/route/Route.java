package alpha.nomagicdispatch.route;

import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.HttpConstants.Method;
import alpha.nomagicdispatch.handler.RequestHandler;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A {@code Route} is a method, a {@link PathPattern} and an ordered chain of
 * {@link RequestHandler}s.<p>
 * 
 * Routes are usually not created directly, but implicitly through the
 * registration methods of the {@link Engine}:
 * 
 * <pre>{@code
 *   app.get("/users/:id", loadUser, renderUser);
 * }</pre>
 * 
 * The engine selects the first registered route whose method is equal to the
 * request method and whose pattern matches the request path. There are no
 * specificity rules. If {@code "/users/:id"} is registered before {@code
 * "/users/me"}, then a request to "/users/me" will always be served by the
 * former with the parameter {@code id = "me"}. Register static routes first.<p>
 * 
 * The handlers of the route are executed one at a time, each handler passing
 * control to the next by calling {@code chain.proceed()}, until the response
 * has been written.<p>
 * 
 * The implementation is immutable and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Engine#route(Method, String, RequestHandler, RequestHandler...)
 */
public final class Route
{
    /**
     * Creates a route.
     * 
     * @param method  HTTP method
     * @param pattern path pattern
     * @param first   first handler
     * @param more    optionally more handlers
     * 
     * @return a new route
     * 
     * @throws NullPointerException
     *             if any argument or handler is {@code null}
     * @throws RoutePatternInvalidException
     *             if the pattern is invalid (see {@link PathPattern})
     */
    public static Route of(
            Method method, String pattern, RequestHandler first, RequestHandler... more)
    {
        var handlers = new ArrayList<RequestHandler>(1 + more.length);
        handlers.add(requireNonNull(first));
        for (RequestHandler h : more) {
            handlers.add(requireNonNull(h));
        }
        return new Route(requireNonNull(method), PathPattern.parse(pattern), List.copyOf(handlers));
    }
    
    private final Method method;
    private final PathPattern pattern;
    private final List<RequestHandler> handlers;
    
    private Route(Method method, PathPattern pattern, List<RequestHandler> handlers) {
        this.method   = method;
        this.pattern  = pattern;
        this.handlers = handlers;
    }
    
    /**
     * Returns the method this route is registered for.
     * 
     * @return the method this route is registered for
     */
    public Method method() {
        return method;
    }
    
    /**
     * Returns the path pattern.
     * 
     * @return the path pattern
     */
    public PathPattern pattern() {
        return pattern;
    }
    
    /**
     * Returns the handlers, in order of execution.
     * 
     * @return the handlers (unmodifiable, never empty)
     */
    public List<RequestHandler> handlers() {
        return handlers;
    }
    
    /**
     * Matches the request path against the pattern, given that the method is
     * equal.
     * 
     * @param method request method token
     * @param path   request path
     * 
     * @return the result (never {@code null})
     */
    public MatchResult match(String method, String path) {
        return this.method.name().equals(method) ?
                pattern.match(path) : MatchResult.noMatch();
    }
    
    /**
     * Returns a copy of this route with the given prefix prepended to the
     * pattern. The handlers are shared.
     * 
     * @param prefix to prepend
     * @return a copy of this route
     * @see PathPattern#prefixed(String)
     */
    public Route withPrefix(String prefix) {
        return new Route(method, pattern.prefixed(prefix), handlers);
    }
    
    /**
     * Returns the method and the pattern, e.g. "GET /users/:id".
     * 
     * @return the method and the pattern
     */
    @Override
    public String toString() {
        return method + " " + pattern;
    }
}
