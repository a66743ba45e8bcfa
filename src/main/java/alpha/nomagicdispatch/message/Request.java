package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.handler.RequestHandler;

import java.util.Map;

/**
 * An inbound HTTP request, as seen by handlers.<p>
 * 
 * One instance is created per dispatch and shared by all handlers of that
 * dispatch. Handlers run strictly one after the other, so they will observe
 * each other's side effects, but the request object itself is immutable to
 * them.<p>
 * 
 * Path parameters are bound once a route matches. Middleware and error
 * handlers invoked before a route matched observe an empty map. For example,
 * given the route {@code "/users/:id"} and the request path
 * {@code "/users/42"}:
 * 
 * <pre>{@code
 *   String id = request.params().get("id"); // "42"
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see RequestHandler
 */
public interface Request
{
    /**
     * Returns the method token.
     * 
     * @return the method token (never {@code null})
     */
    String method();
    
    /**
     * Returns the request URL.<p>
     * 
     * If the adapter provided the absolute form, it is returned as-is.
     * Otherwise the URL is rebuilt using the {@code Host} header, if present.
     * Without a {@code Host} header, this method returns the raw
     * request-target.
     * 
     * @return the request URL (never {@code null})
     */
    String url();
    
    /**
     * Returns the path component of the request-target.<p>
     * 
     * The path is not percent-decoded, nor normalized in any way. The empty
     * path is replaced with "/".
     * 
     * @return the path component of the request-target (never {@code null})
     */
    String path();
    
    /**
     * Returns the request headers.
     * 
     * @return the request headers (read-only, never {@code null})
     */
    Headers headers();
    
    /**
     * Returns path parameters extracted from the request path by the matched
     * route.
     * 
     * @return path parameters (unmodifiable, never {@code null})
     */
    Map<String, String> params();
    
    /**
     * Returns percent-decoded query parameters.<p>
     * 
     * If a query key is repeated, the last value wins. A key without a value
     * maps to the empty string.
     * 
     * @return query parameters (unmodifiable, never {@code null})
     */
    Map<String, String> query();
    
    /**
     * Returns the request body.<p>
     * 
     * The body was converted by the engine based on the {@code Content-Type}
     * header:
     * 
     * <table>
     *   <caption>Body conversion</caption>
     *   <tr><th>Content-Type</th><th>Body</th></tr>
     *   <tr><td>application/json</td><td>{@link Body.Json}</td></tr>
     *   <tr><td>application/x-www-form-urlencoded</td><td>{@link Body.Json} (an object of fields)</td></tr>
     *   <tr><td>application/octet-stream</td><td>{@link Body.Bytes}</td></tr>
     *   <tr><td>anything else, or absent</td><td>{@link Body.Text}</td></tr>
     * </table>
     * 
     * An empty body, or a body that failed conversion, is {@link Body.Empty}.
     * 
     * @return the request body (never {@code null})
     */
    Body body();
}
