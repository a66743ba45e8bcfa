package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.handler.ErrorHandler;
import alpha.nomagicdispatch.handler.RequestHandler;
import alpha.nomagicdispatch.route.MatchResult;
import alpha.nomagicdispatch.route.Route;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Ordered collections of routes, middleware and error handlers.<p>
 * 
 * The registry is append-only. Order of registration is order of precedence;
 * a lookup never re-orders entries by specificity.<p>
 * 
 * The collections are copy-on-write, so lookups are safe to perform
 * concurrently with each other, and they do not observe half-made
 * registrations. Registrations are expected to complete before the first
 * lookup, which is enforced by the {@link DefaultEngine}, not here.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Registry
{
    /** Prefix filter that matches all paths. */
    static final String ALL = "*";
    
    /**
     * A handler registered for a path prefix.
     * 
     * @param prefix filter; {@value ALL} or a literal path prefix
     * @param handler the handler
     * @param <H> type of handler
     */
    record Filtered<H>(String prefix, H handler) {
        Filtered {
            requireNonNull(prefix);
            requireNonNull(handler);
        }
        
        boolean appliesTo(String path) {
            return prefix.equals(ALL) || path.startsWith(prefix);
        }
        
        Filtered<H> withPrefix(String mount) {
            if (mount.equals("/")) {
                return this;
            }
            return new Filtered<>(prefix.equals(ALL) ? mount : mount + prefix, handler);
        }
    }
    
    /**
     * A route lookup hit.
     * 
     * @param route the matched route
     * @param result of matching the path
     */
    record RouteMatch(Route route, MatchResult result) {
        // Empty
    }
    
    private final List<Route> routes;
    private final List<Filtered<RequestHandler>> middleware;
    private final List<Filtered<ErrorHandler>> errorHandlers;
    
    Registry() {
        routes        = new CopyOnWriteArrayList<>();
        middleware    = new CopyOnWriteArrayList<>();
        errorHandlers = new CopyOnWriteArrayList<>();
    }
    
    void addRoute(Route route) {
        routes.add(requireNonNull(route));
    }
    
    void addMiddleware(String prefix, RequestHandler handler) {
        middleware.add(new Filtered<>(prefix, handler));
    }
    
    void addErrorHandler(String prefix, ErrorHandler handler) {
        errorHandlers.add(new Filtered<>(prefix, handler));
    }
    
    /**
     * Returns the first route matching the given method and path.
     * 
     * @param method request method token
     * @param path request path
     * @return the match, or {@code null} if no route matches
     */
    RouteMatch lookup(String method, String path) {
        for (Route r : routes) {
            var res = r.match(method, path);
            if (res.matched()) {
                return new RouteMatch(r, res);
            }
        }
        return null;
    }
    
    /**
     * Returns middleware applicable to the given path, in order of
     * registration.
     * 
     * @param path request path
     * @return middleware (a new list)
     */
    List<RequestHandler> middleware(String path) {
        return applicable(middleware, path);
    }
    
    /**
     * Returns error handlers applicable to the given path, in order of
     * registration.
     * 
     * @param path request path
     * @return error handlers (a new list)
     */
    List<ErrorHandler> errorHandlers(String path) {
        return applicable(errorHandlers, path);
    }
    
    private static <H> List<H> applicable(List<Filtered<H>> entries, String path) {
        var hits = new ArrayList<H>(entries.size());
        for (var e : entries) {
            if (e.appliesTo(path)) {
                hits.add(e.handler());
            }
        }
        return hits;
    }
    
    List<Route> routes() {
        return List.copyOf(routes);
    }
    
    List<Filtered<RequestHandler>> middlewareEntries() {
        return List.copyOf(middleware);
    }
    
    List<Filtered<ErrorHandler>> errorHandlerEntries() {
        return List.copyOf(errorHandlers);
    }
    
    /**
     * Copies all entries of this registry into the given registry, with paths
     * rewritten to begin with the given prefix.<p>
     * 
     * The copy is structural. Entries added to this registry afterwards are
     * not seen by the target. This registry is not modified.
     * 
     * @param prefix to prepend ("/" prepends nothing)
     * @param target registry to copy into
     */
    void copyInto(String prefix, Registry target) {
        // Build all copies first, an invalid pattern must not leave the target half-copied
        var r = new ArrayList<Route>();
        routes.forEach(x -> r.add(x.withPrefix(prefix)));
        var m = new ArrayList<Filtered<RequestHandler>>();
        middleware.forEach(x -> m.add(x.withPrefix(prefix)));
        var e = new ArrayList<Filtered<ErrorHandler>>();
        errorHandlers.forEach(x -> e.add(x.withPrefix(prefix)));
        target.routes.addAll(r);
        target.middleware.addAll(m);
        target.errorHandlers.addAll(e);
    }
}
