package alpha.nomagicdispatch;

import alpha.nomagicdispatch.HttpConstants.Method;
import alpha.nomagicdispatch.adapter.Adapter;
import alpha.nomagicdispatch.adapter.JdkHttpServerAdapter;
import alpha.nomagicdispatch.adapter.Server;
import alpha.nomagicdispatch.handler.Chain;
import alpha.nomagicdispatch.handler.ErrorHandler;
import alpha.nomagicdispatch.handler.RequestHandler;
import alpha.nomagicdispatch.internal.DefaultEngine;
import alpha.nomagicdispatch.message.InboundRequest;
import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.route.PathPattern;
import alpha.nomagicdispatch.route.Route;
import alpha.nomagicdispatch.route.RoutePatternInvalidException;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionStage;

import static alpha.nomagicdispatch.HttpConstants.Method.DELETE;
import static alpha.nomagicdispatch.HttpConstants.Method.GET;
import static alpha.nomagicdispatch.HttpConstants.Method.PATCH;
import static alpha.nomagicdispatch.HttpConstants.Method.POST;
import static alpha.nomagicdispatch.HttpConstants.Method.PUT;

/**
 * Dispatches requests through middleware, routes and error handlers.<p>
 * 
 * An engine is a registry of three ordered sequences, and an algorithm that
 * walks through them for each request:
 * 
 * <ol>
 *   <li>Middleware ({@link #use(String, RequestHandler, RequestHandler...)
 *       use}) whose prefix filter matches the request path are executed in
 *       the order they were registered.</li>
 *   <li>The first {@link Route} whose method is equal to the request method
 *       and whose {@link PathPattern} matches the request path is selected,
 *       and its handlers are executed in order.</li>
 *   <li>If a handler {@linkplain Chain#fail(Throwable) fails}, the normal
 *       chain is abandoned and error handlers ({@link #onError(String,
 *       ErrorHandler, ErrorHandler...) onError}) whose prefix filter
 *       matches the request path are executed in the order they were
 *       registered.</li>
 * </ol>
 * 
 * Each handler passes control to the next handler by calling its {@link
 * Chain}. The first handler to write the response wins; no handler after it
 * executes. A trivial example:
 * 
 * <pre>{@code
 *   Engine app = Engine.create();
 *   app.use((req, res, chain) -> {
 *       System.out.println(req.method() + " " + req.path());
 *       chain.proceed();
 *   });
 *   app.get("/users/:id", (req, res, chain) ->
 *       res.json(Map.of("id", req.params().get("id"))));
 *   app.onError((err, req, res, chain) ->
 *       res.status(400).send(err.getMessage()));
 *   app.listen(8080);
 * }</pre>
 * 
 * The engine itself does no I/O. A request is given to {@link
 * #dispatch(InboundRequest)} and the response comes back through the returned
 * stage. Transport is the job of an {@link Adapter}. {@link #listen(int)}
 * uses the {@link JdkHttpServerAdapter}.
 * 
 * <h2>Completion guarantees</h2>
 * 
 * Every dispatch completes with a well-formed response:
 * <ul>
 *   <li>If no one wrote the response; "404 Not Found".</li>
 *   <li>If an error was not handled, or a handler threw an exception;
 *       "500 Internal Server Error". Exceptions thrown from a handler are not
 *       given to error handlers. A handler that wishes to have its error
 *       handled must catch it and call {@link Chain#fail(Throwable)}.</li>
 * </ul>
 * 
 * <h2>Thread safety</h2>
 * 
 * Registration is expected to complete before the engine serves requests. The
 * first call to {@code dispatch} freezes the engine, and subsequent
 * registrations throw {@link IllegalStateException}. After that point the
 * engine is thread-safe and may dispatch any number of requests
 * concurrently.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Engine
{
    /**
     * Creates an engine using {@linkplain Config#DEFAULT default
     * configuration}.
     * 
     * @return an instance of {@link DefaultEngine}
     */
    static Engine create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates an engine.
     * 
     * @param config of engine
     * @return an instance of {@link DefaultEngine}
     * @throws NullPointerException if {@code config} is {@code null}
     */
    static Engine create(Config config) {
        return new DefaultEngine(config);
    }
    
    /**
     * Registers a route.<p>
     * 
     * Routes are matched in the order they were registered.
     * 
     * @param method  HTTP method
     * @param pattern path pattern
     * @param first   first handler
     * @param more    optionally more handlers
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument or handler is {@code null}
     * @throws RoutePatternInvalidException
     *             if the pattern is invalid
     * @throws IllegalStateException
     *             if the engine has dispatched a request
     */
    Engine route(Method method, String pattern, RequestHandler first, RequestHandler... more);
    
    /**
     * Registers a route.
     * 
     * @param route to register
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code route} is {@code null}
     * @throws IllegalStateException if the engine has dispatched a request
     */
    Engine add(Route route);
    
    /**
     * Registers a {@link Method#GET GET} route.
     * 
     * @param pattern path pattern
     * @param first   first handler
     * @param more    optionally more handlers
     * @return this (for chaining/fluency)
     * @see #route(Method, String, RequestHandler, RequestHandler...) 
     */
    default Engine get(String pattern, RequestHandler first, RequestHandler... more) {
        return route(GET, pattern, first, more);
    }
    
    /**
     * Registers a {@link Method#POST POST} route.
     * 
     * @param pattern path pattern
     * @param first   first handler
     * @param more    optionally more handlers
     * @return this (for chaining/fluency)
     * @see #route(Method, String, RequestHandler, RequestHandler...) 
     */
    default Engine post(String pattern, RequestHandler first, RequestHandler... more) {
        return route(POST, pattern, first, more);
    }
    
    /**
     * Registers a {@link Method#PUT PUT} route.
     * 
     * @param pattern path pattern
     * @param first   first handler
     * @param more    optionally more handlers
     * @return this (for chaining/fluency)
     * @see #route(Method, String, RequestHandler, RequestHandler...) 
     */
    default Engine put(String pattern, RequestHandler first, RequestHandler... more) {
        return route(PUT, pattern, first, more);
    }
    
    /**
     * Registers a {@link Method#DELETE DELETE} route.
     * 
     * @param pattern path pattern
     * @param first   first handler
     * @param more    optionally more handlers
     * @return this (for chaining/fluency)
     * @see #route(Method, String, RequestHandler, RequestHandler...) 
     */
    default Engine delete(String pattern, RequestHandler first, RequestHandler... more) {
        return route(DELETE, pattern, first, more);
    }
    
    /**
     * Registers a {@link Method#PATCH PATCH} route.
     * 
     * @param pattern path pattern
     * @param first   first handler
     * @param more    optionally more handlers
     * @return this (for chaining/fluency)
     * @see #route(Method, String, RequestHandler, RequestHandler...) 
     */
    default Engine patch(String pattern, RequestHandler first, RequestHandler... more) {
        return route(PATCH, pattern, first, more);
    }
    
    /**
     * Registers middleware applicable to all requests.<p>
     * 
     * Same as {@code use("*", first, more)}.
     * 
     * @param first first handler
     * @param more  optionally more handlers
     * @return this (for chaining/fluency)
     * @see #use(String, RequestHandler, RequestHandler...) 
     */
    default Engine use(RequestHandler first, RequestHandler... more) {
        return use("*", first, more);
    }
    
    /**
     * Registers middleware applicable to requests whose path starts with the
     * given prefix.<p>
     * 
     * The prefix {@code "*"} matches all paths. Any other prefix is compared
     * literally, segment boundaries are not considered; {@code "/user"}
     * matches "/users/5".
     * 
     * @param prefix path prefix, or "*"
     * @param first  first handler
     * @param more   optionally more handlers
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument or handler is {@code null}
     * @throws IllegalArgumentException
     *             if {@code prefix} is neither "*" nor starts with "/"
     * @throws IllegalStateException
     *             if the engine has dispatched a request
     */
    Engine use(String prefix, RequestHandler first, RequestHandler... more);
    
    /**
     * Registers error handlers applicable to all requests.<p>
     * 
     * Same as {@code onError("*", first, more)}.
     * 
     * @param first first error handler
     * @param more  optionally more error handlers
     * @return this (for chaining/fluency)
     * @see #onError(String, ErrorHandler, ErrorHandler...) 
     */
    default Engine onError(ErrorHandler first, ErrorHandler... more) {
        return onError("*", first, more);
    }
    
    /**
     * Registers error handlers applicable to requests whose path starts with
     * the given prefix.
     * 
     * @param prefix path prefix, or "*"
     * @param first  first error handler
     * @param more   optionally more error handlers
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument or handler is {@code null}
     * @throws IllegalArgumentException
     *             if {@code prefix} is neither "*" nor starts with "/"
     * @throws IllegalStateException
     *             if the engine has dispatched a request
     * 
     * @see ErrorHandler
     */
    Engine onError(String prefix, ErrorHandler first, ErrorHandler... more);
    
    /**
     * Copies all routes, middleware and error handlers of the given engine
     * into this engine, with their paths prefixed.<p>
     * 
     * A route "/ping" of the child mounted at "/api" becomes "/api/ping" in
     * this engine. Middleware registered on the child for all paths ("*")
     * applies to paths starting with "/api". Mounting at "/" copies the
     * entries unchanged.<p>
     * 
     * The copy is made once. Entries registered on the child afterwards are
     * not seen by this engine. The child is not modified.
     * 
     * @param prefix path prefix
     * @param child  engine to copy from
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if the prefix does not start with "/", or ends with "/"
     *             (unless it is "/"), or if the child is this engine, or an
     *             unknown implementation
     * @throws RoutePatternInvalidException
     *             if a prefixed route pattern is invalid
     * @throws IllegalStateException
     *             if the engine has dispatched a request
     */
    Engine mount(String prefix, Engine child);
    
    /**
     * Returns a snapshot of all registered routes, in order of
     * registration.
     * 
     * @return all registered routes (unmodifiable)
     */
    List<Route> routes();
    
    /**
     * Dispatches a request.<p>
     * 
     * The returned stage completes when the response is final. It never
     * completes exceptionally.
     * 
     * @param request to dispatch
     * @return the response
     * @throws NullPointerException if {@code request} is {@code null}
     */
    CompletionStage<Response> dispatch(InboundRequest request);
    
    /**
     * Returns the engine's configuration.
     * 
     * @return the engine's configuration (never {@code null})
     */
    Config config();
    
    /**
     * Listens on the given port using the {@link JdkHttpServerAdapter}.
     * 
     * @param port to listen on, 0 for a system-picked port
     * @return the running server
     * @throws IOException if an I/O error occurs
     */
    default Server listen(int port) throws IOException {
        return listen(new JdkHttpServerAdapter(), port);
    }
    
    /**
     * Listens on the given port using the given adapter.
     * 
     * @param adapter transport
     * @param port    to listen on, 0 for a system-picked port
     * @return the running server
     * @throws NullPointerException if {@code adapter} is {@code null}
     * @throws IOException if an I/O error occurs
     */
    default Server listen(Adapter adapter, int port) throws IOException {
        return adapter.start(this, port);
    }
}
