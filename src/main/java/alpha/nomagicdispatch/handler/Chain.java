package alpha.nomagicdispatch.handler;

import java.util.concurrent.CompletionStage;

/**
 * Proceed, fail or abort the invocation chain of middleware and route
 * handlers.<p>
 * 
 * The chain object is thread-safe and does not necessarily have to be called
 * by the same thread running the handler. In fact, the chief purpose behind
 * this interface is to support asynchronous handlers that do not complete
 * their job when the handler's {@code handle} method returns.<p>
 * 
 * Each chain object passed to a handler is unique for that handler
 * invocation. Only the first call to a method declared in this interface has
 * an effect. Subsequent invocations are NOP. A handler can therefore never
 * cause a downstream handler to execute twice.<p>
 * 
 * The chain advances when <i>both</i> the handler's {@code handle} method has
 * returned normally and a method of this interface has been called. If the
 * response has been written when {@code handle} returns, the chain stops and
 * calling this interface is not necessary. Otherwise, it is important that
 * the handler eventually interacts with the chain. The engine has no timeout.
 * Failure to do so will hang the dispatch until the adapter gives up.<p>
 * 
 * The chain object given to an {@link ErrorHandler} is inert. All its methods
 * are NOP.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Chain
{
    /**
     * Proceed with calling the next handler if there is one.<p>
     * 
     * After the last middleware, the next handler is the first handler of the
     * matched route. If no route matches, or all handlers of the route have
     * proceeded, the dispatch completes, and unless someone wrote the response
     * the client receives "404 Not Found".<p>
     * 
     * The returned stage completes when the remainder of the chain has
     * completed, and the response is final. The stage never completes
     * exceptionally. This may be used to observe the outcome of downstream
     * handlers:
     * 
     * <pre>{@code
     *   app.use((req, res, chain) -> {
     *       long start = System.nanoTime();
     *       chain.proceed().thenRun(() ->
     *           LOG.log(INFO, req.path() + " took " + (System.nanoTime() - start)));
     *   });
     * }</pre>
     * 
     * Blocking on the returned stage from within the handler will deadlock
     * the dispatch, as the chain does not advance until the handler returns.
     * 
     * @return a stage that completes when the dispatch has completed
     */
    CompletionStage<Void> proceed();
    
    /**
     * Abandon the normal chain and enter error handling.<p>
     * 
     * Registered {@link ErrorHandler}s whose prefix filter matches the request
     * path are called in the order they were registered, until one of them
     * writes the response. If none does, the client receives "500 Internal
     * Server Error". The normal chain never resumes.
     * 
     * @param error the error (not {@code null})
     * 
     * @throws NullPointerException if {@code error} is {@code null}
     */
    void fail(Throwable error);
    
    /**
     * Mark the current handler invocation as complete and do not continue the
     * call chain.<p>
     * 
     * An aborting handler should normally have written the response first.
     * If it didn't, the client receives "404 Not Found".
     */
    void abort();
}
